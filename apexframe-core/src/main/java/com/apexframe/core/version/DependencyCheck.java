package com.apexframe.core.version;

import com.apexframe.core.manifest.DependencySpec;
import org.jspecify.annotations.Nullable;

/**
 * 单个依赖的解析结果
 */
public record DependencyCheck(DependencySpec dependency, Status status, @Nullable SemanticVersion foundVersion) {

    public enum Status {
        SATISFIED, MISSING, VERSION_MISMATCH
    }

    public boolean isSatisfied() {
        return status == Status.SATISFIED;
    }

    public String describe() {
        switch (status) {
            case MISSING:
                return dependency.pluginId() + " " + dependency.versionRange() + " (not available)";
            case VERSION_MISMATCH:
                return dependency.pluginId() + " " + dependency.versionRange() + " (found " + foundVersion + ")";
            default:
                return dependency.pluginId() + " " + dependency.versionRange() + " (ok " + foundVersion + ")";
        }
    }
}
