package com.apexframe.core.version;

import com.apexframe.core.manifest.DependencySpec;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 依赖解析器
 * <p>
 * 纯函数：给定当前可用的 (id -> version) 与依赖范围列表，逐个给出满足与否。
 * 每个 id 只会注册一个版本，因此不尝试备选版本，复杂度 O(依赖数)。
 * </p>
 */
public final class VersionResolver {

    private VersionResolver() {
    }

    public static List<DependencyCheck> resolve(Map<String, SemanticVersion> available, List<DependencySpec> required) {
        List<DependencyCheck> checks = new ArrayList<>(required.size());
        for (DependencySpec dependency : required) {
            SemanticVersion found = available.get(dependency.pluginId());
            if (found == null) {
                checks.add(new DependencyCheck(dependency, DependencyCheck.Status.MISSING, null));
            } else if (dependency.range().isSatisfiedBy(found)) {
                checks.add(new DependencyCheck(dependency, DependencyCheck.Status.SATISFIED, found));
            } else {
                checks.add(new DependencyCheck(dependency, DependencyCheck.Status.VERSION_MISMATCH, found));
            }
        }
        return checks;
    }

    public static boolean allSatisfied(List<DependencyCheck> checks) {
        return checks.stream().allMatch(DependencyCheck::isSatisfied);
    }
}
