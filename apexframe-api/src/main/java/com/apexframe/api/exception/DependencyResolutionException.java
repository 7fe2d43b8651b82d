package com.apexframe.api.exception;

import lombok.Getter;

import java.util.List;

/**
 * 依赖关系阻止迁移：start 时依赖范围未被满足，或 stop 时仍有已启动的依赖方
 */
@Getter
public class DependencyResolutionException extends ApexException {

    private final String extensionId;
    private final List<String> unsatisfied;

    public DependencyResolutionException(String extensionId, List<String> unsatisfied) {
        super(ErrorKind.DEPENDENCY_RESOLUTION,
                "Cannot start [" + extensionId + "]: unsatisfied dependencies: " + String.join(", ", unsatisfied));
        this.extensionId = extensionId;
        this.unsatisfied = List.copyOf(unsatisfied);
    }

    private DependencyResolutionException(String extensionId, List<String> unsatisfied, String message) {
        super(ErrorKind.DEPENDENCY_RESOLUTION, message);
        this.extensionId = extensionId;
        this.unsatisfied = List.copyOf(unsatisfied);
    }

    /**
     * stop 被拒绝：列出仍处于 STARTED 的依赖方
     */
    public static DependencyResolutionException dependentsRunning(String extensionId, List<String> dependents) {
        List<String> reasons = dependents.stream().map(d -> "'" + d + "' is started and depends on it").toList();
        return new DependencyResolutionException(extensionId, reasons,
                "Cannot stop [" + extensionId + "]: started dependents: " + String.join(", ", dependents));
    }
}
