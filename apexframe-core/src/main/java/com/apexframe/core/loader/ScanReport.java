package com.apexframe.core.loader;

import com.apexframe.api.exception.LoadException;
import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 字节码扫描结果
 *
 * @param forbidden           终止 JVM 的调用，存在即拒绝加载
 * @param findings            需要权限的调用
 * @param requiredPermissions 由 findings 推导出的权限集合
 */
public record ScanReport(List<Finding> forbidden, List<Finding> findings, Set<String> requiredPermissions) {

    public ScanReport {
        forbidden = List.copyOf(forbidden);
        findings = List.copyOf(findings);
        requiredPermissions = Set.copyOf(requiredPermissions);
    }

    public static ScanReport empty() {
        return new ScanReport(List.of(), List.of(), Set.of());
    }

    public boolean hasForbiddenCalls() {
        return !forbidden.isEmpty();
    }

    public void throwIfForbidden(String extensionId) {
        if (hasForbiddenCalls()) {
            throw new LoadException("Extension [" + extensionId + "] calls forbidden APIs:\n"
                    + forbidden.stream().map(Finding::toString).collect(Collectors.joining("\n")));
        }
    }

    /**
     * 单条扫描发现
     *
     * @param permission 该调用要求的权限，禁止调用为 null
     */
    public record Finding(String className, String apiCall, @Nullable String permission) {

        @Override
        public String toString() {
            return permission == null
                    ? String.format("%s in %s", apiCall, className)
                    : String.format("%s in %s requires '%s'", apiCall, className, permission);
        }
    }
}
