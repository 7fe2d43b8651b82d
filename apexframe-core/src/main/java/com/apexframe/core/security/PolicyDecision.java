package com.apexframe.core.security;

import java.util.Set;

/**
 * 宿主策略对某个扩展的裁决结果
 *
 * @param grantable 可授予的权限模式（可含通配）
 */
public record PolicyDecision(String extensionId,
                             String tier,
                             Set<String> grantable,
                             ResourceLimitProfile limits,
                             boolean trusted) {

    public PolicyDecision {
        grantable = Set.copyOf(grantable);
    }

    public boolean permits(String permission) {
        for (String pattern : grantable) {
            if (pattern.equals("*") || pattern.equals(permission)) {
                return true;
            }
            if (pattern.endsWith(".*") && permission.startsWith(pattern.substring(0, pattern.length() - 1))) {
                return true;
            }
        }
        return false;
    }
}
