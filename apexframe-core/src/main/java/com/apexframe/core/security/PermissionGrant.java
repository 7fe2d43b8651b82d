package com.apexframe.core.security;

import java.util.Set;

/**
 * 单次激活期内的授权结果（initialize 时计算，之后不变）
 *
 * @param permissions 授予的权限，即扩展声明的权限集合
 */
public record PermissionGrant(String extensionId, String tier, Set<String> permissions) {

    public PermissionGrant {
        permissions = Set.copyOf(permissions);
    }

    public boolean has(String permission) {
        return permissions.contains(permission);
    }
}
