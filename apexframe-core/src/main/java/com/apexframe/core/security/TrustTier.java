package com.apexframe.core.security;

import java.util.Set;

/**
 * 信任等级：可授予的权限、资源上限以及是否允许在宿主进程内执行
 *
 * @param permissions 可授予的权限，支持 "*" 与 "prefix.*" 通配
 */
public record TrustTier(String name, Set<String> permissions, LimitOverrides limits, boolean trusted) {

    public TrustTier {
        permissions = Set.copyOf(permissions);
        limits = limits == null ? LimitOverrides.none() : limits;
    }
}
