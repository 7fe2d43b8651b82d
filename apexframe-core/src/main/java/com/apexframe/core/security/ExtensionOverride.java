package com.apexframe.core.security;

import org.jspecify.annotations.Nullable;

import java.util.Set;

/**
 * 针对单个扩展的策略覆盖
 *
 * @param tier        使用的信任等级，null 表示默认等级
 * @param permissions 在等级之外额外可授予的权限
 * @param trusted     覆盖等级的 trusted 标志，null 表示沿用
 */
public record ExtensionOverride(@Nullable String tier,
                                Set<String> permissions,
                                LimitOverrides limits,
                                @Nullable Boolean trusted) {

    public ExtensionOverride {
        permissions = Set.copyOf(permissions);
        limits = limits == null ? LimitOverrides.none() : limits;
    }

    public static ExtensionOverride ofTier(String tier) {
        return new ExtensionOverride(tier, Set.of(), LimitOverrides.none(), null);
    }
}
