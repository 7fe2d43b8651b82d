package com.apexframe.core.security;

import lombok.Getter;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * 宿主安全策略（不可变）
 * <p>
 * 由信任等级、按扩展 ID 的覆盖和默认等级组成。未知扩展使用默认等级。
 * </p>
 */
@Getter
public class HostPolicy {

    public static final String DEFAULT_TIER = "default";

    private final Map<String, TrustTier> tiers;
    private final Map<String, ExtensionOverride> overrides;
    private final String defaultTier;
    private final ResourceLimitProfile baseLimits;

    public HostPolicy(Map<String, TrustTier> tiers, Map<String, ExtensionOverride> overrides,
                      String defaultTier, ResourceLimitProfile baseLimits) {
        this.tiers = Map.copyOf(tiers);
        this.overrides = Map.copyOf(overrides);
        this.defaultTier = defaultTier;
        this.baseLimits = baseLimits;
        if (!this.tiers.containsKey(defaultTier)) {
            throw new IllegalArgumentException("Default tier '" + defaultTier + "' is not defined");
        }
        for (Map.Entry<String, ExtensionOverride> entry : this.overrides.entrySet()) {
            String tier = entry.getValue().tier();
            if (tier != null && !this.tiers.containsKey(tier)) {
                throw new IllegalArgumentException("Extension '" + entry.getKey()
                        + "' refers to undefined tier '" + tier + "'");
            }
        }
    }

    /**
     * 不授予任何权限、不受信任的策略
     */
    public static HostPolicy denyAll(ResourceLimitProfile baseLimits) {
        TrustTier tier = new TrustTier(DEFAULT_TIER, Set.of(), LimitOverrides.none(), false);
        return new HostPolicy(Map.of(DEFAULT_TIER, tier), Map.of(), DEFAULT_TIER, baseLimits);
    }

    /**
     * 授予全部权限的单一等级策略
     */
    public static HostPolicy allowAll(boolean trusted, ResourceLimitProfile baseLimits) {
        TrustTier tier = new TrustTier(DEFAULT_TIER, Set.of("*"), LimitOverrides.none(), trusted);
        return new HostPolicy(Map.of(DEFAULT_TIER, tier), Map.of(), DEFAULT_TIER, baseLimits);
    }

    public static Builder builder(ResourceLimitProfile baseLimits) {
        return new Builder(baseLimits);
    }

    public PolicyDecision decide(String extensionId) {
        ExtensionOverride override = overrides.get(extensionId);
        String tierName = override != null && override.tier() != null ? override.tier() : defaultTier;
        TrustTier tier = tiers.get(tierName);

        Set<String> grantable = new HashSet<>(tier.permissions());
        ResourceLimitProfile limits = tier.limits().applyTo(baseLimits);
        boolean trusted = tier.trusted();
        if (override != null) {
            grantable.addAll(override.permissions());
            limits = override.limits().applyTo(limits);
            if (override.trusted() != null) {
                trusted = override.trusted();
            }
        }
        return new PolicyDecision(extensionId, tierName, grantable, limits, trusted);
    }

    public static class Builder {
        private final ResourceLimitProfile baseLimits;
        private final Map<String, TrustTier> tiers = new LinkedHashMap<>();
        private final Map<String, ExtensionOverride> overrides = new LinkedHashMap<>();
        private String defaultTier = DEFAULT_TIER;

        private Builder(ResourceLimitProfile baseLimits) {
            this.baseLimits = baseLimits;
        }

        public Builder tier(TrustTier tier) {
            tiers.put(tier.name(), tier);
            return this;
        }

        public Builder override(String extensionId, ExtensionOverride override) {
            overrides.put(extensionId, override);
            return this;
        }

        public Builder defaultTier(String name) {
            this.defaultTier = name;
            return this;
        }

        public HostPolicy build() {
            return new HostPolicy(tiers, overrides, defaultTier, baseLimits);
        }
    }
}
