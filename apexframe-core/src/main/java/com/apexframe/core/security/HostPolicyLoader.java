package com.apexframe.core.security;

import com.apexframe.core.config.YamlDocument;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * 从 policy.yml 读取宿主策略
 * <pre>
 * default_tier: restricted
 * tiers:
 *   trusted:
 *     trusted: true
 *     permissions: [event.emit, event.subscribe, "file.*"]
 *     limits: {cpu_time: 10s, memory: 512MB, timeout: 30s, max_output: 1MB, max_concurrency: 16}
 *   restricted:
 *     permissions: [event.emit]
 * extensions:
 *   hello-world:
 *     tier: trusted
 *     permissions: [network.connect]
 *     limits: {timeout: 5s}
 * </pre>
 */
@Slf4j
public final class HostPolicyLoader {

    private HostPolicyLoader() {
    }

    /**
     * 文件不存在时返回 {@link HostPolicy#denyAll}
     */
    public static HostPolicy load(Path file, ResourceLimitProfile baseLimits) throws IOException {
        if (file == null || !Files.isRegularFile(file)) {
            log.warn("Host policy file {} not found, every extension falls into a tier without permissions", file);
            return HostPolicy.denyAll(baseLimits);
        }
        try (InputStream in = Files.newInputStream(file)) {
            return load(file.toString(), in, baseLimits);
        }
    }

    public static HostPolicy load(String source, InputStream in, ResourceLimitProfile baseLimits) {
        YamlDocument doc = YamlDocument.parse(source, in);
        HostPolicy.Builder builder = HostPolicy.builder(baseLimits)
                .defaultTier(doc.string("default_tier").orElse(HostPolicy.DEFAULT_TIER));

        Map<String, YamlDocument> tiers = doc.sections("tiers");
        if (!tiers.containsKey(HostPolicy.DEFAULT_TIER) && !doc.has("default_tier")) {
            builder.tier(new TrustTier(HostPolicy.DEFAULT_TIER, Set.of(), LimitOverrides.none(), false));
        }
        tiers.forEach((name, tier) -> builder.tier(new TrustTier(name,
                new LinkedHashSet<>(tier.strings("permissions")),
                limits(tier.section("limits")),
                tier.bool("trusted").orElse(false))));

        doc.sections("extensions").forEach((id, ext) -> builder.override(id, new ExtensionOverride(
                ext.string("tier").orElse(null),
                new LinkedHashSet<>(ext.strings("permissions")),
                limits(ext.section("limits")),
                ext.bool("trusted").orElse(null))));

        HostPolicy policy = builder.build();
        log.info("Host policy loaded from {}: {} tiers, {} extension overrides, default tier '{}'",
                source, policy.getTiers().size(), policy.getOverrides().size(), policy.getDefaultTier());
        return policy;
    }

    static LimitOverrides limits(YamlDocument section) {
        if (section == null) {
            return LimitOverrides.none();
        }
        return new LimitOverrides(
                section.duration("cpu_time").orElse(null),
                section.size("memory").orElse(null),
                section.duration("timeout").orElse(null),
                section.size("max_output").orElse(null),
                section.integer("max_concurrency").orElse(null));
    }
}
