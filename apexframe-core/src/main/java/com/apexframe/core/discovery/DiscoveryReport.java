package com.apexframe.core.discovery;

import java.util.ArrayList;
import java.util.List;

/**
 * 一次扫描的结果（均按发现顺序）
 */
public record DiscoveryReport(List<DiscoveredExtension> accepted,
                              List<RejectedExtension> rejected,
                              List<DuplicateIdWarning> duplicates) {

    public DiscoveryReport {
        accepted = List.copyOf(accepted);
        rejected = List.copyOf(rejected);
        duplicates = List.copyOf(duplicates);
    }

    public static DiscoveryReport empty() {
        return new DiscoveryReport(List.of(), List.of(), List.of());
    }

    /**
     * 追加注册阶段发现的重复项，并从 accepted 中移除被忽略的一方
     */
    public DiscoveryReport withRegistryDuplicates(List<DuplicateIdWarning> more) {
        if (more.isEmpty()) {
            return this;
        }
        List<DiscoveredExtension> kept = new ArrayList<>(accepted);
        kept.removeIf(d -> more.stream().anyMatch(w -> w.id().equals(d.id()) && w.ignoredPath().equals(d.directory())));
        List<DuplicateIdWarning> all = new ArrayList<>(duplicates);
        all.addAll(more);
        return new DiscoveryReport(kept, rejected, all);
    }
}
