package com.apexframe.core.security;

import lombok.Builder;
import lombok.Value;
import org.jspecify.annotations.Nullable;

import java.time.Duration;

/**
 * 资源上限配置
 * <p>
 * 数值为 0 或 null 的字段表示不限制；timeout 与 maxConcurrency 始终生效。
 * </p>
 */
@Value
@Builder(toBuilder = true)
public class ResourceLimitProfile {

    /**
     * 单次调用（或单个流的累计）CPU 时间上限
     */
    @Builder.Default
    @Nullable Duration cpuTime = Duration.ofSeconds(10);

    /**
     * 内存上限（字节）：进程内按线程分配量计，隔离进程按 -Xmx 计
     */
    @Builder.Default
    long memoryBytes = 256L * 1024 * 1024;

    /**
     * 单次调用（流的单次拉取）墙钟时间上限
     */
    @Builder.Default
    Duration timeout = Duration.ofSeconds(30);

    /**
     * 输出上限（JSON 序列化后字节数），流按累计计算
     */
    @Builder.Default
    long maxOutputBytes = 1024L * 1024;

    /**
     * 同一扩展的并发调用上限
     */
    @Builder.Default
    int maxConcurrency = 8;

    public static ResourceLimitProfile defaults() {
        return ResourceLimitProfile.builder().build();
    }

    public boolean limitsCpu() {
        return cpuTime != null && !cpuTime.isZero() && !cpuTime.isNegative();
    }

    public boolean limitsMemory() {
        return memoryBytes > 0;
    }

    public boolean limitsOutput() {
        return maxOutputBytes > 0;
    }
}
