package com.apexframe.core.security;

import org.jspecify.annotations.Nullable;

import java.time.Duration;

/**
 * 策略文件中对资源上限的部分覆盖，未给出的字段沿用基准值
 */
public record LimitOverrides(@Nullable Duration cpuTime,
                             @Nullable Long memoryBytes,
                             @Nullable Duration timeout,
                             @Nullable Long maxOutputBytes,
                             @Nullable Integer maxConcurrency) {

    public static LimitOverrides none() {
        return new LimitOverrides(null, null, null, null, null);
    }

    public ResourceLimitProfile applyTo(ResourceLimitProfile base) {
        ResourceLimitProfile.ResourceLimitProfileBuilder builder = base.toBuilder();
        if (cpuTime != null) {
            builder.cpuTime(cpuTime);
        }
        if (memoryBytes != null) {
            builder.memoryBytes(memoryBytes);
        }
        if (timeout != null) {
            builder.timeout(timeout);
        }
        if (maxOutputBytes != null) {
            builder.maxOutputBytes(maxOutputBytes);
        }
        if (maxConcurrency != null) {
            builder.maxConcurrency(maxConcurrency);
        }
        return builder.build();
    }
}
