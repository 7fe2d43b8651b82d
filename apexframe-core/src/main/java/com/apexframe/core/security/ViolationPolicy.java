package com.apexframe.core.security;

import lombok.extern.slf4j.Slf4j;

/**
 * 资源超限的宿主处理策略（如多次超限后卸载扩展）
 */
@FunctionalInterface
public interface ViolationPolicy {

    /**
     * @param count 该扩展累计的超限次数（含本次）
     */
    void onViolation(ResourceViolation violation, int count);

    /**
     * 默认策略：只记录日志
     */
    static ViolationPolicy logOnly() {
        return LogOnly.INSTANCE;
    }

    @Slf4j
    final class LogOnly implements ViolationPolicy {
        private static final LogOnly INSTANCE = new LogOnly();

        private LogOnly() {
        }

        @Override
        public void onViolation(ResourceViolation violation, int count) {
            log.warn("[{}] Resource violation #{} on action '{}': {} ({})", violation.extensionId(), count,
                    violation.action(), violation.limitType(), violation.message());
        }
    }
}
