package com.apexframe.core.security;

import com.apexframe.api.event.ExtensionEvent;
import com.apexframe.api.event.LifecycleEvents;
import com.apexframe.api.exception.ResourceLimitExceededException;
import com.apexframe.core.event.EventBus;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 资源超限计数器
 * <p>
 * 统计每个扩展的超限次数，发布 extension.resource_violation 事件，并交给 {@link ViolationPolicy} 处理。
 * </p>
 */
@Slf4j
public class ViolationTracker {

    private final EventBus eventBus;
    private final Map<String, AtomicInteger> counts = new ConcurrentHashMap<>();
    private volatile ViolationPolicy policy;

    public ViolationTracker(EventBus eventBus, ViolationPolicy policy) {
        this.eventBus = eventBus;
        this.policy = policy;
    }

    public void setPolicy(ViolationPolicy policy) {
        this.policy = policy;
    }

    public void record(String action, ResourceLimitExceededException e) {
        ResourceViolation violation = new ResourceViolation(e.getExtensionId(), action, e.getLimitType(),
                e.getMessage(), Instant.now());
        int count = counts.computeIfAbsent(e.getExtensionId(), k -> new AtomicInteger()).incrementAndGet();
        log.warn("[AUDIT] [{}] {} exceeded on '{}': {}", e.getExtensionId(), e.getLimitType(), action, e.getMessage());

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("action", action);
        payload.put("limit_type", e.getLimitType().name());
        payload.put("message", e.getMessage());
        payload.put("count", count);
        eventBus.publish(new ExtensionEvent(LifecycleEvents.RESOURCE_VIOLATION, e.getExtensionId(), payload));

        try {
            policy.onViolation(violation, count);
        } catch (RuntimeException ex) {
            log.error("[{}] Violation policy failed", e.getExtensionId(), ex);
        }
    }

    public int count(String extensionId) {
        AtomicInteger count = counts.get(extensionId);
        return count == null ? 0 : count.get();
    }

    public void reset(String extensionId) {
        counts.remove(extensionId);
    }
}
