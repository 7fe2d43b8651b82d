package com.apexframe.core.event;

import com.apexframe.api.event.ExtensionEvent;
import com.apexframe.api.event.ExtensionEventListener;
import com.apexframe.api.event.Subscription;
import lombok.extern.slf4j.Slf4j;
import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 事件总线
 * <p>
 * 按事件类型字符串订阅，"*" 订阅全部类型。高优先级先执行，同优先级按注册顺序。
 * 监听器异常只记录日志，不影响其余监听器。
 * </p>
 */
@Slf4j
public class EventBus {

    public static final String WILDCARD = "*";

    private static final Comparator<Registration> DELIVERY_ORDER =
            Comparator.comparingInt(Registration::priority).reversed()
                    .thenComparingLong(Registration::sequence);

    private final Map<String, List<Registration>> listeners = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    /**
     * @param owner 订阅方（扩展 ID 或 host），用于批量退订
     */
    public Subscription subscribe(String type, int priority, @Nullable String sourceFilter,
                                  String owner, ExtensionEventListener listener) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(listener, "listener");
        Registration registration = new Registration(type, priority, sourceFilter, owner, listener,
                sequence.incrementAndGet());
        listeners.computeIfAbsent(type, k -> new CopyOnWriteArrayList<>()).add(registration);
        return () -> remove(registration);
    }

    public void publish(ExtensionEvent event) {
        List<Registration> targets = new ArrayList<>(listeners.getOrDefault(event.getType(), List.of()));
        if (!WILDCARD.equals(event.getType())) {
            targets.addAll(listeners.getOrDefault(WILDCARD, List.of()));
        }
        if (targets.isEmpty()) {
            return;
        }
        targets.sort(DELIVERY_ORDER);
        for (Registration registration : targets) {
            if (registration.sourceFilter() != null && !registration.sourceFilter().equals(event.getSource())) {
                continue;
            }
            try {
                registration.listener().onEvent(event);
            } catch (Exception e) {
                log.error("[{}] Event listener failed on {} from {}",
                        registration.owner(), event.getType(), event.getSource(), e);
            }
        }
    }

    /**
     * 移除某订阅方的全部订阅
     *
     * @return 移除数量
     */
    public int unsubscribeAll(String owner) {
        int removed = 0;
        for (List<Registration> registrations : listeners.values()) {
            List<Registration> owned = registrations.stream()
                    .filter(r -> r.owner().equals(owner))
                    .toList();
            registrations.removeAll(owned);
            removed += owned.size();
        }
        if (removed > 0) {
            log.debug("[{}] Removed {} event subscriptions", owner, removed);
        }
        return removed;
    }

    public int subscriberCount(String type) {
        return listeners.getOrDefault(type, List.of()).size();
    }

    private void remove(Registration registration) {
        List<Registration> registrations = listeners.get(registration.type());
        if (registrations != null) {
            registrations.remove(registration);
        }
    }

    private record Registration(String type, int priority, @Nullable String sourceFilter,
                                String owner, ExtensionEventListener listener, long sequence) {
    }
}
