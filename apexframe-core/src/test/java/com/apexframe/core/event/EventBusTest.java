package com.apexframe.core.event;

import com.apexframe.api.event.ExtensionEvent;
import com.apexframe.api.event.Subscription;
import com.apexframe.api.exception.PermissionDeniedException;
import com.apexframe.api.security.Permissions;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("事件总线")
class EventBusTest {

    private final EventBus bus = new EventBus();

    private static ExtensionEvent event(String type, String source) {
        return new ExtensionEvent(type, source, Map.of());
    }

    @Nested
    @DisplayName("投递顺序与过滤")
    class DeliveryTests {

        @Test
        @DisplayName("高优先级先执行，同优先级按订阅顺序")
        void priorityOrder() {
            List<String> calls = new ArrayList<>();
            bus.subscribe("t", 0, null, "o", e -> calls.add("low-1"));
            bus.subscribe("t", 10, null, "o", e -> calls.add("high"));
            bus.subscribe("t", 0, null, "o", e -> calls.add("low-2"));
            bus.subscribe(EventBus.WILDCARD, 5, null, "o", e -> calls.add("wildcard"));

            bus.publish(event("t", "src"));

            assertEquals(List.of("high", "wildcard", "low-1", "low-2"), calls);
        }

        @Test
        @DisplayName("来源过滤只接收指定来源")
        void sourceFilter() {
            List<String> sources = new ArrayList<>();
            bus.subscribe("t", 0, "a", "o", e -> sources.add(e.getSource()));

            bus.publish(event("t", "a"));
            bus.publish(event("t", "b"));

            assertEquals(List.of("a"), sources);
        }

        @Test
        @DisplayName("监听器异常不影响其余监听器")
        void listenerFailureIsolated() {
            List<String> calls = new ArrayList<>();
            bus.subscribe("t", 10, null, "o", e -> {
                throw new IllegalStateException("boom");
            });
            bus.subscribe("t", 0, null, "o", e -> calls.add("after"));

            assertDoesNotThrow(() -> bus.publish(event("t", "s")));
            assertEquals(List.of("after"), calls);
        }
    }

    @Nested
    @DisplayName("退订")
    class UnsubscribeTests {

        @Test
        @DisplayName("单个退订与按订阅方批量退订")
        void unsubscribe() {
            Subscription s = bus.subscribe("t", 0, null, "a", e -> { });
            bus.subscribe("t", 0, null, "b", e -> { });
            bus.subscribe("u", 0, null, "b", e -> { });

            s.unsubscribe();
            assertEquals(1, bus.subscriberCount("t"));
            assertEquals(2, bus.unsubscribeAll("b"));
            assertEquals(0, bus.subscriberCount("t"));
            assertEquals(0, bus.subscriberCount("u"));
        }
    }

    @Nested
    @DisplayName("扩展事件通道权限")
    class ScopedChannelTests {

        @Test
        @DisplayName("缺少 event.emit / event.subscribe 时拒绝")
        void requiresPermissions() {
            Set<String> granted = new HashSet<>();
            ScopedEventChannel channel = new ScopedEventChannel("ext", bus, () -> granted);

            assertThrows(PermissionDeniedException.class, () -> channel.publish("t", Map.of()));
            assertThrows(PermissionDeniedException.class, () -> channel.subscribe("t", e -> { }));

            granted.add(Permissions.EVENT_EMIT);
            granted.add(Permissions.EVENT_SUBSCRIBE);
            List<ExtensionEvent> received = new ArrayList<>();
            channel.subscribe("t", received::add);
            channel.publish("t", Map.of("k", "v"));

            assertEquals(1, received.size());
            assertEquals("ext", received.get(0).getSource());
            assertEquals("v", received.get(0).getPayload().get("k"));
        }

        @Test
        @DisplayName("关闭通道移除该扩展的全部订阅")
        void closeRemovesSubscriptions() {
            ScopedEventChannel channel = new ScopedEventChannel("ext", bus,
                    () -> Set.of(Permissions.EVENT_SUBSCRIBE));
            channel.subscribe("t", e -> { });
            channel.subscribe("u", e -> { });

            assertEquals(2, channel.close());
            assertEquals(0, bus.subscriberCount("t"));
        }
    }
}
