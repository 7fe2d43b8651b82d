package com.apexframe.core.event;

import com.apexframe.api.event.EventChannel;
import com.apexframe.api.event.ExtensionEvent;
import com.apexframe.api.event.ExtensionEventListener;
import com.apexframe.api.event.Subscription;
import com.apexframe.api.exception.PermissionDeniedException;
import com.apexframe.api.security.Permissions;
import lombok.RequiredArgsConstructor;
import org.jspecify.annotations.Nullable;

import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

/**
 * 单个扩展的事件通道
 * <p>
 * 发布时 source 固定为扩展 ID；发布需要 event.emit，订阅需要 event.subscribe。
 * </p>
 */
@RequiredArgsConstructor
public class ScopedEventChannel implements EventChannel {

    private final String extensionId;
    private final EventBus bus;
    /**
     * 当前激活期的授权集合，initialize 之前为空
     */
    private final Supplier<Set<String>> granted;

    @Override
    public void publish(String type, Map<String, Object> payload) {
        require(Permissions.EVENT_EMIT, "publish " + type);
        bus.publish(new ExtensionEvent(type, extensionId, payload));
    }

    @Override
    public Subscription subscribe(String type, int priority, @Nullable String sourceFilter,
                                  ExtensionEventListener listener) {
        require(Permissions.EVENT_SUBSCRIBE, "subscribe " + type);
        return bus.subscribe(type, priority, sourceFilter, extensionId, listener);
    }

    /**
     * 卸载时移除该扩展的全部订阅
     */
    public int close() {
        return bus.unsubscribeAll(extensionId);
    }

    private void require(String permission, String operation) {
        if (!granted.get().contains(permission)) {
            throw new PermissionDeniedException(extensionId, Set.of(permission),
                    "Extension [" + extensionId + "] lacks '" + permission + "' to " + operation);
        }
    }
}
