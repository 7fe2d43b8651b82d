package com.apexframe.api.event;

import org.jspecify.annotations.Nullable;

import java.util.Map;

/**
 * 扩展侧事件通道
 * <p>
 * 订阅者按优先级从高到低调用，可按事件源过滤。事件类型 {@code "*"} 匹配全部事件。
 * </p>
 *
 * @author ApexFrame
 */
public interface EventChannel {

    /** 默认订阅优先级 */
    int DEFAULT_PRIORITY = 0;

    /**
     * 发布事件，事件源为当前扩展
     *
     * @param type    事件类型
     * @param payload 事件数据
     */
    void publish(String type, Map<String, Object> payload);

    /**
     * 订阅事件
     *
     * @param type         事件类型
     * @param priority     优先级，数值越大越先调用
     * @param sourceFilter 事件源过滤，null 表示不过滤
     * @param listener     监听器
     * @return 订阅句柄
     */
    Subscription subscribe(String type, int priority, @Nullable String sourceFilter, ExtensionEventListener listener);

    default Subscription subscribe(String type, ExtensionEventListener listener) {
        return subscribe(type, DEFAULT_PRIORITY, null, listener);
    }
}
