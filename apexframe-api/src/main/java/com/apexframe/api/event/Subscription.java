package com.apexframe.api.event;

/**
 * 订阅句柄（用于取消订阅）
 */
@FunctionalInterface
public interface Subscription {
    void unsubscribe();
}
