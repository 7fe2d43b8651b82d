package com.apexframe.api.event;

/**
 * 事件监听器
 *
 * @author ApexFrame
 */
@FunctionalInterface
public interface ExtensionEventListener {

    /**
     * 处理事件
     * @param event 事件对象
     */
    void onEvent(ExtensionEvent event);
}
