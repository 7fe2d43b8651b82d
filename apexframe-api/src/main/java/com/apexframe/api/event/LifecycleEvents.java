package com.apexframe.api.event;

/**
 * 运行时发布的生命周期事件类型
 * <p>
 * 事件源为扩展ID，payload 包含 {@code version} 与 {@code state}。
 * </p>
 */
public final class LifecycleEvents {

    public static final String REGISTERED = "extension.registered";
    public static final String INITIALIZED = "extension.initialized";
    public static final String STARTED = "extension.started";
    public static final String STOPPED = "extension.stopped";
    public static final String UNLOADED = "extension.unloaded";
    public static final String ERROR = "extension.error";

    /**
     * 资源超限，payload 包含 {@code limit} 与 {@code count}
     */
    public static final String RESOURCE_VIOLATION = "extension.resource_violation";

    /** 宿主作为事件源时使用的标识 */
    public static final String HOST_SOURCE = "host";

    private LifecycleEvents() {
    }
}
