package com.apexframe.core.registry;

/**
 * 扩展生命周期状态
 */
public enum LifecycleState {
    REGISTERED,
    INITIALIZED,
    STARTED,
    STOPPED,
    UNLOADED,
    ERROR;

    /**
     * 可作为依赖满足启动检查的状态
     */
    public boolean isActive() {
        return this == INITIALIZED || this == STARTED;
    }
}
