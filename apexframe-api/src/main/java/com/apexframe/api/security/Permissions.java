package com.apexframe.api.security;

/**
 * 统一权限令牌常量
 * <p>
 * 扩展在清单 {@code declared_permissions} 中声明，宿主策略决定是否授予。
 * 令牌是开放集合，这里只列出运行时本身会检查的部分。
 * </p>
 */
public final class Permissions {

    // ==================== 事件 ====================
    /**
     * 向事件总线发布事件
     */
    public static final String EVENT_EMIT = "event.emit";

    /**
     * 订阅事件总线
     */
    public static final String EVENT_SUBSCRIBE = "event.subscribe";

    // ==================== 文件 ====================
    public static final String FILE_READ = "file.read";
    public static final String FILE_WRITE = "file.write";

    // ==================== 网络 ====================
    /**
     * 出站网络连接
     */
    public static final String NETWORK_CONNECT = "network.connect";

    // ==================== 系统 ====================
    /**
     * 启动外部进程
     */
    public static final String SYSTEM_EXECUTE = "system.execute";

    private Permissions() {
        // 防止实例化
    }
}
