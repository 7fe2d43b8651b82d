package com.apexframe.api.state;

import org.jspecify.annotations.Nullable;

import java.util.Set;

/**
 * 扩展状态存储
 * <p>
 * 每个扩展只能看到自己的命名空间。单个键的写入是原子的，不提供跨键事务；
 * 需要多键一致性的扩展应把数据编码进同一个键的值里。
 * </p>
 *
 * @author ApexFrame
 */
public interface StateAccess {

    /**
     * 保存状态
     *
     * @param key   不透明的键
     * @param value 可序列化的值
     * @throws com.apexframe.api.exception.PluginStateException 序列化或 I/O 失败
     */
    void save(String key, Object value);

    /**
     * 读取状态
     *
     * @param key          键
     * @param type         值类型
     * @param defaultValue 键不存在时返回的默认值
     * @return 已保存的值，或默认值
     */
    <T> @Nullable T load(String key, Class<T> type, @Nullable T defaultValue);

    /**
     * 删除状态（幂等）
     *
     * @param key 键
     * @return 键之前是否存在
     */
    boolean delete(String key);

    /**
     * 判断键是否存在
     */
    boolean contains(String key);

    /**
     * 列出命名空间内的全部键
     */
    Set<String> keys();
}
