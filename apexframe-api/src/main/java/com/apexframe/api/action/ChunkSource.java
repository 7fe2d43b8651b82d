package com.apexframe.api.action;

import java.util.Optional;

/**
 * 流式动作的生产者
 * <p>
 * 拉取驱动：生产者只在 {@link #pull()} 被调用时产出下一个分片，两次拉取之间处于挂起状态。
 * 返回 {@link Optional#empty()} 表示序列结束。{@link #close()} 在消费完毕、提前取消或超时时被调用一次，
 * 用于释放生产者持有的资源。
 * </p>
 *
 * @param <T> 分片类型
 * @author ApexFrame
 */
@FunctionalInterface
public interface ChunkSource<T> extends AutoCloseable {

    /**
     * 产出下一个分片
     *
     * @return 下一个分片，序列结束时为空
     * @throws Exception 生产失败，已交付的分片仍然有效
     */
    Optional<T> pull() throws Exception;

    @Override
    default void close() {
        // Default empty implementation
    }
}
