package com.apexframe.api.action;

import java.util.Iterator;

/**
 * 调用方持有的流句柄
 * <p>
 * 惰性、有限、按拉取推进。调用方必须消费完毕或显式 {@link #cancel()}。
 * 生产者在已交付若干分片后失败时，失败在下一次拉取时以
 * {@link com.apexframe.api.exception.StreamConsumptionException} 抛出，已交付的分片保持有效。
 * </p>
 *
 * @param <T> 分片类型
 */
public interface ChunkStream<T> extends Iterator<T>, AutoCloseable {

    /**
     * 提前取消，释放生产者资源（幂等）
     */
    void cancel();

    boolean isCancelled();

    /**
     * 已交付给调用方的分片数量
     */
    long deliveredCount();

    @Override
    default void close() {
        cancel();
    }
}
