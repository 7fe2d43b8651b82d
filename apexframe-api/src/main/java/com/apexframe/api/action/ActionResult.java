package com.apexframe.api.action;

import org.jspecify.annotations.Nullable;

import java.util.Objects;

/**
 * 扩展动作的返回结果：单个终值，或一个分片生产者
 */
public sealed interface ActionResult {

    static ActionResult value(@Nullable Object value) {
        return new Value(value);
    }

    static ActionResult stream(ChunkSource<?> source) {
        return new Streamed(Objects.requireNonNull(source, "source"));
    }

    /**
     * 终值
     */
    record Value(@Nullable Object value) implements ActionResult {
    }

    /**
     * 流式输出
     */
    record Streamed(ChunkSource<?> source) implements ActionResult {
    }
}
