package com.apexframe.api.action;

import org.jspecify.annotations.Nullable;

/**
 * 调用方拿到的结果：终值或流句柄
 */
public sealed interface InvocationResult {

    boolean isStream();

    /**
     * 同步返回的终值
     */
    record Value(@Nullable Object value) implements InvocationResult {
        @Override
        public boolean isStream() {
            return false;
        }
    }

    /**
     * 立即返回的流句柄
     */
    record Stream(ChunkStream<Object> stream) implements InvocationResult {
        @Override
        public boolean isStream() {
            return true;
        }
    }
}
