package com.apexframe.api.action;

import java.util.Arrays;
import java.util.Iterator;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link ChunkSource} 的常用构造方法
 */
public final class ChunkSources {

    private ChunkSources() {
    }

    @SafeVarargs
    public static <T> ChunkSource<T> of(T... chunks) {
        return fromIterator(Arrays.asList(chunks).iterator());
    }

    public static <T> ChunkSource<T> fromIterator(Iterator<? extends T> iterator) {
        return fromIterator(iterator, () -> {
        });
    }

    /**
     * @param onClose 关闭时执行的清理动作
     */
    public static <T> ChunkSource<T> fromIterator(Iterator<? extends T> iterator, Runnable onClose) {
        Objects.requireNonNull(iterator, "iterator");
        Objects.requireNonNull(onClose, "onClose");
        return new ChunkSource<>() {
            @Override
            public Optional<T> pull() {
                return iterator.hasNext() ? Optional.of(iterator.next()) : Optional.empty();
            }

            @Override
            public void close() {
                onClose.run();
            }
        };
    }
}
