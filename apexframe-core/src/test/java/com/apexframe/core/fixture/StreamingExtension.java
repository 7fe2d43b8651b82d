package com.apexframe.core.fixture;

import com.apexframe.api.action.ActionResult;
import com.apexframe.api.action.ChunkSource;
import com.apexframe.api.action.ChunkSources;
import com.apexframe.api.extension.ApexExtension;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.IntStream;

/**
 * 测试扩展：流式输出
 */
public class StreamingExtension implements ApexExtension {

    /** 已关闭的生产者数量 */
    public static final AtomicInteger CLOSED = new AtomicInteger();

    @Override
    public ActionResult dispatch(String action, Map<String, Object> input) {
        switch (action) {
            case "numbers": {
                int count = ((Number) input.getOrDefault("count", 3)).intValue();
                return ActionResult.stream(ChunkSources.fromIterator(
                        IntStream.rangeClosed(1, count).boxed().iterator(), CLOSED::incrementAndGet));
            }
            case "flaky":
                return ActionResult.stream(new FailingSource(5));
            case "endless":
                return ActionResult.stream(new FailingSource(Integer.MAX_VALUE));
            case "mislabeled":
                return ActionResult.stream(ChunkSources.of("a"));
            default:
                throw new IllegalArgumentException("Unknown action " + action);
        }
    }

    /**
     * 交付 failAfter 个分片后失败
     */
    static final class FailingSource implements ChunkSource<String> {
        private final int failAfter;
        private int produced;

        FailingSource(int failAfter) {
            this.failAfter = failAfter;
        }

        @Override
        public Optional<String> pull() {
            if (produced >= failAfter) {
                throw new IllegalStateException("source broke after " + produced);
            }
            produced++;
            return Optional.of("chunk-" + produced);
        }

        @Override
        public void close() {
            CLOSED.incrementAndGet();
        }
    }
}
