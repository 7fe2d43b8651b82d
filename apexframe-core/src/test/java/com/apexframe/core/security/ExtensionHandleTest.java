package com.apexframe.core.security;

import com.apexframe.api.action.ChunkStream;
import com.apexframe.api.action.InvocationResult;
import com.apexframe.api.event.ExtensionEvent;
import com.apexframe.api.event.LifecycleEvents;
import com.apexframe.api.exception.ActionExecutionException;
import com.apexframe.api.exception.ActionInputException;
import com.apexframe.api.exception.PluginStateException;
import com.apexframe.api.exception.ResourceLimitExceededException;
import com.apexframe.api.exception.ResourceLimitExceededException.LimitType;
import com.apexframe.api.exception.StreamConsumptionException;
import com.apexframe.core.ExtensionRuntime;
import com.apexframe.core.config.ApexFrameConfig;
import com.apexframe.core.fixture.BurnerExtension;
import com.apexframe.core.fixture.EchoExtension;
import com.apexframe.core.fixture.StreamingExtension;
import com.apexframe.core.registry.LifecycleState;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static com.apexframe.core.fixture.ExtensionFixtures.extension;
import static com.apexframe.core.fixture.ExtensionFixtures.manifest;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("扩展调用与资源上限（进程内）")
class ExtensionHandleTest {

    @TempDir
    Path tempDir;

    private ExtensionRuntime runtime;
    private final List<ExtensionEvent> violations = new CopyOnWriteArrayList<>();

    @AfterEach
    void tearDown() {
        if (runtime != null) {
            runtime.shutdown();
        }
    }

    private ExtensionRuntime start(ResourceLimitProfile limits, String id, Class<?> entry, String... extra) {
        ApexFrameConfig config = ApexFrameConfig.builder()
                .stateDir(tempDir.resolve("state"))
                .processIsolationEnabled(false)
                .concurrencyAcquireTimeout(Duration.ofMillis(100))
                .build();
        runtime = new ExtensionRuntime(config, HostPolicy.allowAll(true, limits));
        runtime.init();
        runtime.getEventBus().subscribe(LifecycleEvents.RESOURCE_VIOLATION, 0, null, "test", violations::add);
        runtime.registerDirectory(extension(tempDir, id, manifest(id, "1.0.0", entry, extra)));
        runtime.initialize(id);
        runtime.start(id);
        return runtime;
    }

    private ExtensionRuntime start(String id, Class<?> entry, String... extra) {
        return start(ResourceLimitProfile.defaults(), id, entry, extra);
    }

    @Nested
    @DisplayName("调用契约")
    class ContractTests {

        @Test
        @DisplayName("未声明的动作被拒绝")
        void undeclaredAction() {
            start("echo", EchoExtension.class, "actions:", "  - name: echo");

            ActionInputException e = assertThrows(ActionInputException.class,
                    () -> runtime.handle("echo").call("greet", Map.of()));
            assertTrue(e.getMessage().contains("not declared"));
        }

        @Test
        @DisplayName("输入不符合 input_schema 时不调用扩展")
        void schemaValidation() {
            start("echo", EchoExtension.class,
                    "properties:", "  greeting: hello",
                    "actions:",
                    "  - name: greet",
                    "    input_schema:",
                    "      type: object",
                    "      required: [name]",
                    "      properties:",
                    "        name: {type: string}");

            ActionInputException e = assertThrows(ActionInputException.class,
                    () -> runtime.handle("echo").call("greet", Map.of("name", 42)));
            assertTrue(e.getProblems().get(0).startsWith("input.name must be of type string"));

            assertEquals("hello, ada", runtime.handle("echo").call("greet", Map.of("name", "ada")));
        }

        @Test
        @DisplayName("未启动的扩展不接受调用")
        void requiresStarted() {
            start("echo", EchoExtension.class, "actions:", "  - name: echo");
            runtime.stop("echo");

            assertThrows(PluginStateException.class, () -> runtime.handle("echo").call("echo", Map.of()));
        }

        @Test
        @DisplayName("扩展抛出的异常转换为 ActionExecutionException，扩展保持 STARTED")
        void extensionFailure() {
            start("echo", EchoExtension.class, "actions:", "  - name: unknown");

            ActionExecutionException e = assertThrows(ActionExecutionException.class,
                    () -> runtime.handle("echo").call("unknown", Map.of()));
            assertTrue(e.getMessage().contains("Unknown action"));
            assertEquals(LifecycleState.STARTED, runtime.stateOf("echo").orElseThrow());
        }
    }

    @Nested
    @DisplayName("流式动作")
    class StreamTests {

        private static final String[] ACTIONS = {
                "actions:",
                "  - name: numbers",
                "    streams_output: true",
                "  - name: flaky",
                "    streams_output: true",
                "  - name: endless",
                "    streams_output: true",
                "  - name: mislabeled"
        };

        @Test
        @DisplayName("按顺序交付全部分片")
        void deliversInOrder() {
            start("streamer", StreamingExtension.class, ACTIONS);

            InvocationResult result = runtime.invoke("streamer", "numbers", Map.of("count", 4));
            assertTrue(result.isStream());

            List<Object> chunks = new ArrayList<>();
            ((InvocationResult.Stream) result).stream().forEachRemaining(chunks::add);
            assertEquals(List.of(1, 2, 3, 4), chunks);
        }

        @Test
        @DisplayName("生产者失败时已交付的分片保留，下一次拉取抛出 StreamConsumptionException")
        void producerFailure() {
            start("streamer", StreamingExtension.class, ACTIONS);
            ChunkStream<Object> stream = runtime.handle("streamer").stream("flaky", Map.of());

            List<Object> chunks = new ArrayList<>();
            StreamConsumptionException e = assertThrows(StreamConsumptionException.class,
                    () -> stream.forEachRemaining(chunks::add));

            assertEquals(5, chunks.size());
            assertEquals(5, stream.deliveredCount());
            assertTrue(e.getMessage().contains("after 5 chunks"));
        }

        @Test
        @DisplayName("流式与非流式调用方式不匹配时拒绝")
        void wrongCallStyle() {
            start("streamer", StreamingExtension.class, ACTIONS);

            assertThrows(ActionInputException.class, () -> runtime.handle("streamer").call("numbers", Map.of()));
            assertThrows(ActionExecutionException.class,
                    () -> runtime.handle("streamer").call("mislabeled", Map.of()));
        }

        @Test
        @DisplayName("停止扩展会取消未消费完的流")
        void stopCancelsStreams() {
            start("streamer", StreamingExtension.class, ACTIONS);
            int closedBefore = StreamingExtension.CLOSED.get();
            ChunkStream<Object> stream = runtime.handle("streamer").stream("endless", Map.of());
            assertEquals("chunk-1", stream.next());

            runtime.stop("streamer");

            assertTrue(stream.isCancelled());
            assertFalse(stream.hasNext());
            assertEquals(closedBefore + 1, StreamingExtension.CLOSED.get());
        }
    }

    @Nested
    @DisplayName("资源上限")
    class LimitTests {

        private static final String[] ACTIONS = {
                "actions:",
                "  - name: spin",
                "  - name: sleep",
                "  - name: alloc",
                "  - name: quick"
        };

        private void assertViolation(LimitType expected, String action, Map<String, Object> input) {
            ResourceLimitExceededException e = assertThrows(ResourceLimitExceededException.class,
                    () -> runtime.handle("burner").call(action, input));
            assertEquals(expected, e.getLimitType());
            assertEquals("burner", e.getExtensionId());

            // 超限只终止本次调用
            assertEquals(LifecycleState.STARTED, runtime.stateOf("burner").orElseThrow());
            assertEquals("done", runtime.handle("burner").call("quick", Map.of()));
            assertEquals(1, runtime.getViolationTracker().count("burner"));
            assertEquals(expected.name(), violations.get(0).getPayload().get("limit_type"));
        }

        @Test
        @DisplayName("墙钟超时")
        void wallClock() {
            start(ResourceLimitProfile.builder().timeout(Duration.ofMillis(300)).build(),
                    "burner", BurnerExtension.class, ACTIONS);

            assertViolation(LimitType.WALL_CLOCK, "sleep", Map.of("millis", 60_000));
        }

        @Test
        @DisplayName("CPU 时间上限")
        void cpuTime() {
            start(ResourceLimitProfile.builder().cpuTime(Duration.ofMillis(200)).build(),
                    "burner", BurnerExtension.class, ACTIONS);

            assertViolation(LimitType.CPU_TIME, "spin", Map.of());
        }

        @Test
        @DisplayName("分配字节上限")
        void memory() {
            start(ResourceLimitProfile.builder().memoryBytes(16L * 1024 * 1024).build(),
                    "burner", BurnerExtension.class, ACTIONS);

            assertViolation(LimitType.MEMORY, "alloc", Map.of());
        }

        @Test
        @DisplayName("输出大小上限")
        void outputSize() {
            start(ResourceLimitProfile.builder().maxOutputBytes(1000).build(),
                    "burner", EchoExtension.class, "actions:", "  - name: big", "  - name: quick");

            ResourceLimitExceededException e = assertThrows(ResourceLimitExceededException.class,
                    () -> runtime.handle("burner").call("big", Map.of("size", 5000)));
            assertEquals(LimitType.OUTPUT_SIZE, e.getLimitType());
            assertEquals(200, ((String) runtime.handle("burner").call("big", Map.of("size", 200))).length());
        }

        @Test
        @DisplayName("流的累计输出超限时终止流")
        void streamOutputSize() {
            start(ResourceLimitProfile.builder().maxOutputBytes(20).build(),
                    "burner", StreamingExtension.class, "actions:", "  - name: numbers", "    streams_output: true");
            ChunkStream<Object> stream = runtime.handle("burner").stream("numbers", Map.of("count", 100));

            List<Object> chunks = new ArrayList<>();
            ResourceLimitExceededException e = assertThrows(ResourceLimitExceededException.class,
                    () -> stream.forEachRemaining(chunks::add));

            assertEquals(LimitType.OUTPUT_SIZE, e.getLimitType());
            assertFalse(chunks.isEmpty());
            assertTrue(chunks.size() < 20);
        }

        @Test
        @DisplayName("并发上限：开放的流占用许可")
        void concurrency() {
            start(ResourceLimitProfile.builder().maxConcurrency(1).build(),
                    "burner", StreamingExtension.class, "actions:", "  - name: numbers", "    streams_output: true");
            ChunkStream<Object> held = runtime.handle("burner").stream("numbers", Map.of("count", 3));

            ResourceLimitExceededException e = assertThrows(ResourceLimitExceededException.class,
                    () -> runtime.handle("burner").stream("numbers", Map.of()));
            assertEquals(LimitType.CONCURRENCY, e.getLimitType());

            held.cancel();
            ChunkStream<Object> next = runtime.handle("burner").stream("numbers", Map.of("count", 1));
            assertEquals(1, next.next());
            assertFalse(next.hasNext());
        }
    }
}
