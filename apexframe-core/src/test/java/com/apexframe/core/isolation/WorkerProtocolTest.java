package com.apexframe.core.isolation;

import com.apexframe.api.exception.ActionExecutionException;
import com.apexframe.api.exception.ErrorKind;
import com.apexframe.api.exception.PermissionDeniedException;
import com.apexframe.api.exception.ResourceLimitExceededException;
import com.apexframe.api.exception.ResourceLimitExceededException.LimitType;
import com.apexframe.api.exception.StreamConsumptionException;
import com.apexframe.core.security.ResourceLimitProfile;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.file.Paths;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("隔离进程协议")
class WorkerProtocolTest {

    @Nested
    @DisplayName("消息编码")
    class MessageTests {

        @Test
        @DisplayName("空字段不写入，错误字段使用下划线命名")
        void compactLines() {
            assertEquals("{\"type\":\"next\"}", WorkerMessage.of(WorkerMessage.NEXT).toLine());

            String line = WorkerMessage.error("RESOURCE_LIMIT_EXCEEDED", "MEMORY", "oom").toLine();
            assertTrue(line.contains("\"error_kind\":\"RESOURCE_LIMIT_EXCEEDED\""));
            assertTrue(line.contains("\"limit_type\":\"MEMORY\""));
        }

        @Test
        @DisplayName("解析时忽略未知字段")
        void parsesLeniently() {
            WorkerMessage message = WorkerMessage.parse(
                    "{\"type\":\"invoke\",\"action\":\"echo\",\"input\":{\"n\":1},\"trace\":\"x\"}");

            assertTrue(message.is(WorkerMessage.INVOKE));
            assertEquals("echo", message.action());
            assertEquals(Map.of("n", 1), message.input());
        }

        @Test
        @DisplayName("非 JSON 行被拒绝")
        void rejectsGarbage() {
            assertThrows(IllegalArgumentException.class, () -> WorkerMessage.parse("12:00 INFO started"));
        }
    }

    @Nested
    @DisplayName("错误还原")
    class FailureTests {

        private final ProcessActionExecutor executor = new ProcessActionExecutor("remote", null,
                ResourceLimitProfile.defaults(), message -> {
                });

        @Test
        @DisplayName("按 error_kind 还原异常类型")
        void mapsKinds() {
            RuntimeException limit = executor.failure("a",
                    WorkerMessage.error(ErrorKind.RESOURCE_LIMIT_EXCEEDED.name(), "OUTPUT_SIZE", "too big"));
            assertEquals(LimitType.OUTPUT_SIZE, ((ResourceLimitExceededException) limit).getLimitType());

            assertInstanceOf(PermissionDeniedException.class, executor.failure("a",
                    WorkerMessage.error(ErrorKind.PERMISSION_DENIED.name(), null, "no")));
            assertInstanceOf(StreamConsumptionException.class, executor.failure("a",
                    WorkerMessage.error(ErrorKind.STREAM_CONSUMPTION.name(), null, "no stream")));
        }

        @Test
        @DisplayName("未知类型与非错误应答视为执行失败")
        void unknownKinds() {
            RuntimeException unknown = executor.failure("a", WorkerMessage.error("SOMETHING_NEW", null, "boom"));
            assertInstanceOf(ActionExecutionException.class, unknown);
            assertTrue(unknown.getMessage().contains("boom"));

            assertInstanceOf(ActionExecutionException.class,
                    executor.failure("a", WorkerMessage.of(WorkerMessage.CHUNK)));
        }
    }

    @Test
    @DisplayName("启动命令携带堆上限、classpath 与授权")
    void launchCommand() {
        WorkerLauncher launcher = WorkerLauncher.builder()
                .javaCommand("/opt/jdk/bin/java")
                .jvmOption("-Dfile.encoding=UTF-8")
                .classpath("a.jar:b.jar")
                .manifestFile(Paths.get("/ext/demo/plugin.yml"))
                .extensionDir(Paths.get("/ext/demo"))
                .stateRoot(Paths.get("/state"))
                .grantedPermissions(Set.of("event.emit"))
                .startupTimeout(Duration.ofSeconds(5))
                .pollInterval(Duration.ofMillis(20))
                .build();

        List<String> command = launcher.command(ResourceLimitProfile.builder().memoryBytes(64L * 1024 * 1024).build());

        assertEquals(List.of("/opt/jdk/bin/java", "-Xmx64m", "-XX:+ExitOnOutOfMemoryError", "-Dfile.encoding=UTF-8",
                "-cp", "a.jar:b.jar", IsolatedWorkerMain.class.getName(),
                Paths.get("/ext/demo/plugin.yml").toString(), Paths.get("/ext/demo").toString(),
                Paths.get("/state").toString(), "event.emit"), command);
    }
}
