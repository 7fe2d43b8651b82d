package com.apexframe.core.isolation;

import com.apexframe.api.exception.ActionExecutionException;
import com.apexframe.api.exception.ResourceLimitExceededException;
import com.apexframe.api.exception.ResourceLimitExceededException.LimitType;
import com.apexframe.core.security.ResourceLimitProfile;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.jspecify.annotations.Nullable;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * 宿主侧的隔离进程句柄
 * <p>
 * 标准输出承载协议，标准错误转入宿主日志。每个请求都在看门狗下等待应答：
 * 墙钟超时或累计 CPU 超限时强制结束进程。
 * </p>
 */
@Slf4j
class WorkerProcess implements AutoCloseable {

    /**
     * -XX:+ExitOnOutOfMemoryError 的退出码
     */
    static final int OUT_OF_MEMORY_EXIT = 3;

    @Getter
    private final String extensionId;
    private final Process process;
    private final BufferedWriter stdin;
    private final BlockingQueue<WorkerMessage> replies = new LinkedBlockingQueue<>();
    private final Duration pollInterval;
    private volatile long cpuBaselineNanos;

    private WorkerProcess(String extensionId, Process process, Duration pollInterval) {
        this.extensionId = extensionId;
        this.process = process;
        this.pollInterval = pollInterval;
        this.stdin = new BufferedWriter(new OutputStreamWriter(process.getOutputStream(), StandardCharsets.UTF_8));
    }

    /**
     * 启动隔离进程并等待 ready
     *
     * @param eventSink 接收隔离进程推送的事件
     */
    static WorkerProcess launch(String extensionId, List<String> command, Duration startupTimeout,
                                Duration pollInterval, Consumer<WorkerMessage> eventSink) {
        Process process;
        try {
            process = new ProcessBuilder(command).start();
        } catch (IOException e) {
            throw new ActionExecutionException("Failed to launch isolated worker for [" + extensionId + "]", e);
        }
        WorkerProcess worker = new WorkerProcess(extensionId, process, pollInterval);
        worker.startPumps(eventSink);

        WorkerMessage ready = worker.await(startupTimeout, null, "startup");
        if (!ready.is(WorkerMessage.READY)) {
            worker.destroy();
            throw new ActionExecutionException("Isolated worker for [" + extensionId + "] failed to start: "
                    + ready.message());
        }
        worker.cpuBaselineNanos = worker.cpuNanos();
        log.debug("[{}] Isolated worker pid {} ready", extensionId, process.pid());
        return worker;
    }

    /**
     * 发送请求并在资源上限内等待应答
     */
    WorkerMessage request(WorkerMessage request, ResourceLimitProfile limits, String action) {
        send(request);
        return await(limits.getTimeout(), limits, action);
    }

    void send(WorkerMessage message) {
        try {
            synchronized (stdin) {
                stdin.write(message.toLine());
                stdin.newLine();
                stdin.flush();
            }
        } catch (IOException e) {
            throw new ActionExecutionException("Isolated worker for [" + extensionId + "] is not accepting requests", e);
        }
    }

    private WorkerMessage await(Duration timeout, @Nullable ResourceLimitProfile limits, String action) {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            WorkerMessage reply;
            try {
                reply = replies.poll(pollInterval.toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                destroy();
                throw new ActionExecutionException("Interrupted while waiting for " + extensionId + "/" + action, e);
            }
            if (reply != null) {
                if (reply.is(WorkerMessage.EXITED)) {
                    throw exited(action);
                }
                return reply;
            }
            if (System.nanoTime() > deadline) {
                destroy();
                throw new ResourceLimitExceededException(extensionId, LimitType.WALL_CLOCK,
                        "Isolated " + extensionId + "/" + action + " exceeded " + timeout.toMillis() + "ms");
            }
            if (limits != null && limits.limitsCpu()) {
                long used = cpuNanos() - cpuBaselineNanos;
                if (used > limits.getCpuTime().toNanos()) {
                    destroy();
                    throw new ResourceLimitExceededException(extensionId, LimitType.CPU_TIME,
                            "Isolated " + extensionId + "/" + action + " used " + TimeUnit.NANOSECONDS.toMillis(used)
                                    + "ms CPU, limit " + limits.getCpuTime().toMillis() + "ms");
                }
            }
        }
    }

    private RuntimeException exited(String action) {
        int code;
        try {
            process.waitFor(1, TimeUnit.SECONDS);
            code = process.isAlive() ? -1 : process.exitValue();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            code = -1;
        }
        if (code == OUT_OF_MEMORY_EXIT) {
            return new ResourceLimitExceededException(extensionId, LimitType.MEMORY,
                    "Isolated " + extensionId + "/" + action + " ran out of memory");
        }
        return new ActionExecutionException("Isolated worker for [" + extensionId + "] exited with code " + code
                + " during " + action);
    }

    private long cpuNanos() {
        return process.toHandle().info().totalCpuDuration().map(Duration::toNanos).orElse(0L);
    }

    private void startPumps(Consumer<WorkerMessage> eventSink) {
        Thread stdout = new Thread(() -> {
            try (BufferedReader reader = new BufferedReader(
                    new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    if (line.isBlank()) {
                        continue;
                    }
                    WorkerMessage message;
                    try {
                        message = WorkerMessage.parse(line);
                    } catch (IllegalArgumentException e) {
                        log.warn("[{}] Ignoring malformed worker output: {}", extensionId, line);
                        continue;
                    }
                    if (message.is(WorkerMessage.EVENT)) {
                        try {
                            eventSink.accept(message);
                        } catch (RuntimeException e) {
                            log.error("[{}] Failed to forward worker event {}", extensionId, message.eventType(), e);
                        }
                    } else {
                        replies.offer(message);
                    }
                }
            } catch (IOException e) {
                log.debug("[{}] Worker stdout closed: {}", extensionId, e.getMessage());
            } finally {
                replies.offer(WorkerMessage.of(WorkerMessage.EXITED));
            }
        }, "apexframe-worker-out-" + extensionId);
        stdout.setDaemon(true);
        stdout.start();

        Thread stderr = new Thread(() -> {
            try (BufferedReader reader = new BufferedReader(
                    new InputStreamReader(process.getErrorStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    log.debug("[{}] worker: {}", extensionId, line);
                }
            } catch (IOException e) {
                log.debug("[{}] Worker stderr closed: {}", extensionId, e.getMessage());
            }
        }, "apexframe-worker-err-" + extensionId);
        stderr.setDaemon(true);
        stderr.start();
    }

    boolean isAlive() {
        return process.isAlive();
    }

    /**
     * 请求正常退出，超时后强制结束
     */
    @Override
    public void close() {
        if (!process.isAlive()) {
            return;
        }
        try {
            send(WorkerMessage.of(WorkerMessage.TERMINATE));
            if (!process.waitFor(2, TimeUnit.SECONDS)) {
                destroy();
            }
        } catch (ActionExecutionException e) {
            destroy();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            destroy();
        }
    }

    void destroy() {
        if (process.isAlive()) {
            log.warn("[{}] Destroying isolated worker pid {}", extensionId, process.pid());
            process.destroyForcibly();
        }
    }
}
