package com.apexframe.core.isolation;

import com.apexframe.api.action.ActionResult;
import com.apexframe.api.action.ChunkSource;
import com.apexframe.api.exception.ActionExecutionException;
import com.apexframe.api.exception.ErrorKind;
import com.apexframe.api.exception.PermissionDeniedException;
import com.apexframe.api.exception.ResourceLimitExceededException;
import com.apexframe.api.exception.ResourceLimitExceededException.LimitType;
import com.apexframe.api.exception.StreamConsumptionException;
import com.apexframe.core.security.ResourceLimitProfile;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * 子进程动作执行器（不受信任扩展）
 * <p>
 * 每次调用（每个流）启动一个隔离 JVM，在其中重建扩展并执行动作。
 * 值结果返回后立即结束进程；流结果在流关闭时结束进程。
 * </p>
 */
@Slf4j
public class ProcessActionExecutor implements ActionExecutor {

    private final String extensionId;
    private final WorkerLauncher launcher;
    private final ResourceLimitProfile limits;
    private final Consumer<WorkerMessage> eventSink;
    private final Set<WorkerProcess> workers = ConcurrentHashMap.newKeySet();

    public ProcessActionExecutor(String extensionId, WorkerLauncher launcher, ResourceLimitProfile limits,
                                 Consumer<WorkerMessage> eventSink) {
        this.extensionId = extensionId;
        this.launcher = launcher;
        this.limits = limits;
        this.eventSink = eventSink;
    }

    @Override
    public ActionResult execute(String action, Map<String, Object> input) {
        WorkerProcess worker = launcher.launch(extensionId, limits, eventSink);
        workers.add(worker);
        boolean keep = false;
        try {
            WorkerMessage reply = worker.request(WorkerMessage.invoke(action, input), limits, action);
            if (reply.is(WorkerMessage.VALUE)) {
                return ActionResult.value(reply.value());
            }
            if (reply.is(WorkerMessage.STREAM)) {
                keep = true;
                return ActionResult.stream(new RemoteChunkSource(action, worker));
            }
            throw failure(action, reply);
        } finally {
            if (!keep) {
                retire(worker);
            }
        }
    }

    @Override
    public String mode() {
        return "process";
    }

    @Override
    public void close() {
        for (WorkerProcess worker : List.copyOf(workers)) {
            worker.destroy();
        }
        workers.clear();
    }

    private void retire(WorkerProcess worker) {
        workers.remove(worker);
        worker.close();
    }

    /**
     * 把隔离进程的 error 应答还原为对应的异常类型
     */
    RuntimeException failure(String action, WorkerMessage reply) {
        if (!reply.is(WorkerMessage.ERROR)) {
            return new ActionExecutionException("Unexpected worker reply '" + reply.type() + "' to " + action);
        }
        String message = reply.message() == null ? "no message" : reply.message();
        ErrorKind kind;
        try {
            kind = reply.errorKind() == null ? ErrorKind.ACTION_FAILED : ErrorKind.valueOf(reply.errorKind());
        } catch (IllegalArgumentException e) {
            kind = ErrorKind.ACTION_FAILED;
        }
        switch (kind) {
            case RESOURCE_LIMIT_EXCEEDED:
                LimitType type = reply.limitType() == null ? LimitType.MEMORY : LimitType.valueOf(reply.limitType());
                return new ResourceLimitExceededException(extensionId, type, message);
            case PERMISSION_DENIED:
                return new PermissionDeniedException(extensionId, Set.of(), message);
            case STREAM_CONSUMPTION:
                return new StreamConsumptionException(message);
            default:
                return new ActionExecutionException("Isolated " + extensionId + "/" + action + " failed: " + message);
        }
    }

    /**
     * 通过 next 请求逐个拉取隔离进程中的分片
     */
    private final class RemoteChunkSource implements ChunkSource<Object> {
        private final String action;
        private final WorkerProcess worker;

        private RemoteChunkSource(String action, WorkerProcess worker) {
            this.action = action;
            this.worker = worker;
        }

        @Override
        public Optional<Object> pull() {
            WorkerMessage reply = worker.request(WorkerMessage.of(WorkerMessage.NEXT), limits, action);
            if (reply.is(WorkerMessage.CHUNK)) {
                return Optional.ofNullable(reply.value());
            }
            if (reply.is(WorkerMessage.END)) {
                return Optional.empty();
            }
            throw failure(action, reply);
        }

        @Override
        public void close() {
            if (worker.isAlive()) {
                try {
                    worker.send(WorkerMessage.of(WorkerMessage.CANCEL));
                } catch (ActionExecutionException e) {
                    log.debug("[{}] Worker already gone while cancelling '{}'", extensionId, action);
                }
            }
            retire(worker);
        }
    }
}
