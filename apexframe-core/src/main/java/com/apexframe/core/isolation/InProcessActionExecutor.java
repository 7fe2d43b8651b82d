package com.apexframe.core.isolation;

import com.apexframe.api.action.ActionResult;
import com.apexframe.api.action.ChunkSource;
import com.apexframe.api.exception.ActionExecutionException;
import com.apexframe.api.exception.ApexException;
import com.apexframe.api.exception.ResourceLimitExceededException;
import com.apexframe.api.exception.ResourceLimitExceededException.LimitType;
import com.apexframe.api.extension.ApexExtension;
import com.apexframe.core.security.ResourceLimitProfile;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 宿主进程内的动作执行器（受信任扩展）
 * 职责：线程隔离、墙钟超时、CPU 与分配上限
 * <p>
 * 超限时中断工作线程并立即向调用方抛出异常；不响应中断的扩展代码会继续占用线程直至自行结束。
 * </p>
 */
@Slf4j
public class InProcessActionExecutor implements ActionExecutor {

    private final String extensionId;
    private final ApexExtension instance;
    private final ClassLoader classLoader;
    private final ResourceLimitProfile limits;
    private final ExecutorService pool;
    private final ResourceWatchdog watchdog;
    private final Set<FutureTask<?>> running = ConcurrentHashMap.newKeySet();

    public InProcessActionExecutor(String extensionId, ApexExtension instance, ClassLoader classLoader,
                                   ResourceLimitProfile limits, ExecutorService pool, ResourceWatchdog watchdog) {
        this.extensionId = extensionId;
        this.instance = instance;
        this.classLoader = classLoader;
        this.limits = limits;
        this.pool = pool;
        this.watchdog = watchdog;
    }

    @Override
    public ActionResult execute(String action, Map<String, Object> input) {
        ExecutionBudget budget = new ExecutionBudget(limits);
        ActionResult result = run(action, budget, () -> instance.dispatch(action, input));
        if (result == null) {
            throw new ActionExecutionException("Extension [" + extensionId + "] action '" + action + "' returned null");
        }
        if (result instanceof ActionResult.Streamed streamed) {
            return ActionResult.stream(new GovernedSource(action, streamed.source(), budget));
        }
        return result;
    }

    @Override
    public String mode() {
        return "in-process";
    }

    @Override
    public void close() {
        for (FutureTask<?> task : running) {
            task.cancel(true);
        }
        running.clear();
    }

    private <T> T run(String action, ExecutionBudget budget, Callable<T> body) {
        ResourceWatchdog.Watch watch = watchdog.watch(extensionId, budget);
        FutureTask<T> task = new FutureTask<>(() -> {
            Thread current = Thread.currentThread();
            ClassLoader previous = current.getContextClassLoader();
            current.setContextClassLoader(classLoader);
            watch.attach();
            try {
                return body.call();
            } finally {
                watch.detach();
                current.setContextClassLoader(previous);
            }
        });
        watch.bind(task);
        running.add(task);
        try {
            pool.execute(task);
        } catch (RejectedExecutionException e) {
            running.remove(task);
            watchdog.unwatch(watch);
            throw new ResourceLimitExceededException(extensionId, LimitType.CONCURRENCY,
                    "Action executor is saturated, rejected " + extensionId + "/" + action);
        }

        try {
            return task.get(limits.getTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            task.cancel(true);
            log.error("[{}] Execution timeout ({}ms) on action '{}'", extensionId, limits.getTimeout().toMillis(), action);
            throw new ResourceLimitExceededException(extensionId, LimitType.WALL_CLOCK,
                    "Action " + extensionId + "/" + action + " exceeded " + limits.getTimeout().toMillis() + "ms");
        } catch (CancellationException e) {
            LimitType breached = watch.breached();
            if (breached != null) {
                throw new ResourceLimitExceededException(extensionId, breached,
                        "Action " + extensionId + "/" + action + " exceeded its " + breached + " ceiling");
            }
            throw new ActionExecutionException("Action " + extensionId + "/" + action + " was cancelled", e);
        } catch (ExecutionException e) {
            LimitType breached = watch.breached();
            if (breached != null) {
                throw new ResourceLimitExceededException(extensionId, breached,
                        "Action " + extensionId + "/" + action + " exceeded its " + breached + " ceiling");
            }
            throw translate(action, e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            task.cancel(true);
            throw new ActionExecutionException("Interrupted while waiting for " + extensionId + "/" + action, e);
        } finally {
            running.remove(task);
            watchdog.unwatch(watch);
        }
    }

    private RuntimeException translate(String action, Throwable cause) {
        if (cause instanceof ApexException apex) {
            return apex;
        }
        log.warn("[{}] Action '{}' failed: {}", extensionId, action, cause.toString());
        return new ActionExecutionException("Action " + extensionId + "/" + action + " failed: " + cause, cause);
    }

    /**
     * 每次拉取都在线程池中受同一预算约束
     */
    private final class GovernedSource implements ChunkSource<Object> {
        private final String action;
        private final ChunkSource<?> delegate;
        private final ExecutionBudget budget;

        private GovernedSource(String action, ChunkSource<?> delegate, ExecutionBudget budget) {
            this.action = action;
            this.delegate = delegate;
            this.budget = budget;
        }

        @Override
        public Optional<Object> pull() {
            Optional<?> chunk = run(action, budget, delegate::pull);
            return chunk == null ? Optional.empty() : chunk.map(c -> (Object) c);
        }

        @Override
        public void close() {
            ClassLoader previous = Thread.currentThread().getContextClassLoader();
            Thread.currentThread().setContextClassLoader(classLoader);
            try {
                delegate.close();
            } catch (Exception e) {
                log.warn("[{}] Chunk source of '{}' failed to close", extensionId, action, e);
            } finally {
                Thread.currentThread().setContextClassLoader(previous);
            }
        }
    }
}
