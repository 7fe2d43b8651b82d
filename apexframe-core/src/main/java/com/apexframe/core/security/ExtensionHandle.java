package com.apexframe.core.security;

import com.apexframe.api.action.ActionResult;
import com.apexframe.api.action.ChunkSource;
import com.apexframe.api.action.ChunkStream;
import com.apexframe.api.action.InvocationResult;
import com.apexframe.api.exception.ActionExecutionException;
import com.apexframe.api.exception.ActionInputException;
import com.apexframe.api.exception.PluginStateException;
import com.apexframe.api.exception.ResourceLimitExceededException;
import com.apexframe.api.exception.ResourceLimitExceededException.LimitType;
import com.apexframe.core.isolation.ActionExecutor;
import com.apexframe.core.manifest.ActionDescriptor;
import com.apexframe.core.manifest.InputSchemaValidator;
import com.apexframe.core.registry.LifecycleState;
import com.apexframe.core.registry.RegistryEntry;
import com.apexframe.core.stream.ManagedChunkStream;
import com.apexframe.core.stream.StreamReaper;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 扩展调用句柄：交给调用方的执行边界
 * <p>
 * 每次调用依次检查：条目处于 STARTED、动作已声明、动作所需权限已授予、输入满足 schema；
 * 然后获取并发许可，交给执行器执行，并计量输出大小。
 * 资源超限只终止本次调用，生命周期状态不变。
 * </p>
 */
@Slf4j
public class ExtensionHandle {

    private final RegistryEntry entry;
    private final ExtensionSecurityManager securityManager;
    private final ViolationTracker violations;
    private final StreamReaper reaper;
    private final Duration streamIdleTimeout;
    private final Duration acquireTimeout;

    public ExtensionHandle(RegistryEntry entry, ExtensionSecurityManager securityManager,
                           ViolationTracker violations, StreamReaper reaper,
                           Duration streamIdleTimeout, Duration acquireTimeout) {
        this.entry = entry;
        this.securityManager = securityManager;
        this.violations = violations;
        this.reaper = reaper;
        this.streamIdleTimeout = streamIdleTimeout;
        this.acquireTimeout = acquireTimeout;
    }

    public String getId() {
        return entry.getId();
    }

    public LifecycleState getState() {
        return entry.getState();
    }

    /**
     * 调用动作，结果类型由动作声明决定
     */
    public InvocationResult invoke(String action, Map<String, Object> input) {
        ActionDescriptor descriptor = prepare(action, input);
        return dispatch(descriptor, input);
    }

    /**
     * 调用非流式动作并同步返回值
     */
    public Object call(String action, Map<String, Object> input) {
        ActionDescriptor descriptor = prepare(action, input);
        if (descriptor.streamsOutput()) {
            throw new ActionInputException(action, List.of("action streams its output, use stream()"));
        }
        return ((InvocationResult.Value) dispatch(descriptor, input)).value();
    }

    /**
     * 调用流式动作，立即返回流句柄
     */
    public ChunkStream<Object> stream(String action, Map<String, Object> input) {
        ActionDescriptor descriptor = prepare(action, input);
        if (!descriptor.streamsOutput()) {
            throw new ActionInputException(action, List.of("action does not stream its output, use call()"));
        }
        return ((InvocationResult.Stream) dispatch(descriptor, input)).stream();
    }

    private ActionDescriptor prepare(String action, Map<String, Object> input) {
        String id = entry.getId();
        LifecycleState state = entry.getState();
        if (state != LifecycleState.STARTED) {
            throw new PluginStateException("Extension [" + id + "] is " + state + ", actions need STARTED");
        }
        ActionDescriptor descriptor = entry.getManifest().findAction(action)
                .orElseThrow(() -> new ActionInputException(action,
                        List.of("action is not declared by extension [" + id + "]")));
        securityManager.checkAction(id, entry.getGrant(), descriptor);
        InputSchemaValidator.validate(descriptor, input == null ? Map.of() : input);
        return descriptor;
    }

    private InvocationResult dispatch(ActionDescriptor descriptor, Map<String, Object> input) {
        String id = entry.getId();
        String action = descriptor.name();
        ActionExecutor executor = entry.getExecutor();
        Semaphore bulkhead = entry.getBulkhead();
        ResourceLimitProfile limits = entry.getLimits();
        if (executor == null || bulkhead == null || limits == null) {
            throw new PluginStateException("Extension [" + id + "] is no longer started");
        }

        Permit permit = acquire(bulkhead, action);
        boolean handedOff = false;
        try {
            ActionResult result = executor.execute(action, input == null ? Map.of() : input);
            boolean streamed = result instanceof ActionResult.Streamed;
            if (streamed != descriptor.streamsOutput()) {
                if (result instanceof ActionResult.Streamed s) {
                    s.source().close();
                }
                throw new ActionExecutionException("Action " + id + "/" + action + " declares streams_output="
                        + descriptor.streamsOutput() + " but returned a " + (streamed ? "stream" : "value"));
            }

            OutputMeter meter = new OutputMeter(id, action, limits.getMaxOutputBytes());
            if (result instanceof ActionResult.Streamed s) {
                ManagedChunkStream stream = new ManagedChunkStream(id, action,
                        new PermitReleasingSource(s.source(), permit, action),
                        chunk -> {
                            try {
                                meter.add(chunk);
                            } catch (ResourceLimitExceededException e) {
                                violations.record(action, e);
                                throw e;
                            }
                        },
                        streamIdleTimeout);
                handedOff = true;
                reaper.track(stream);
                return new InvocationResult.Stream(stream);
            }

            Object value = ((ActionResult.Value) result).value();
            meter.add(value);
            return new InvocationResult.Value(value);
        } catch (ResourceLimitExceededException e) {
            violations.record(action, e);
            throw e;
        } finally {
            if (!handedOff) {
                permit.release();
            }
        }
    }

    private Permit acquire(Semaphore bulkhead, String action) {
        String id = entry.getId();
        try {
            if (!bulkhead.tryAcquire(acquireTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                ResourceLimitExceededException e = new ResourceLimitExceededException(id, LimitType.CONCURRENCY,
                        "Extension [" + id + "] is busy (concurrency limit reached) for action '" + action + "'");
                violations.record(action, e);
                throw e;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ActionExecutionException("Interrupted while waiting for a permit of " + id + "/" + action, e);
        }
        return new Permit(bulkhead);
    }

    /**
     * 并发许可，只释放一次
     */
    private static final class Permit {
        private final Semaphore bulkhead;
        private final AtomicBoolean released = new AtomicBoolean();

        private Permit(Semaphore bulkhead) {
            this.bulkhead = bulkhead;
        }

        void release() {
            if (released.compareAndSet(false, true)) {
                bulkhead.release();
            }
        }
    }

    /**
     * 流关闭时释放许可，拉取超限时记录违规
     */
    private final class PermitReleasingSource implements ChunkSource<Object> {
        private final ChunkSource<?> delegate;
        private final Permit permit;
        private final String action;

        private PermitReleasingSource(ChunkSource<?> delegate, Permit permit, String action) {
            this.delegate = delegate;
            this.permit = permit;
            this.action = action;
        }

        @Override
        public Optional<Object> pull() throws Exception {
            try {
                Optional<?> chunk = delegate.pull();
                return chunk == null ? Optional.empty() : chunk.map(c -> (Object) c);
            } catch (ResourceLimitExceededException e) {
                violations.record(action, e);
                throw e;
            }
        }

        @Override
        public void close() {
            try {
                delegate.close();
            } finally {
                permit.release();
            }
        }
    }
}
