package com.apexframe.core.stream;

import com.apexframe.api.action.ChunkSource;
import com.apexframe.api.action.ChunkStream;
import com.apexframe.api.exception.ApexException;
import com.apexframe.api.exception.ResourceLimitExceededException;
import com.apexframe.api.exception.StreamConsumptionException;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * 交给调用方的受管流
 * <p>
 * 拉取式：hasNext 最多预取一个分片。生产者在若干分片之后失败时，
 * 下一次拉取抛出 {@link StreamConsumptionException}；单次拉取超出资源上限时原样抛出 {@link ResourceLimitExceededException}。
 * cancel 幂等且可从任意线程调用，源只关闭一次；拉取进行中被取消时，源在该次拉取返回后由拉取线程关闭。
 * </p>
 */
@Slf4j
public class ManagedChunkStream implements ChunkStream<Object> {

    enum Phase { OPEN, EXHAUSTED, FAILED, CANCELLED, REAPED }

    @Getter
    private final String extensionId;
    @Getter
    private final String action;
    private final ChunkSource<?> source;
    private final Consumer<Object> chunkGuard;
    private final long idleTimeoutNanos;

    private final AtomicReference<Phase> phase = new AtomicReference<>(Phase.OPEN);
    private volatile RuntimeException failure;
    private volatile long lastActivity = System.nanoTime();
    private final Object pullLock = new Object();
    // 写入需持有 pullLock
    private volatile boolean pulling;
    private boolean closeDeferred;
    private volatile long delivered;
    private volatile Runnable onFinish = () -> {
    };

    // 仅在持有监视器时访问
    private Object lookahead;
    private boolean hasLookahead;

    /**
     * @param chunkGuard 每个分片交付前调用，可抛出异常终止流（如输出大小超限）
     */
    public ManagedChunkStream(String extensionId, String action, ChunkSource<?> source,
                              Consumer<Object> chunkGuard, Duration idleTimeout) {
        this.extensionId = extensionId;
        this.action = action;
        this.source = source;
        this.chunkGuard = chunkGuard;
        this.idleTimeoutNanos = idleTimeout.toNanos();
    }

    void onFinish(Runnable callback) {
        this.onFinish = callback;
    }

    @Override
    public synchronized boolean hasNext() {
        lastActivity = System.nanoTime();
        if (!checkOpen()) {
            return false;
        }
        if (hasLookahead) {
            return true;
        }

        Optional<?> chunk;
        synchronized (pullLock) {
            pulling = true;
        }
        try {
            chunk = source.pull();
        } catch (ResourceLimitExceededException e) {
            if (!checkOpen()) {
                return false;
            }
            fail(e);
            throw e;
        } catch (Exception e) {
            if (!checkOpen()) {
                return false;
            }
            fail(new StreamConsumptionException("Producer of " + describe() + " failed after "
                    + delivered + " chunks: " + e.getMessage(), e));
            throw failure;
        } finally {
            boolean closeNow;
            synchronized (pullLock) {
                pulling = false;
                closeNow = closeDeferred;
                closeDeferred = false;
            }
            lastActivity = System.nanoTime();
            if (closeNow) {
                release();
            }
        }

        if (!checkOpen()) {
            return false;
        }
        if (chunk == null || chunk.isEmpty()) {
            if (phase.compareAndSet(Phase.OPEN, Phase.EXHAUSTED)) {
                release();
            }
            return false;
        }
        Object value = chunk.get();
        try {
            chunkGuard.accept(value);
        } catch (ApexException e) {
            fail(e);
            throw e;
        }
        lookahead = value;
        hasLookahead = true;
        return true;
    }

    @Override
    public synchronized Object next() {
        if (!hasNext()) {
            throw new NoSuchElementException("Stream " + describe() + " has no more chunks");
        }
        Object value = lookahead;
        lookahead = null;
        hasLookahead = false;
        delivered++;
        return value;
    }

    @Override
    public void cancel() {
        if (terminate(Phase.CANCELLED)) {
            log.debug("[{}] Stream of action '{}' cancelled by caller", extensionId, action);
        }
    }

    /**
     * 空闲超时后由 {@link StreamReaper} 调用
     */
    void reap() {
        if (terminate(Phase.REAPED)) {
            log.warn("[{}] Stream of action '{}' cancelled after idle timeout ({} chunks delivered)",
                    extensionId, action, delivered);
        }
    }

    @Override
    public boolean isCancelled() {
        Phase current = phase.get();
        return current == Phase.CANCELLED || current == Phase.REAPED;
    }

    @Override
    public long deliveredCount() {
        return delivered;
    }

    public boolean isFinished() {
        return phase.get() != Phase.OPEN;
    }

    Phase phase() {
        return phase.get();
    }

    boolean isIdle(long nowNanos) {
        return !pulling && nowNanos - lastActivity > idleTimeoutNanos;
    }

    /**
     * @return 流是否仍然开放；已回收或已失败时抛出异常
     */
    private boolean checkOpen() {
        switch (phase.get()) {
            case OPEN:
                return true;
            case REAPED:
                throw new StreamConsumptionException("Stream " + describe() + " was cancelled after being idle");
            case FAILED:
                throw failure;
            default:
                return false;
        }
    }

    private boolean terminate(Phase target) {
        if (!phase.compareAndSet(Phase.OPEN, target)) {
            return false;
        }
        boolean inFlight;
        synchronized (pullLock) {
            inFlight = pulling;
            closeDeferred = inFlight;
        }
        if (!inFlight) {
            release();
        }
        return true;
    }

    private void fail(RuntimeException e) {
        failure = e;
        if (phase.compareAndSet(Phase.OPEN, Phase.FAILED)) {
            release();
        }
    }

    private void release() {
        try {
            source.close();
        } catch (Exception e) {
            log.warn("[{}] Failed to close chunk source of action '{}'", extensionId, action, e);
        } finally {
            onFinish.run();
        }
    }

    private String describe() {
        return extensionId + "/" + action;
    }
}
