package com.apexframe.core.stream;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 空闲流回收器
 * <p>
 * 跟踪所有开放的流，定期取消超过空闲时限的流；卸载扩展时取消其全部流。
 * </p>
 */
@Slf4j
public class StreamReaper implements AutoCloseable {

    private final Set<ManagedChunkStream> open = ConcurrentHashMap.newKeySet();
    private final Duration interval;
    private ScheduledExecutorService scheduler;

    public StreamReaper(Duration interval) {
        this.interval = interval;
    }

    public synchronized void start() {
        if (scheduler != null) {
            return;
        }
        AtomicInteger counter = new AtomicInteger(0);
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "apexframe-stream-reaper-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        long millis = Math.max(1, interval.toMillis());
        scheduler.scheduleWithFixedDelay(this::sweep, millis, millis, TimeUnit.MILLISECONDS);
    }

    /**
     * 开始跟踪一个流，流结束后自动移除
     */
    public ManagedChunkStream track(ManagedChunkStream stream) {
        open.add(stream);
        stream.onFinish(() -> open.remove(stream));
        if (stream.isFinished()) {
            open.remove(stream);
        }
        return stream;
    }

    /**
     * 回收空闲流
     *
     * @return 本轮回收数量
     */
    public int sweep() {
        long now = System.nanoTime();
        int reaped = 0;
        for (ManagedChunkStream stream : open) {
            try {
                if (stream.isFinished()) {
                    open.remove(stream);
                } else if (stream.isIdle(now)) {
                    stream.reap();
                    reaped++;
                }
            } catch (RuntimeException e) {
                log.error("[{}] Failed to reap stream of action '{}'", stream.getExtensionId(), stream.getAction(), e);
            }
        }
        return reaped;
    }

    /**
     * 取消某扩展的全部开放流
     */
    public int cancelAll(String extensionId) {
        int cancelled = 0;
        for (ManagedChunkStream stream : open) {
            if (stream.getExtensionId().equals(extensionId)) {
                stream.cancel();
                cancelled++;
            }
        }
        if (cancelled > 0) {
            log.info("[{}] Cancelled {} open streams", extensionId, cancelled);
        }
        return cancelled;
    }

    public int openCount(String extensionId) {
        return (int) open.stream().filter(s -> s.getExtensionId().equals(extensionId)).count();
    }

    @Override
    public synchronized void close() {
        if (scheduler != null) {
            scheduler.shutdownNow();
            scheduler = null;
        }
        open.forEach(ManagedChunkStream::cancel);
    }
}
