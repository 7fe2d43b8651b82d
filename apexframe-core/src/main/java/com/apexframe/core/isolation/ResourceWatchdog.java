package com.apexframe.core.isolation;

import com.apexframe.api.exception.ResourceLimitExceededException.LimitType;
import com.apexframe.core.security.ResourceLimitProfile;
import lombok.extern.slf4j.Slf4j;
import org.jspecify.annotations.Nullable;

import java.lang.management.ManagementFactory;
import java.lang.management.ThreadMXBean;
import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * 进程内资源看门狗
 * <p>
 * 定期检查被监视线程的 CPU 时间与分配字节，超限时标记违规、中断线程并取消对应任务。
 * 分配字节是累计分配量而非存活内存。
 * </p>
 */
@Slf4j
public class ResourceWatchdog implements AutoCloseable {

    private final ThreadMXBean threads = ManagementFactory.getThreadMXBean();
    private final com.sun.management.ThreadMXBean allocation;
    private final Set<Watch> watches = ConcurrentHashMap.newKeySet();
    private final ScheduledExecutorService scheduler;

    public ResourceWatchdog(Duration interval) {
        this.allocation = threads instanceof com.sun.management.ThreadMXBean sun
                && sun.isThreadAllocatedMemorySupported() ? sun : null;
        if (threads.isThreadCpuTimeSupported() && !threads.isThreadCpuTimeEnabled()) {
            threads.setThreadCpuTimeEnabled(true);
        }
        if (allocation != null && !allocation.isThreadAllocatedMemoryEnabled()) {
            allocation.setThreadAllocatedMemoryEnabled(true);
        }
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "apexframe-watchdog");
            t.setDaemon(true);
            return t;
        });
        long millis = Math.max(1, interval.toMillis());
        scheduler.scheduleWithFixedDelay(this::sweep, millis, millis, TimeUnit.MILLISECONDS);
    }

    Watch watch(String extensionId, ExecutionBudget budget) {
        Watch watch = new Watch(extensionId, budget);
        watches.add(watch);
        return watch;
    }

    void unwatch(Watch watch) {
        watches.remove(watch);
    }

    void sweep() {
        for (Watch watch : watches) {
            try {
                watch.check();
            } catch (RuntimeException e) {
                log.error("[{}] Watchdog check failed", watch.extensionId, e);
            }
        }
    }

    @Override
    public void close() {
        scheduler.shutdownNow();
        watches.clear();
    }

    /**
     * 单次执行的监视记录
     */
    final class Watch {
        private final String extensionId;
        private final ExecutionBudget budget;
        private volatile @Nullable Thread thread;
        private volatile long startCpu;
        private volatile long startAllocated;
        private volatile @Nullable Future<?> future;
        private volatile @Nullable LimitType breached;

        private Watch(String extensionId, ExecutionBudget budget) {
            this.extensionId = extensionId;
            this.budget = budget;
        }

        void bind(Future<?> future) {
            this.future = future;
        }

        /**
         * 在执行线程上调用
         */
        void attach() {
            Thread current = Thread.currentThread();
            startCpu = cpuOf(current);
            startAllocated = allocatedOf(current);
            thread = current;
        }

        /**
         * 在执行线程上调用，把本次消耗计入预算
         */
        void detach() {
            Thread current = thread;
            thread = null;
            if (current != null) {
                budget.charge(cpuOf(current) - startCpu, allocatedOf(current) - startAllocated);
            }
        }

        @Nullable LimitType breached() {
            return breached;
        }

        private void check() {
            Thread current = thread;
            if (current == null || breached != null) {
                return;
            }
            ResourceLimitProfile limits = budget.getLimits();
            if (limits.limitsCpu()) {
                long used = budget.getCpuNanos().get() + cpuOf(current) - startCpu;
                if (used > limits.getCpuTime().toNanos()) {
                    breach(current, LimitType.CPU_TIME);
                    return;
                }
            }
            if (limits.limitsMemory() && allocation != null) {
                long used = budget.getAllocatedBytes().get() + allocatedOf(current) - startAllocated;
                if (used > limits.getMemoryBytes()) {
                    breach(current, LimitType.MEMORY);
                }
            }
        }

        private void breach(Thread current, LimitType type) {
            breached = type;
            log.warn("[{}] {} ceiling breached, interrupting {}", extensionId, type, current.getName());
            current.interrupt();
            Future<?> f = future;
            if (f != null) {
                f.cancel(true);
            }
        }
    }

    private long cpuOf(Thread thread) {
        long cpu = threads.isThreadCpuTimeSupported() ? threads.getThreadCpuTime(thread.getId()) : -1;
        return Math.max(0, cpu);
    }

    private long allocatedOf(Thread thread) {
        if (allocation == null) {
            return 0;
        }
        return Math.max(0, allocation.getThreadAllocatedBytes(thread.getId()));
    }
}
