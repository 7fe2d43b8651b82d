package com.apexframe.core.isolation;

import com.apexframe.core.security.ResourceLimitProfile;
import lombok.Getter;

import java.util.concurrent.atomic.AtomicLong;

/**
 * 一次调用（或一个流的全部拉取）累计消耗的 CPU 时间与分配字节
 */
@Getter
class ExecutionBudget {

    private final ResourceLimitProfile limits;
    private final AtomicLong cpuNanos = new AtomicLong();
    private final AtomicLong allocatedBytes = new AtomicLong();

    ExecutionBudget(ResourceLimitProfile limits) {
        this.limits = limits;
    }

    void charge(long cpu, long allocated) {
        cpuNanos.addAndGet(Math.max(0, cpu));
        allocatedBytes.addAndGet(Math.max(0, allocated));
    }
}
