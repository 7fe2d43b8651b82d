package com.apexframe.api.exception;

import lombok.Getter;

/**
 * 单次调用超出资源上限
 * <p>
 * 只终止当前调用，扩展的生命周期状态不受影响。
 * </p>
 */
@Getter
public class ResourceLimitExceededException extends ApexException {

    public enum LimitType {
        CPU_TIME, MEMORY, WALL_CLOCK, OUTPUT_SIZE, CONCURRENCY
    }

    private final String extensionId;
    private final LimitType limitType;

    public ResourceLimitExceededException(String extensionId, LimitType limitType, String message) {
        super(ErrorKind.RESOURCE_LIMIT_EXCEEDED, message);
        this.extensionId = extensionId;
        this.limitType = limitType;
    }
}
