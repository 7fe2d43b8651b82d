package com.apexframe.core.security;

import com.apexframe.api.exception.ResourceLimitExceededException.LimitType;

import java.time.Instant;

/**
 * 一次资源超限记录
 */
public record ResourceViolation(String extensionId, String action, LimitType limitType, String message, Instant at) {
}
