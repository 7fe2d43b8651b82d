package com.apexframe.api.exception;

/**
 * 错误类别，调用方按类别分支而不是匹配异常消息
 */
public enum ErrorKind {
    MANIFEST_VALIDATION,
    LOAD,
    PERMISSION_DENIED,
    DEPENDENCY_RESOLUTION,
    RESOURCE_LIMIT_EXCEEDED,
    PLUGIN_STATE,
    STREAM_CONSUMPTION,
    EXTENSION_NOT_FOUND,
    ILLEGAL_TRANSITION,
    INVALID_INPUT,
    ACTION_FAILED,
    /**
     * 运行时核心不可恢复的故障（例如状态存储介质不可用）
     */
    FATAL
}
