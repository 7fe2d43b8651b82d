package com.apexframe.api.exception;

/**
 * 状态存储的序列化或 I/O 失败，不会产生部分写入
 */
public class PluginStateException extends ApexException {

    public PluginStateException(String message) {
        super(ErrorKind.PLUGIN_STATE, message);
    }

    public PluginStateException(String message, Throwable cause) {
        super(ErrorKind.PLUGIN_STATE, message, cause);
    }
}
