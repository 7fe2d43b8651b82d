package com.apexframe.api.exception;

/**
 * 动作在扩展内部执行失败，或未声明/返回类型不符
 */
public class ActionExecutionException extends ApexException {

    public ActionExecutionException(String message) {
        super(ErrorKind.ACTION_FAILED, message);
    }

    public ActionExecutionException(String message, Throwable cause) {
        super(ErrorKind.ACTION_FAILED, message, cause);
    }
}
