package com.apexframe.api.exception;

/**
 * 非法的生命周期迁移，状态保持不变
 */
public class IllegalTransitionException extends ApexException {

    public IllegalTransitionException(String extensionId, String from, String operation) {
        super(ErrorKind.ILLEGAL_TRANSITION,
                "Cannot " + operation + " [" + extensionId + "] in state " + from);
    }
}
