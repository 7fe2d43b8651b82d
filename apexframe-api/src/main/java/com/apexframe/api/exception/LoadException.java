package com.apexframe.api.exception;

/**
 * 扩展代码单元无法加载或入口类不满足能力接口
 */
public class LoadException extends ApexException {

    public LoadException(String message) {
        super(ErrorKind.LOAD, message);
    }

    public LoadException(String message, Throwable cause) {
        super(ErrorKind.LOAD, message, cause);
    }
}
