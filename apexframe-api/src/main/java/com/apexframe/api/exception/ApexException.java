package com.apexframe.api.exception;

import lombok.Getter;

/**
 * ApexFrame 基础异常
 *
 * @author ApexFrame
 */
@Getter
public class ApexException extends RuntimeException {

    private final ErrorKind kind;

    public ApexException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ApexException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }
}
