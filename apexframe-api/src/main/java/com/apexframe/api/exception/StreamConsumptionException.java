package com.apexframe.api.exception;

/**
 * 流消费过程中的失败（生产者故障、空闲超时）
 */
public class StreamConsumptionException extends ApexException {

    public StreamConsumptionException(String message) {
        super(ErrorKind.STREAM_CONSUMPTION, message);
    }

    public StreamConsumptionException(String message, Throwable cause) {
        super(ErrorKind.STREAM_CONSUMPTION, message, cause);
    }
}
