package com.apexframe.core.security;

import com.apexframe.api.exception.ActionExecutionException;
import com.apexframe.api.exception.ResourceLimitExceededException;
import com.apexframe.api.exception.ResourceLimitExceededException.LimitType;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * 输出大小计量：按 JSON 序列化后的字节数累计
 */
public class OutputMeter {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final String extensionId;
    private final String action;
    private final long limit;
    private long total;

    public OutputMeter(String extensionId, String action, long limit) {
        this.extensionId = extensionId;
        this.action = action;
        this.limit = limit;
    }

    /**
     * 计入一个值（终值或流分片）
     *
     * @throws ResourceLimitExceededException 累计超出上限
     */
    public synchronized void add(Object value) {
        long size = sizeOf(value);
        total += size;
        if (limit > 0 && total > limit) {
            throw new ResourceLimitExceededException(extensionId, LimitType.OUTPUT_SIZE,
                    "Output of " + extensionId + "/" + action + " reached " + total + " bytes, limit " + limit);
        }
    }

    public synchronized long total() {
        return total;
    }

    static long sizeOf(Object value) {
        try {
            return MAPPER.writeValueAsBytes(value).length;
        } catch (JsonProcessingException e) {
            throw new ActionExecutionException("Action output is not serializable: " + e.getOriginalMessage(), e);
        }
    }
}
