package com.apexframe.core.isolation;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;

import java.util.Map;

/**
 * 宿主与隔离进程之间的行协议消息（每行一个 JSON 对象）
 * <p>
 * 请求：invoke、next、cancel、terminate。
 * 应答：ready、value、stream、chunk、end、error；event 为隔离进程主动推送的事件。
 * </p>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WorkerMessage(String type,
                            @Nullable String action,
                            @Nullable Map<String, Object> input,
                            @Nullable Object value,
                            @Nullable String message,
                            @JsonProperty("error_kind") @Nullable String errorKind,
                            @JsonProperty("limit_type") @Nullable String limitType,
                            @JsonProperty("event_type") @Nullable String eventType,
                            @Nullable Map<String, Object> payload) {

    // 请求
    public static final String INVOKE = "invoke";
    public static final String NEXT = "next";
    public static final String CANCEL = "cancel";
    public static final String TERMINATE = "terminate";
    // 应答
    public static final String READY = "ready";
    public static final String VALUE = "value";
    public static final String STREAM = "stream";
    public static final String CHUNK = "chunk";
    public static final String END = "end";
    public static final String ERROR = "error";
    public static final String EVENT = "event";
    /**
     * 宿主内部使用：隔离进程的标准输出已关闭
     */
    static final String EXITED = "exited";

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public static WorkerMessage of(String type) {
        return new WorkerMessage(type, null, null, null, null, null, null, null, null);
    }

    public static WorkerMessage invoke(String action, Map<String, Object> input) {
        return new WorkerMessage(INVOKE, action, input, null, null, null, null, null, null);
    }

    public static WorkerMessage value(@Nullable Object value) {
        return new WorkerMessage(VALUE, null, null, value, null, null, null, null, null);
    }

    public static WorkerMessage chunk(@Nullable Object value) {
        return new WorkerMessage(CHUNK, null, null, value, null, null, null, null, null);
    }

    public static WorkerMessage error(String errorKind, @Nullable String limitType, String message) {
        return new WorkerMessage(ERROR, null, null, null, message, errorKind, limitType, null, null);
    }

    public static WorkerMessage event(String eventType, Map<String, Object> payload) {
        return new WorkerMessage(EVENT, null, null, null, null, null, null, eventType, payload);
    }

    public boolean is(String expected) {
        return expected.equals(type);
    }

    public String toLine() {
        try {
            return MAPPER.writeValueAsString(this);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Message is not serializable: " + e.getOriginalMessage(), e);
        }
    }

    public static WorkerMessage parse(String line) {
        try {
            return MAPPER.readValue(line, WorkerMessage.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed worker message: " + e.getOriginalMessage(), e);
        }
    }
}
