package com.apexframe.api.event;

import lombok.Getter;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 宿主范围的事件
 * 以事件类型字符串路由，事件源为发布者（扩展ID 或宿主）
 */
@Getter
public class ExtensionEvent implements Serializable {

    private final String type;
    private final String source;
    private final Map<String, Object> payload;
    private final long timestamp;

    public ExtensionEvent(String type, String source, Map<String, Object> payload) {
        this.type = Objects.requireNonNull(type, "type");
        this.source = Objects.requireNonNull(source, "source");
        this.payload = payload == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
        this.timestamp = System.currentTimeMillis();
    }

    @Override
    public String toString() {
        return "ExtensionEvent[type=" + type + ", source=" + source + ", timestamp=" + timestamp + "]";
    }
}
