package com.apexframe.core.config;

import org.jspecify.annotations.Nullable;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * YAML 配置文档的类型化读取
 * <p>
 * 时长支持 "500ms"、"30s"、"2m"、"1h" 或毫秒整数；大小支持 "64KB"、"256MB"、"1GB" 或字节整数。
 * </p>
 */
public final class YamlDocument {

    private static final Pattern DURATION = Pattern.compile("(\\d+)\\s*(ms|s|m|h)?");
    private static final Pattern SIZE = Pattern.compile("(\\d+)\\s*(b|kb|mb|gb)?");

    private final String source;
    private final Map<String, Object> values;

    public YamlDocument(String source, Map<String, Object> values) {
        this.source = source;
        this.values = values;
    }

    public static YamlDocument read(Path file) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            return parse(file.toString(), in);
        }
    }

    public static YamlDocument parse(String source, InputStream in) {
        Object loaded = new Yaml(new SafeConstructor(new LoaderOptions())).load(in);
        if (loaded == null) {
            return new YamlDocument(source, Map.of());
        }
        if (!(loaded instanceof Map)) {
            throw new IllegalArgumentException(source + ": document root must be a mapping");
        }
        return new YamlDocument(source, stringKeys((Map<?, ?>) loaded));
    }

    public boolean has(String key) {
        return values.containsKey(key);
    }

    public Optional<String> string(String key) {
        Object value = values.get(key);
        return value == null ? Optional.empty() : Optional.of(String.valueOf(value));
    }

    public Optional<Boolean> bool(String key) {
        Object value = values.get(key);
        if (value == null) {
            return Optional.empty();
        }
        if (value instanceof Boolean) {
            return Optional.of((Boolean) value);
        }
        throw invalid(key, "a boolean", value);
    }

    public Optional<Integer> integer(String key) {
        Object value = values.get(key);
        if (value == null) {
            return Optional.empty();
        }
        if (value instanceof Number) {
            return Optional.of(((Number) value).intValue());
        }
        throw invalid(key, "an integer", value);
    }

    public Optional<Duration> duration(String key) {
        Object value = values.get(key);
        if (value == null) {
            return Optional.empty();
        }
        if (value instanceof Number) {
            return Optional.of(Duration.ofMillis(((Number) value).longValue()));
        }
        Matcher m = DURATION.matcher(String.valueOf(value).trim().toLowerCase(Locale.ROOT));
        if (!m.matches()) {
            throw invalid(key, "a duration", value);
        }
        long amount = Long.parseLong(m.group(1));
        String unit = m.group(2) == null ? "ms" : m.group(2);
        switch (unit) {
            case "s":
                return Optional.of(Duration.ofSeconds(amount));
            case "m":
                return Optional.of(Duration.ofMinutes(amount));
            case "h":
                return Optional.of(Duration.ofHours(amount));
            default:
                return Optional.of(Duration.ofMillis(amount));
        }
    }

    public Optional<Long> size(String key) {
        Object value = values.get(key);
        if (value == null) {
            return Optional.empty();
        }
        if (value instanceof Number) {
            return Optional.of(((Number) value).longValue());
        }
        Matcher m = SIZE.matcher(String.valueOf(value).trim().toLowerCase(Locale.ROOT));
        if (!m.matches()) {
            throw invalid(key, "a size", value);
        }
        long amount = Long.parseLong(m.group(1));
        String unit = m.group(2) == null ? "b" : m.group(2);
        switch (unit) {
            case "kb":
                return Optional.of(amount * 1024);
            case "mb":
                return Optional.of(amount * 1024 * 1024);
            case "gb":
                return Optional.of(amount * 1024 * 1024 * 1024);
            default:
                return Optional.of(amount);
        }
    }

    public List<String> strings(String key) {
        Object value = values.get(key);
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List)) {
            throw invalid(key, "a list", value);
        }
        List<String> result = new ArrayList<>();
        for (Object item : (List<?>) value) {
            result.add(String.valueOf(item));
        }
        return result;
    }

    public @Nullable YamlDocument section(String key) {
        Object value = values.get(key);
        if (value == null) {
            return null;
        }
        if (!(value instanceof Map)) {
            throw invalid(key, "a mapping", value);
        }
        return new YamlDocument(source + "#" + key, stringKeys((Map<?, ?>) value));
    }

    /**
     * 以子映射形式返回各键（保持文档顺序）
     */
    public Map<String, YamlDocument> sections(String key) {
        YamlDocument section = section(key);
        Map<String, YamlDocument> result = new LinkedHashMap<>();
        if (section == null) {
            return result;
        }
        for (String name : section.values.keySet()) {
            YamlDocument child = section.section(name);
            result.put(name, child == null ? new YamlDocument(section.source + "#" + name, Map.of()) : child);
        }
        return result;
    }

    private IllegalArgumentException invalid(String key, String expected, Object value) {
        return new IllegalArgumentException(source + ": '" + key + "' must be " + expected + " but was '" + value + "'");
    }

    private static Map<String, Object> stringKeys(Map<?, ?> raw) {
        Map<String, Object> result = new LinkedHashMap<>();
        raw.forEach((k, v) -> result.put(String.valueOf(k), v));
        return result;
    }
}
