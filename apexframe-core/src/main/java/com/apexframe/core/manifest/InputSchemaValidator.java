package com.apexframe.core.manifest;

import com.apexframe.api.exception.ActionInputException;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 调用输入校验器
 * <p>
 * 支持 JSON Schema 的一个子集：type、required、properties、items、additionalProperties。
 * </p>
 */
public final class InputSchemaValidator {

    private InputSchemaValidator() {
    }

    /**
     * @throws ActionInputException 输入不满足动作声明的 input_schema
     */
    public static void validate(ActionDescriptor action, Map<String, Object> input) {
        if (action.inputSchema().isEmpty()) {
            return;
        }
        List<String> problems = new ArrayList<>();
        check(action.inputSchema(), input, "input", problems);
        if (!problems.isEmpty()) {
            throw new ActionInputException(action.name(), problems);
        }
    }

    private static void check(Map<?, ?> schema, Object value, String path, List<String> problems) {
        Object type = schema.get("type");
        if (type instanceof String && !matchesType((String) type, value)) {
            problems.add(path + " must be of type " + type + " but was " + describe(value));
            return;
        }

        if (value instanceof Map) {
            Map<?, ?> object = (Map<?, ?>) value;
            Object required = schema.get("required");
            if (required instanceof List) {
                for (Object name : (List<?>) required) {
                    if (!object.containsKey(name)) {
                        problems.add(path + "." + name + " is required");
                    }
                }
            }
            Map<?, ?> properties = schema.get("properties") instanceof Map
                    ? (Map<?, ?>) schema.get("properties") : Map.of();
            for (Map.Entry<?, ?> field : object.entrySet()) {
                Object propertySchema = properties.get(field.getKey());
                if (propertySchema instanceof Map) {
                    check((Map<?, ?>) propertySchema, field.getValue(), path + "." + field.getKey(), problems);
                } else if (Boolean.FALSE.equals(schema.get("additionalProperties"))) {
                    problems.add(path + "." + field.getKey() + " is not an allowed property");
                }
            }
        } else if (value instanceof List && schema.get("items") instanceof Map) {
            Map<?, ?> items = (Map<?, ?>) schema.get("items");
            int index = 0;
            for (Object element : (List<?>) value) {
                check(items, element, path + "[" + index++ + "]", problems);
            }
        }
    }

    private static boolean matchesType(String type, Object value) {
        switch (type) {
            case "object":
                return value instanceof Map;
            case "array":
                return value instanceof List;
            case "string":
                return value instanceof String;
            case "boolean":
                return value instanceof Boolean;
            case "integer":
                return value instanceof Integer || value instanceof Long
                        || value instanceof Short || value instanceof Byte
                        || value instanceof BigInteger;
            case "number":
                return value instanceof Number;
            case "null":
                return value == null;
            default:
                return true;
        }
    }

    private static String describe(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName();
    }
}
