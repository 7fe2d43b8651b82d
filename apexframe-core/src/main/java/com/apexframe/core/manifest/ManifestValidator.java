package com.apexframe.core.manifest;

import com.apexframe.api.exception.ManifestValidationException;
import com.apexframe.core.version.SemanticVersion;
import com.apexframe.core.version.VersionRange;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * 清单结构校验
 * <p>
 * 收集全部问题后一次性抛出，方便运维一次看清扩展被拒绝的所有原因。
 * </p>
 */
public final class ManifestValidator {

    static final Pattern ID_PATTERN = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._-]*");
    static final Pattern PERMISSION_PATTERN = Pattern.compile("[a-z][a-z0-9_.:-]*");
    static final Pattern ACTION_PATTERN = Pattern.compile("[A-Za-z_][A-Za-z0-9_.-]*");
    static final Pattern PACKAGE_PATTERN = Pattern.compile("[A-Za-z_$][\\w$]*(\\.[A-Za-z_$][\\w$]*)*\\.?");

    static final Set<String> SCHEMA_TYPES = Set.of(
            "object", "string", "number", "integer", "boolean", "array", "null");

    private ManifestValidator() {
    }

    /**
     * 校验原始清单
     *
     * @param raw    解析出的键值树
     * @param source 清单来源（用于错误信息）
     * @throws ManifestValidationException 存在任何问题
     */
    public static void validate(Map<String, Object> raw, String source) {
        List<String> problems = new ArrayList<>();

        String id = stringField(raw, ManifestFields.ID, problems);
        if (id != null && !ID_PATTERN.matcher(id).matches()) {
            problems.add("id '" + id + "' must match " + ID_PATTERN.pattern());
        }

        String version = stringField(raw, ManifestFields.VERSION, problems);
        if (version != null && !SemanticVersion.isValid(version)) {
            problems.add("version '" + version + "' is not a semantic version");
        }

        String entry = stringField(raw, ManifestFields.ENTRY_REFERENCE, problems);
        if (entry != null) {
            try {
                EntryReference.parse(entry);
            } catch (IllegalArgumentException e) {
                problems.add(e.getMessage());
            }
        }

        Set<String> declared = validatePermissions(raw.get(ManifestFields.DECLARED_PERMISSIONS), problems);
        validateDependencies(raw.get(ManifestFields.DEPENDENCIES), id, problems);
        validateActions(raw.get(ManifestFields.ACTIONS), declared, problems);

        Object properties = raw.get(ManifestFields.PROPERTIES);
        if (properties != null && !(properties instanceof Map)) {
            problems.add("properties must be a mapping");
        }
        validateSharedPackages(raw.get(ManifestFields.SHARED_PACKAGES), problems);

        if (!problems.isEmpty()) {
            throw new ManifestValidationException(source, problems);
        }
    }

    private static String stringField(Map<String, Object> raw, String field, List<String> problems) {
        Object value = raw.get(field);
        if (value == null) {
            problems.add(field + " is required");
            return null;
        }
        if (!(value instanceof String) || ((String) value).isBlank()) {
            problems.add(field + " must be a non-empty string");
            return null;
        }
        return ((String) value).trim();
    }

    private static Set<String> validatePermissions(Object value, List<String> problems) {
        Set<String> declared = new HashSet<>();
        if (value == null) {
            return declared;
        }
        if (!(value instanceof List)) {
            problems.add(ManifestFields.DECLARED_PERMISSIONS + " must be a list");
            return declared;
        }
        for (Object token : (List<?>) value) {
            if (!(token instanceof String) || !PERMISSION_PATTERN.matcher((String) token).matches()) {
                problems.add("permission token '" + token + "' must match " + PERMISSION_PATTERN.pattern());
            } else {
                declared.add((String) token);
            }
        }
        return declared;
    }

    private static void validateSharedPackages(Object value, List<String> problems) {
        if (value == null) {
            return;
        }
        if (!(value instanceof List)) {
            problems.add(ManifestFields.SHARED_PACKAGES + " must be a list");
            return;
        }
        for (Object prefix : (List<?>) value) {
            if (!(prefix instanceof String) || !PACKAGE_PATTERN.matcher((String) prefix).matches()) {
                problems.add("shared package '" + prefix + "' is not a package name");
            }
        }
    }

    private static void validateDependencies(Object value, String selfId, List<String> problems) {
        if (value == null) {
            return;
        }
        if (!(value instanceof List)) {
            problems.add(ManifestFields.DEPENDENCIES + " must be a list");
            return;
        }
        Set<String> seen = new HashSet<>();
        int index = 0;
        for (Object item : (List<?>) value) {
            String where = "dependencies[" + index++ + "]";
            if (!(item instanceof Map)) {
                problems.add(where + " must be a mapping");
                continue;
            }
            Map<?, ?> dep = (Map<?, ?>) item;
            Object target = dep.get(ManifestFields.PLUGIN_ID);
            if (!(target instanceof String) || ((String) target).isBlank()) {
                problems.add(where + "." + ManifestFields.PLUGIN_ID + " is required");
            } else {
                String targetId = ((String) target).trim();
                if (targetId.equals(selfId)) {
                    problems.add(where + " depends on the extension itself");
                }
                if (!seen.add(targetId)) {
                    problems.add(where + " duplicates dependency on '" + targetId + "'");
                }
            }
            Object range = dep.get(ManifestFields.VERSION_RANGE);
            if (range != null && !(range instanceof String)) {
                problems.add(where + "." + ManifestFields.VERSION_RANGE + " must be a string");
            } else if (range != null && !VersionRange.isValid((String) range)) {
                problems.add(where + "." + ManifestFields.VERSION_RANGE + " '" + range + "' is not a valid range");
            }
        }
    }

    private static void validateActions(Object value, Set<String> declared, List<String> problems) {
        if (value == null) {
            return;
        }
        if (!(value instanceof List)) {
            problems.add(ManifestFields.ACTIONS + " must be a list");
            return;
        }
        Set<String> names = new HashSet<>();
        int index = 0;
        for (Object item : (List<?>) value) {
            String where = "actions[" + index++ + "]";
            if (!(item instanceof Map)) {
                problems.add(where + " must be a mapping");
                continue;
            }
            Map<?, ?> action = (Map<?, ?>) item;
            Object name = action.get(ManifestFields.NAME);
            if (!(name instanceof String) || !ACTION_PATTERN.matcher((String) name).matches()) {
                problems.add(where + ".name '" + name + "' must match " + ACTION_PATTERN.pattern());
            } else if (!names.add((String) name)) {
                problems.add(where + " duplicates action name '" + name + "'");
            } else {
                where = "action '" + name + "'";
            }

            Object streams = action.get(ManifestFields.STREAMS_OUTPUT);
            if (streams != null && !(streams instanceof Boolean)) {
                problems.add(where + "." + ManifestFields.STREAMS_OUTPUT + " must be a boolean");
            }

            Object schema = action.get(ManifestFields.INPUT_SCHEMA);
            if (schema != null) {
                validateSchema(schema, where + "." + ManifestFields.INPUT_SCHEMA, problems);
            }

            Object required = action.get(ManifestFields.REQUIRED_PERMISSIONS);
            if (required != null) {
                if (!(required instanceof List)) {
                    problems.add(where + "." + ManifestFields.REQUIRED_PERMISSIONS + " must be a list");
                } else {
                    for (Object token : (List<?>) required) {
                        if (!declared.contains(token)) {
                            problems.add(where + " requires undeclared permission '" + token + "'");
                        }
                    }
                }
            }
        }
    }

    static void validateSchema(Object schema, String where, List<String> problems) {
        if (!(schema instanceof Map)) {
            problems.add(where + " must be a mapping");
            return;
        }
        Map<?, ?> map = (Map<?, ?>) schema;
        Object type = map.get("type");
        if (type != null && !(type instanceof String && SCHEMA_TYPES.contains(type))) {
            problems.add(where + ".type '" + type + "' is not one of " + SCHEMA_TYPES);
        }
        Object properties = map.get("properties");
        if (properties != null) {
            if (!(properties instanceof Map)) {
                problems.add(where + ".properties must be a mapping");
            } else {
                for (Map.Entry<?, ?> property : ((Map<?, ?>) properties).entrySet()) {
                    validateSchema(property.getValue(), where + ".properties." + property.getKey(), problems);
                }
            }
        }
        Object required = map.get("required");
        if (required != null) {
            if (!(required instanceof List) || !((List<?>) required).stream().allMatch(r -> r instanceof String)) {
                problems.add(where + ".required must be a list of strings");
            }
        }
        Object items = map.get("items");
        if (items != null) {
            validateSchema(items, where + ".items", problems);
        }
        Object additional = map.get("additionalProperties");
        if (additional != null && !(additional instanceof Boolean)) {
            problems.add(where + ".additionalProperties must be a boolean");
        }
    }
}
