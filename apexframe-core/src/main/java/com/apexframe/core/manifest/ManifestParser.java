package com.apexframe.core.manifest;

import com.apexframe.api.exception.ManifestValidationException;
import com.apexframe.core.version.SemanticVersion;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 清单加载器
 * 支持 plugin.yml / plugin.yaml (SnakeYAML) 与 plugin.json (Jackson)
 */
public final class ManifestParser {

    /**
     * 同一目录中存在多个清单文件时的优先顺序
     */
    public static final List<String> MANIFEST_FILE_NAMES = List.of("plugin.yml", "plugin.yaml", "plugin.json");

    private static final ObjectMapper JSON = new ObjectMapper();

    private ManifestParser() {
    }

    /**
     * 查找扩展目录中的清单文件
     */
    public static Optional<Path> findManifest(Path directory) {
        for (String name : MANIFEST_FILE_NAMES) {
            Path candidate = directory.resolve(name);
            if (Files.isRegularFile(candidate)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    /**
     * 读取、校验并构建清单
     *
     * @throws ManifestValidationException 文件不可读、格式错误或校验失败
     */
    public static ExtensionManifest parse(Path manifestFile) {
        Map<String, Object> raw = readRaw(manifestFile);
        ManifestValidator.validate(raw, manifestFile.toString());
        return toManifest(raw, manifestFile);
    }

    static Map<String, Object> readRaw(Path manifestFile) {
        String source = manifestFile.toString();
        try (InputStream in = Files.newInputStream(manifestFile)) {
            Object loaded;
            if (source.endsWith(".json")) {
                loaded = JSON.readValue(in, new TypeReference<LinkedHashMap<String, Object>>() {
                });
            } else {
                // 只构造标准类型，不允许 YAML 标签实例化任意类
                Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
                loaded = yaml.load(in);
            }
            if (!(loaded instanceof Map)) {
                throw new ManifestValidationException(source, List.of("manifest root must be a mapping"));
            }
            Map<String, Object> raw = new LinkedHashMap<>();
            ((Map<?, ?>) loaded).forEach((k, v) -> raw.put(String.valueOf(k), v));
            return raw;
        } catch (ManifestValidationException e) {
            throw e;
        } catch (IOException | RuntimeException e) {
            throw new ManifestValidationException(source, "unreadable manifest: " + e.getMessage(), e);
        }
    }

    /**
     * 从已校验的键值树构建清单
     */
    @SuppressWarnings("unchecked")
    static ExtensionManifest toManifest(Map<String, Object> raw, Path source) {
        ExtensionManifest.ExtensionManifestBuilder builder = ExtensionManifest.builder()
                .id(((String) raw.get(ManifestFields.ID)).trim())
                .version(SemanticVersion.parse((String) raw.get(ManifestFields.VERSION)))
                .name((String) raw.get(ManifestFields.NAME))
                .description((String) raw.get(ManifestFields.DESCRIPTION))
                .entryReference(EntryReference.parse((String) raw.get(ManifestFields.ENTRY_REFERENCE)))
                .source(source);

        Object permissions = raw.get(ManifestFields.DECLARED_PERMISSIONS);
        if (permissions != null) {
            builder.declaredPermissions(new LinkedHashSet<>((List<String>) permissions));
        }

        Object dependencies = raw.get(ManifestFields.DEPENDENCIES);
        if (dependencies != null) {
            for (Object item : (List<?>) dependencies) {
                Map<?, ?> dep = (Map<?, ?>) item;
                Object range = dep.get(ManifestFields.VERSION_RANGE);
                builder.dependency(DependencySpec.of(((String) dep.get(ManifestFields.PLUGIN_ID)).trim(),
                        range == null ? "*" : ((String) range).trim()));
            }
        }

        Object actions = raw.get(ManifestFields.ACTIONS);
        if (actions != null) {
            for (Object item : (List<?>) actions) {
                Map<?, ?> action = (Map<?, ?>) item;
                Object schema = action.get(ManifestFields.INPUT_SCHEMA);
                Object required = action.get(ManifestFields.REQUIRED_PERMISSIONS);
                builder.action(new ActionDescriptor(
                        (String) action.get(ManifestFields.NAME),
                        schema == null ? Map.of() : (Map<String, Object>) schema,
                        Boolean.TRUE.equals(action.get(ManifestFields.STREAMS_OUTPUT)),
                        required == null ? Set.of() : new LinkedHashSet<>((List<String>) required)));
            }
        }

        Object properties = raw.get(ManifestFields.PROPERTIES);
        if (properties != null) {
            ((Map<?, ?>) properties).forEach((k, v) -> builder.property(String.valueOf(k), String.valueOf(v)));
        }

        Object shared = raw.get(ManifestFields.SHARED_PACKAGES);
        if (shared != null) {
            for (Object prefix : (List<?>) shared) {
                String pkg = (String) prefix;
                builder.sharedPackage(pkg.endsWith(".") ? pkg : pkg + ".");
            }
        }
        return builder.build();
    }
}
