package com.apexframe.core.manifest;

import com.apexframe.core.version.SemanticVersion;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import org.jspecify.annotations.Nullable;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 扩展清单（不可变）
 * 对应扩展目录中的 plugin.yml / plugin.json，作为标准契约
 */
@Getter
@Builder(toBuilder = true)
public final class ExtensionManifest {

    // === 基础元数据 ===
    private final String id;
    private final SemanticVersion version;
    @Nullable
    private final String name;
    @Nullable
    private final String description;

    // === 运行时配置 ===
    private final EntryReference entryReference;

    @Singular
    private final Set<String> declaredPermissions;

    @Singular
    private final List<DependencySpec> dependencies;

    @Singular
    private final List<ActionDescriptor> actions;

    // === 扩展属性 (KV 键值对，经由 ExtensionContext 暴露给扩展) ===
    @Singular
    private final Map<String, String> properties;

    // === 额外与宿主共享的包前缀（由宿主类加载器定义，以 '.' 结尾） ===
    @Singular
    private final List<String> sharedPackages;

    /**
     * 清单文件位置，代码构造时可为空
     */
    @Nullable
    private final Path source;

    public String getVersionString() {
        return version.toString();
    }

    public Optional<ActionDescriptor> findAction(String actionName) {
        return actions.stream().filter(a -> a.name().equals(actionName)).findFirst();
    }

    @Override
    public String toString() {
        return String.format("ExtensionManifest{id='%s', version='%s'}", id, version);
    }
}
