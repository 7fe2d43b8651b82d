package com.apexframe.core.manifest;

import com.apexframe.core.version.VersionRange;

/**
 * 清单中的依赖声明
 *
 * @param pluginId     目标扩展ID
 * @param versionRange 原始范围表达式
 * @param range        解析后的范围
 */
public record DependencySpec(String pluginId, String versionRange, VersionRange range) {

    public static DependencySpec of(String pluginId, String versionRange) {
        return new DependencySpec(pluginId, versionRange, VersionRange.parse(versionRange));
    }

    @Override
    public String toString() {
        return pluginId + "@" + versionRange;
    }
}
