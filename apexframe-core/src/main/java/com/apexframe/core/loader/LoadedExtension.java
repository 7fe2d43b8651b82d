package com.apexframe.core.loader;

import com.apexframe.api.extension.ApexExtension;

/**
 * 加载结果：实例、所属类加载器与扫描报告
 */
public record LoadedExtension(ApexExtension instance, ClassLoader classLoader, ScanReport scanReport) {
}
