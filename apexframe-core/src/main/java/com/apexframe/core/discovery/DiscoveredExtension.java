package com.apexframe.core.discovery;

import com.apexframe.core.manifest.ExtensionManifest;

import java.nio.file.Path;

/**
 * 通过校验的扩展目录
 */
public record DiscoveredExtension(ExtensionManifest manifest, Path directory) {

    public String id() {
        return manifest.getId();
    }
}
