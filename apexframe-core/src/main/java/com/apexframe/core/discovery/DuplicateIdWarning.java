package com.apexframe.core.discovery;

import java.nio.file.Path;

/**
 * 重复 ID：保留先发现的一方，忽略后发现的一方
 */
public record DuplicateIdWarning(String id,
                                 String keptVersion, Path keptPath,
                                 String ignoredVersion, Path ignoredPath) {

    public String describe() {
        return String.format("Duplicate extension id '%s': keeping %s at %s, ignoring %s at %s",
                id, keptVersion, keptPath, ignoredVersion, ignoredPath);
    }
}
