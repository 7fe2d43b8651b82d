package com.apexframe.core.discovery;

import java.nio.file.Path;
import java.util.List;

/**
 * 清单无效而被拒绝的扩展目录
 */
public record RejectedExtension(Path directory, Path manifestFile, List<String> problems) {

    public RejectedExtension {
        problems = List.copyOf(problems);
    }
}
