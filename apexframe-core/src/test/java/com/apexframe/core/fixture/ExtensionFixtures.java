package com.apexframe.core.fixture;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * 在临时目录中构造扩展目录
 */
public final class ExtensionFixtures {

    private ExtensionFixtures() {
    }

    /**
     * 最小清单，extra 为追加的 YAML 片段（顶层键）
     */
    public static String manifest(String id, String version, Class<?> entry, String... extra) {
        StringBuilder yaml = new StringBuilder()
                .append("id: ").append(id).append('\n')
                .append("version: ").append(version).append('\n')
                .append("entry_reference: ").append(entry.getName()).append('\n');
        for (String line : extra) {
            yaml.append(line).append('\n');
        }
        return yaml.toString();
    }

    /**
     * 写入 root/dirName/plugin.yml
     */
    public static Path extension(Path root, String dirName, String manifestYaml) {
        try {
            Path dir = Files.createDirectories(root.resolve(dirName));
            Files.writeString(dir.resolve("plugin.yml"), manifestYaml);
            return dir;
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * 把测试类的字节码复制到扩展的 classes/ 下，使其进入代码单元与字节码扫描范围
     */
    public static void copyClass(Path extensionDir, Class<?> type) {
        String resource = type.getName().replace('.', '/') + ".class";
        Path target = extensionDir.resolve("classes").resolve(resource);
        try (InputStream in = type.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Class file not found: " + resource);
            }
            Files.createDirectories(target.getParent());
            Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
