package com.apexframe.core.loader;

import com.apexframe.api.exception.LoadException;
import com.apexframe.core.manifest.EntryReference;

import java.io.IOException;
import java.net.MalformedURLException;
import java.net.URL;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * 扩展的代码单元：类加载器的 classpath，同时也是字节码扫描的范围
 *
 * @param entries jar 文件与 class 目录
 */
public record CodeUnit(Path extensionDir, List<Path> entries) {

    public CodeUnit {
        entries = List.copyOf(entries);
    }

    /**
     * 解析入口引用指向的代码单元
     * <ul>
     *     <li>未指定单元：扩展目录下的 classes/、扩展目录中的 jar 以及 lib/ 中的 jar</li>
     *     <li>指定单元：扩展目录内的 jar 或目录，不允许越出扩展目录</li>
     * </ul>
     */
    public static CodeUnit resolve(EntryReference reference, Path extensionDir) {
        Path dir = extensionDir.toAbsolutePath().normalize();
        List<Path> entries = new ArrayList<>();
        if (reference.unit() == null) {
            Path classes = dir.resolve("classes");
            if (Files.isDirectory(classes)) {
                entries.add(classes);
            }
            entries.addAll(jarsIn(dir));
            entries.addAll(jarsIn(dir.resolve("lib")));
            return new CodeUnit(dir, entries);
        }

        Path unit = dir.resolve(reference.unit()).normalize();
        if (!unit.startsWith(dir)) {
            throw new LoadException("Code unit '" + reference.unit() + "' escapes extension directory " + dir);
        }
        if (!Files.exists(unit)) {
            throw new LoadException("Code unit '" + reference.unit() + "' does not exist in " + dir);
        }
        entries.add(unit);
        entries.addAll(jarsIn(dir.resolve("lib")));
        return new CodeUnit(dir, entries);
    }

    public URL[] urls() {
        URL[] urls = new URL[entries.size()];
        for (int i = 0; i < entries.size(); i++) {
            try {
                urls[i] = entries.get(i).toUri().toURL();
            } catch (MalformedURLException e) {
                throw new LoadException("Invalid code unit path " + entries.get(i), e);
            }
        }
        return urls;
    }

    private static List<Path> jarsIn(Path dir) {
        List<Path> jars = new ArrayList<>();
        if (!Files.isDirectory(dir)) {
            return jars;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, "*.jar")) {
            stream.forEach(jars::add);
        } catch (IOException e) {
            throw new LoadException("Failed to list jars in " + dir, e);
        }
        jars.sort(null);
        return jars;
    }
}
