package com.apexframe.core.manifest;

import org.jspecify.annotations.Nullable;

import java.util.regex.Pattern;

/**
 * 入口引用：{@code [<unit>!]<fully.qualified.ClassName>}
 * <p>
 * unit 是扩展目录内的 jar 或目录（相对路径）；省略时代码单元为扩展目录本身
 * （其 classes/ 目录以及目录与 lib/ 下的全部 jar）。
 * </p>
 *
 * @param unit      代码单元相对路径，可为空
 * @param className 入口类全限定名
 */
public record EntryReference(@Nullable String unit, String className) {

    private static final Pattern CLASS_NAME = Pattern.compile(
            "[A-Za-z_$][A-Za-z0-9_$]*(\\.[A-Za-z_$][A-Za-z0-9_$]*)*");

    /**
     * @throws IllegalArgumentException 格式不合法
     */
    public static EntryReference parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("entry_reference is empty");
        }
        String trimmed = text.trim();
        String unit = null;
        String className = trimmed;
        int bang = trimmed.lastIndexOf('!');
        if (bang >= 0) {
            unit = trimmed.substring(0, bang).trim();
            className = trimmed.substring(bang + 1).trim();
            if (unit.isEmpty()) {
                throw new IllegalArgumentException("entry_reference has an empty unit before '!': " + text);
            }
        }
        if (!CLASS_NAME.matcher(className).matches()) {
            throw new IllegalArgumentException("entry_reference has an invalid class name: " + text);
        }
        return new EntryReference(unit, className);
    }

    @Override
    public String toString() {
        return unit == null ? className : unit + "!" + className;
    }
}
