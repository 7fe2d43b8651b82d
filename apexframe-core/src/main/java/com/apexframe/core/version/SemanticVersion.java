package com.apexframe.core.version;

import lombok.NonNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 语义化版本：MAJOR.MINOR.PATCH[-prerelease][+build]
 * 比较规则遵循 semver 2.0，build 元数据不参与比较
 */
public final class SemanticVersion implements Comparable<SemanticVersion> {

    private static final Pattern PATTERN = Pattern.compile(
            "^(0|[1-9]\\d*)\\.(0|[1-9]\\d*)\\.(0|[1-9]\\d*)"
                    + "(?:-((?:0|[1-9]\\d*|\\d*[A-Za-z-][0-9A-Za-z-]*)(?:\\.(?:0|[1-9]\\d*|\\d*[A-Za-z-][0-9A-Za-z-]*))*))?"
                    + "(?:\\+([0-9A-Za-z-]+(?:\\.[0-9A-Za-z-]+)*))?$");

    private final int major;
    private final int minor;
    private final int patch;
    private final List<String> preRelease;
    private final String build;

    private SemanticVersion(int major, int minor, int patch, List<String> preRelease, String build) {
        this.major = major;
        this.minor = minor;
        this.patch = patch;
        this.preRelease = preRelease;
        this.build = build;
    }

    public static SemanticVersion of(int major, int minor, int patch) {
        return new SemanticVersion(major, minor, patch, Collections.emptyList(), null);
    }

    /**
     * 解析版本字符串
     *
     * @throws IllegalArgumentException 格式不合法
     */
    public static SemanticVersion parse(String text) {
        Objects.requireNonNull(text, "Version cannot be null");
        Matcher m = PATTERN.matcher(text.trim());
        if (!m.matches()) {
            throw new IllegalArgumentException("Invalid semantic version: '" + text + "'");
        }
        try {
            int major = Integer.parseInt(m.group(1));
            int minor = Integer.parseInt(m.group(2));
            int patch = Integer.parseInt(m.group(3));
            List<String> pre = m.group(4) == null
                    ? Collections.emptyList()
                    : List.of(m.group(4).split("\\."));
            return new SemanticVersion(major, minor, patch, pre, m.group(5));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Version number out of range: '" + text + "'", e);
        }
    }

    public static boolean isValid(String text) {
        return text != null && PATTERN.matcher(text.trim()).matches();
    }

    public int major() {
        return major;
    }

    public int minor() {
        return minor;
    }

    public int patch() {
        return patch;
    }

    public boolean isPreRelease() {
        return !preRelease.isEmpty();
    }

    /**
     * 去掉预发布与构建信息后的版本
     */
    public SemanticVersion release() {
        return isPreRelease() || build != null ? of(major, minor, patch) : this;
    }

    boolean sameTuple(SemanticVersion other) {
        return major == other.major && minor == other.minor && patch == other.patch;
    }

    @Override
    public int compareTo(@NonNull SemanticVersion other) {
        int c = Integer.compare(major, other.major);
        if (c != 0) return c;
        c = Integer.compare(minor, other.minor);
        if (c != 0) return c;
        c = Integer.compare(patch, other.patch);
        if (c != 0) return c;
        return comparePreRelease(preRelease, other.preRelease);
    }

    private static int comparePreRelease(List<String> a, List<String> b) {
        // 无预发布标识的版本优先级更高
        if (a.isEmpty() || b.isEmpty()) {
            return Boolean.compare(a.isEmpty(), b.isEmpty());
        }
        int n = Math.min(a.size(), b.size());
        for (int i = 0; i < n; i++) {
            String x = a.get(i);
            String y = b.get(i);
            boolean xNum = x.chars().allMatch(Character::isDigit);
            boolean yNum = y.chars().allMatch(Character::isDigit);
            int c;
            if (xNum && yNum) {
                c = Long.compare(Long.parseLong(x), Long.parseLong(y));
            } else if (xNum != yNum) {
                c = xNum ? -1 : 1;
            } else {
                c = x.compareTo(y);
            }
            if (c != 0) return c;
        }
        return Integer.compare(a.size(), b.size());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SemanticVersion)) return false;
        SemanticVersion that = (SemanticVersion) o;
        return compareTo(that) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(major, minor, patch, preRelease);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder().append(major).append('.').append(minor).append('.').append(patch);
        if (!preRelease.isEmpty()) {
            sb.append('-').append(String.join(".", new ArrayList<>(preRelease)));
        }
        if (build != null) {
            sb.append('+').append(build);
        }
        return sb.toString();
    }
}
