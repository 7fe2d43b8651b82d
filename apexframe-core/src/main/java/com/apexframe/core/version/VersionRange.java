package com.apexframe.core.version;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 依赖版本范围
 * <p>
 * 支持的语法：
 * <ul>
 *     <li>精确版本：{@code 1.2.3}、{@code =1.2.3}</li>
 *     <li>插入符：{@code ^1.2.0}（0.x 版本按次版本或补丁号锁定）</li>
 *     <li>波浪号：{@code ~1.2.0}</li>
 *     <li>比较式组合：{@code >=2.0.0 <3.0.0}（空格或逗号分隔，全部满足）</li>
 *     <li>通配：{@code *}、{@code 1.x}、{@code 1.2.x}</li>
 *     <li>或：{@code ^1.0.0 || ^2.0.0}</li>
 * </ul>
 * 预发布版本只匹配同一 major.minor.patch 上带预发布标识的比较式。
 */
public final class VersionRange {

    private final String expression;
    // 外层为“或”，内层为“与”
    private final List<List<Comparator>> alternatives;

    private VersionRange(String expression, List<List<Comparator>> alternatives) {
        this.expression = expression;
        this.alternatives = alternatives;
    }

    public static VersionRange any() {
        return parse("*");
    }

    /**
     * @throws IllegalArgumentException 语法不合法
     */
    public static VersionRange parse(String expression) {
        Objects.requireNonNull(expression, "Version range cannot be null");
        List<List<Comparator>> alternatives = new ArrayList<>();
        for (String alternative : expression.split("\\|\\|", -1)) {
            alternatives.add(parseComparatorSet(alternative.trim(), expression));
        }
        return new VersionRange(expression.trim(), List.copyOf(alternatives));
    }

    public static boolean isValid(String expression) {
        if (expression == null) {
            return false;
        }
        try {
            parse(expression);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    public boolean isSatisfiedBy(SemanticVersion version) {
        for (List<Comparator> set : alternatives) {
            if (matchesSet(set, version)) {
                return true;
            }
        }
        return false;
    }

    public boolean isSatisfiedBy(String version) {
        return isSatisfiedBy(SemanticVersion.parse(version));
    }

    private static boolean matchesSet(List<Comparator> set, SemanticVersion version) {
        for (Comparator comparator : set) {
            if (!comparator.test(version)) {
                return false;
            }
        }
        if (!version.isPreRelease()) {
            return true;
        }
        for (Comparator comparator : set) {
            if (comparator.version().isPreRelease() && comparator.version().sameTuple(version)) {
                return true;
            }
        }
        return false;
    }

    private static List<Comparator> parseComparatorSet(String text, String whole) {
        if (text.isEmpty()) {
            if (whole.contains("||")) {
                throw new IllegalArgumentException("Empty alternative in version range: '" + whole + "'");
            }
            return List.of();
        }
        // 运算符与版本之间允许空格：">= 1.0.0"
        String normalized = text.replaceAll("(>=|<=|==|>|<|=|\\^|~)\\s+", "$1");
        List<Comparator> comparators = new ArrayList<>();
        for (String token : normalized.split("[\\s,]+")) {
            if (!token.isEmpty()) {
                comparators.addAll(parseToken(token, whole));
            }
        }
        return List.copyOf(comparators);
    }

    private static List<Comparator> parseToken(String token, String whole) {
        try {
            if (token.equals("*") || token.equalsIgnoreCase("x")) {
                return List.of();
            }
            if (token.startsWith("^")) {
                return caret(SemanticVersion.parse(token.substring(1)));
            }
            if (token.startsWith("~")) {
                SemanticVersion v = SemanticVersion.parse(token.substring(1));
                return List.of(new Comparator(Op.GTE, v),
                        new Comparator(Op.LT, SemanticVersion.of(v.major(), v.minor() + 1, 0)));
            }
            for (Op op : Op.PARSE_ORDER) {
                if (token.startsWith(op.symbol)) {
                    return List.of(new Comparator(op == Op.EQ_DOUBLE ? Op.EQ : op,
                            SemanticVersion.parse(token.substring(op.symbol.length()))));
                }
            }
            if (SemanticVersion.isValid(token)) {
                return List.of(new Comparator(Op.EQ, SemanticVersion.parse(token)));
            }
            return xRange(token);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid version range '" + whole + "': bad token '" + token + "'", e);
        }
    }

    private static List<Comparator> caret(SemanticVersion v) {
        SemanticVersion upper;
        if (v.major() > 0) {
            upper = SemanticVersion.of(v.major() + 1, 0, 0);
        } else if (v.minor() > 0) {
            upper = SemanticVersion.of(0, v.minor() + 1, 0);
        } else {
            upper = SemanticVersion.of(0, 0, v.patch() + 1);
        }
        return List.of(new Comparator(Op.GTE, v), new Comparator(Op.LT, upper));
    }

    // 1 / 1.x / 1.2 / 1.2.x
    private static List<Comparator> xRange(String token) {
        String[] parts = token.split("\\.");
        if (parts.length > 3) {
            throw new IllegalArgumentException("Too many version components: " + token);
        }
        int major = parseComponent(parts[0], token);
        if (major < 0) {
            return List.of();
        }
        int minor = parts.length > 1 ? parseComponent(parts[1], token) : -1;
        if (minor < 0) {
            return List.of(new Comparator(Op.GTE, SemanticVersion.of(major, 0, 0)),
                    new Comparator(Op.LT, SemanticVersion.of(major + 1, 0, 0)));
        }
        int patch = parts.length > 2 ? parseComponent(parts[2], token) : -1;
        if (patch < 0) {
            return List.of(new Comparator(Op.GTE, SemanticVersion.of(major, minor, 0)),
                    new Comparator(Op.LT, SemanticVersion.of(major, minor + 1, 0)));
        }
        throw new IllegalArgumentException("Not a version: " + token);
    }

    private static int parseComponent(String part, String token) {
        if (part.equals("x") || part.equals("X") || part.equals("*")) {
            return -1;
        }
        if (!part.matches("0|[1-9]\\d*")) {
            throw new IllegalArgumentException("Bad version component '" + part + "' in " + token);
        }
        return Integer.parseInt(part);
    }

    @Override
    public String toString() {
        return expression.isEmpty() ? "*" : expression;
    }

    /**
     * 调试用：展开后的比较式
     */
    public String describe() {
        return alternatives.stream()
                .map(set -> set.isEmpty() ? "*" : set.stream().map(Comparator::toString).collect(Collectors.joining(" ")))
                .collect(Collectors.joining(" || "));
    }

    private enum Op {
        GTE(">="), LTE("<="), EQ_DOUBLE("=="), GT(">"), LT("<"), EQ("=");

        static final Op[] PARSE_ORDER = {GTE, LTE, EQ_DOUBLE, GT, LT, EQ};

        final String symbol;

        Op(String symbol) {
            this.symbol = symbol;
        }
    }

    private record Comparator(Op op, SemanticVersion version) {

        boolean test(SemanticVersion candidate) {
            int c = candidate.compareTo(version);
            switch (op) {
                case GTE:
                    return c >= 0;
                case LTE:
                    return c <= 0;
                case GT:
                    return c > 0;
                case LT:
                    return c < 0;
                default:
                    return c == 0;
            }
        }

        @Override
        public String toString() {
            return op.symbol + version;
        }
    }
}
