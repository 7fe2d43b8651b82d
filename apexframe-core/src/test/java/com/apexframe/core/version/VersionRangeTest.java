package com.apexframe.core.version;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("语义化版本与版本范围")
class VersionRangeTest {

    @Nested
    @DisplayName("版本解析与排序")
    class SemanticVersionTests {

        @Test
        @DisplayName("按数值比较各段，而非字典序")
        void numericOrdering() {
            assertTrue(SemanticVersion.parse("1.10.0").compareTo(SemanticVersion.parse("1.9.0")) > 0);
            assertTrue(SemanticVersion.parse("2.0.0").compareTo(SemanticVersion.parse("1.99.99")) > 0);
        }

        @Test
        @DisplayName("预发布版本低于对应正式版本")
        void preReleaseLowerThanRelease() {
            SemanticVersion rc = SemanticVersion.parse("1.0.0-rc.1");
            assertTrue(rc.isPreRelease());
            assertTrue(rc.compareTo(SemanticVersion.parse("1.0.0")) < 0);
            assertTrue(SemanticVersion.parse("1.0.0-alpha").compareTo(SemanticVersion.parse("1.0.0-beta")) < 0);
            assertTrue(SemanticVersion.parse("1.0.0-rc.2").compareTo(SemanticVersion.parse("1.0.0-rc.10")) < 0);
        }

        @Test
        @DisplayName("非法版本被拒绝")
        void rejectsInvalid() {
            assertFalse(SemanticVersion.isValid("1.0"));
            assertFalse(SemanticVersion.isValid("v1.0.0"));
            assertFalse(SemanticVersion.isValid(""));
            assertThrows(IllegalArgumentException.class, () -> SemanticVersion.parse("abc"));
        }
    }

    @Nested
    @DisplayName("范围匹配")
    class RangeTests {

        @Test
        @DisplayName("比较式组合：>=2.0.0 <3.0.0")
        void comparatorSet() {
            VersionRange range = VersionRange.parse(">=2.0.0 <3.0.0");
            assertTrue(range.isSatisfiedBy("2.0.0"));
            assertTrue(range.isSatisfiedBy("2.9.9"));
            assertFalse(range.isSatisfiedBy("3.0.0"));
            assertFalse(range.isSatisfiedBy("1.9.9"));
        }

        @Test
        @DisplayName("插入符与波浪号")
        void caretAndTilde() {
            assertTrue(VersionRange.parse("^1.2.0").isSatisfiedBy("1.9.0"));
            assertFalse(VersionRange.parse("^1.2.0").isSatisfiedBy("2.0.0"));
            assertFalse(VersionRange.parse("^0.2.0").isSatisfiedBy("0.3.0"));
            assertTrue(VersionRange.parse("~1.2.0").isSatisfiedBy("1.2.7"));
            assertFalse(VersionRange.parse("~1.2.0").isSatisfiedBy("1.3.0"));
        }

        @Test
        @DisplayName("通配与或运算")
        void wildcardAndAlternatives() {
            assertTrue(VersionRange.parse("*").isSatisfiedBy("0.0.1"));
            assertTrue(VersionRange.parse("1.x").isSatisfiedBy("1.4.2"));
            assertFalse(VersionRange.parse("1.x").isSatisfiedBy("2.0.0"));
            VersionRange either = VersionRange.parse("^1.0.0 || ^3.0.0");
            assertTrue(either.isSatisfiedBy("3.1.0"));
            assertFalse(either.isSatisfiedBy("2.1.0"));
        }

        @Test
        @DisplayName("预发布版本不满足普通范围")
        void preReleaseExcludedFromPlainRange() {
            assertFalse(VersionRange.parse(">=1.0.0").isSatisfiedBy("2.0.0-beta"));
            assertTrue(VersionRange.parse(">=2.0.0-alpha").isSatisfiedBy("2.0.0-beta"));
        }

        @Test
        @DisplayName("非法范围表达式")
        void invalidRanges() {
            assertFalse(VersionRange.isValid(">=banana"));
            assertFalse(VersionRange.isValid("^1.0.0 ||"));
            assertThrows(IllegalArgumentException.class, () -> VersionRange.parse("1.2.3.4"));
        }
    }
}
