package com.apexframe.core.version;

import com.apexframe.core.manifest.DependencySpec;
import com.apexframe.core.manifest.EntryReference;
import com.apexframe.core.manifest.ExtensionManifest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("依赖解析与依赖图")
class DependencyGraphTest {

    private static ExtensionManifest manifest(String id, String version, String... deps) {
        ExtensionManifest.ExtensionManifestBuilder builder = ExtensionManifest.builder()
                .id(id)
                .version(SemanticVersion.parse(version))
                .entryReference(EntryReference.parse("com.example.Entry"));
        for (int i = 0; i < deps.length; i += 2) {
            builder.dependency(DependencySpec.of(deps[i], deps[i + 1]));
        }
        return builder.build();
    }

    @Nested
    @DisplayName("VersionResolver")
    class ResolverTests {

        @Test
        @DisplayName("区分缺失与版本不匹配")
        void missingAndMismatch() {
            List<DependencyCheck> checks = VersionResolver.resolve(
                    Map.of("b", SemanticVersion.parse("1.5.0")),
                    List.of(DependencySpec.of("b", ">=2.0.0 <3.0.0"), DependencySpec.of("c", "*")));

            assertEquals(DependencyCheck.Status.VERSION_MISMATCH, checks.get(0).status());
            assertEquals(SemanticVersion.parse("1.5.0"), checks.get(0).foundVersion());
            assertEquals(DependencyCheck.Status.MISSING, checks.get(1).status());
            assertFalse(VersionResolver.allSatisfied(checks));
            assertTrue(checks.get(0).describe().contains("found 1.5.0"));
        }

        @Test
        @DisplayName("全部满足")
        void allSatisfied() {
            List<DependencyCheck> checks = VersionResolver.resolve(
                    Map.of("b", SemanticVersion.parse("2.1.0")),
                    List.of(DependencySpec.of("b", "^2.0.0")));
            assertTrue(VersionResolver.allSatisfied(checks));
        }
    }

    @Nested
    @DisplayName("启动与关闭顺序")
    class OrderingTests {

        @Test
        @DisplayName("依赖排在依赖方之前，关闭顺序相反")
        void dependenciesFirst() {
            DependencyGraph graph = new DependencyGraph(List.of(
                    manifest("a", "1.0.0", "b", "*"),
                    manifest("b", "2.0.0", "c", "*"),
                    manifest("c", "1.0.0")));

            DependencyGraph.Ordering ordering = graph.startupOrder();
            assertEquals(List.of("c", "b", "a"), ordering.order());
            assertTrue(ordering.cyclic().isEmpty());
            assertEquals(List.of("a", "b", "c"), graph.shutdownOrder());
            assertEquals(List.of("a"), graph.dependentsOf("b"));
        }

        @Test
        @DisplayName("循环依赖的成员被单独列出")
        void detectsCycles() {
            DependencyGraph graph = new DependencyGraph(List.of(
                    manifest("x", "1.0.0", "y", "*"),
                    manifest("y", "1.0.0", "x", "*"),
                    manifest("z", "1.0.0")));

            DependencyGraph.Ordering ordering = graph.startupOrder();
            assertEquals(Set.of("x", "y"), ordering.cyclic());
            assertEquals(List.of("z"), ordering.order());
        }

        @Test
        @DisplayName("图外的依赖被忽略")
        void externalDependenciesIgnored() {
            DependencyGraph graph = new DependencyGraph(List.of(manifest("a", "1.0.0", "missing", "*")));
            assertEquals(List.of("a"), graph.startupOrder().order());
        }
    }
}
