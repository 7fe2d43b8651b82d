package com.apexframe.core.manifest;

import com.apexframe.api.exception.ManifestValidationException;
import com.apexframe.core.version.SemanticVersion;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("清单解析与校验")
class ManifestParserTest {

    @TempDir
    Path tempDir;

    private Path write(String name, String content) throws Exception {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content);
        return file;
    }

    @Nested
    @DisplayName("YAML 与 JSON 解析")
    class ParseTests {

        @Test
        @DisplayName("完整的 YAML 清单")
        void parsesYaml() throws Exception {
            Path file = write("plugin.yml", String.join("\n",
                    "id: com.example.echo",
                    "version: 1.2.0",
                    "name: Echo",
                    "entry_reference: com.example.EchoExtension",
                    "declared_permissions: [event.emit, file.write]",
                    "dependencies:",
                    "  - plugin_id: com.example.base",
                    "    version_range: \">=2.0.0 <3.0.0\"",
                    "  - plugin_id: com.example.util",
                    "actions:",
                    "  - name: echo",
                    "    input_schema:",
                    "      type: object",
                    "      required: [text]",
                    "  - name: tail",
                    "    streams_output: true",
                    "    required_permissions: [file.write]",
                    "properties:",
                    "  greeting: hello",
                    "  retries: 3",
                    ""));

            ExtensionManifest manifest = ManifestParser.parse(file);

            assertEquals("com.example.echo", manifest.getId());
            assertEquals(SemanticVersion.of(1, 2, 0), manifest.getVersion());
            assertEquals("com.example.EchoExtension", manifest.getEntryReference().className());
            assertNull(manifest.getEntryReference().unit());
            assertEquals(Set.of("event.emit", "file.write"), manifest.getDeclaredPermissions());
            assertEquals(2, manifest.getDependencies().size());
            assertEquals("*", manifest.getDependencies().get(1).versionRange());
            assertTrue(manifest.findAction("tail").orElseThrow().streamsOutput());
            assertEquals(Set.of("file.write"), manifest.findAction("tail").orElseThrow().requiredPermissions());
            assertEquals("3", manifest.getProperties().get("retries"));
            assertEquals(file, manifest.getSource());
        }

        @Test
        @DisplayName("JSON 清单与带代码单元的入口引用")
        void parsesJson() throws Exception {
            Path file = write("plugin.json", "{\"id\":\"j\",\"version\":\"0.1.0\","
                    + "\"entry_reference\":\"lib/impl.jar!com.example.J\"}");

            ExtensionManifest manifest = ManifestParser.parse(file);

            assertEquals("lib/impl.jar", manifest.getEntryReference().unit());
            assertEquals("com.example.J", manifest.getEntryReference().className());
        }

        @Test
        @DisplayName("按固定顺序查找清单文件")
        void findsManifest() throws Exception {
            assertTrue(ManifestParser.findManifest(tempDir).isEmpty());
            write("plugin.json", "{}");
            write("plugin.yml", "id: x");
            assertEquals(tempDir.resolve("plugin.yml"), ManifestParser.findManifest(tempDir).orElseThrow());
        }

        @Test
        @DisplayName("语法错误的文件报告为校验失败")
        void malformedFile() throws Exception {
            Path file = write("plugin.yml", "id: [unclosed");
            assertThrows(ManifestValidationException.class, () -> ManifestParser.parse(file));
        }

        @Test
        @DisplayName("YAML 标签不会实例化任意类")
        void rejectsYamlTags() throws Exception {
            Path file = write("plugin.yml", "id: !!java.io.File [\"/tmp\"]\nversion: 1.0.0\nentry_reference: a.B\n");
            assertThrows(ManifestValidationException.class, () -> ManifestParser.parse(file));
        }
    }

    @Nested
    @DisplayName("字段校验")
    class ValidationTests {

        @Test
        @DisplayName("一次报告全部问题")
        void collectsAllProblems() {
            Map<String, Object> raw = Map.of(
                    "id", "bad id!",
                    "version", "1.0",
                    "declared_permissions", List.of("Event.Emit"),
                    "actions", List.of(
                            Map.of("name", "a", "required_permissions", List.of("network.connect")),
                            Map.of("name", "a")));

            ManifestValidationException e = assertThrows(ManifestValidationException.class,
                    () -> ManifestValidator.validate(raw, "test"));

            List<String> problems = e.getProblems();
            assertTrue(problems.stream().anyMatch(p -> p.startsWith("id ")));
            assertTrue(problems.stream().anyMatch(p -> p.startsWith("version ")));
            assertTrue(problems.stream().anyMatch(p -> p.startsWith("entry_reference is required")));
            assertTrue(problems.stream().anyMatch(p -> p.contains("permission token 'Event.Emit'")));
            assertTrue(problems.stream().anyMatch(p -> p.contains("undeclared permission 'network.connect'")));
            assertTrue(problems.stream().anyMatch(p -> p.contains("duplicates action name 'a'")));
        }

        @Test
        @DisplayName("自依赖与非法范围")
        void dependencyProblems() {
            Map<String, Object> raw = Map.of(
                    "id", "a",
                    "version", "1.0.0",
                    "entry_reference", "x.A",
                    "dependencies", List.of(
                            Map.of("plugin_id", "a"),
                            Map.of("plugin_id", "b", "version_range", ">=nope")));

            ManifestValidationException e = assertThrows(ManifestValidationException.class,
                    () -> ManifestValidator.validate(raw, "test"));

            assertTrue(e.getProblems().stream().anyMatch(p -> p.contains("depends on the extension itself")));
            assertTrue(e.getProblems().stream().anyMatch(p -> p.contains("is not a valid range")));
        }

        @Test
        @DisplayName("共享包前缀统一以点结尾，非法包名被拒绝")
        void sharedPackages() throws Exception {
            Path file = write("plugin.yml", String.join("\n",
                    "id: a", "version: 1.0.0", "entry_reference: x.A",
                    "shared_packages: [com.acme.model, org.shared.]"));

            assertEquals(List.of("com.acme.model.", "org.shared."), ManifestParser.parse(file).getSharedPackages());

            ManifestValidationException e = assertThrows(ManifestValidationException.class,
                    () -> ManifestValidator.validate(Map.of("id", "a", "version", "1.0.0", "entry_reference", "x.A",
                            "shared_packages", List.of("com..bad", 3)), "test"));
            assertEquals(2, e.getProblems().size());
        }

        @Test
        @DisplayName("最小合法清单")
        void minimalManifest() {
            assertDoesNotThrow(() -> ManifestValidator.validate(
                    Map.of("id", "a", "version", "1.0.0", "entry_reference", "x.A"), "test"));
        }
    }
}
