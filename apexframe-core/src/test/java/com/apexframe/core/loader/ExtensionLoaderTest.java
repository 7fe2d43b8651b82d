package com.apexframe.core.loader;

import com.apexframe.api.context.ExtensionContext;
import com.apexframe.api.exception.LoadException;
import com.apexframe.core.fixture.EchoExtension;
import com.apexframe.core.fixture.ExitingExtension;
import com.apexframe.core.fixture.ExtensionFixtures;
import com.apexframe.core.fixture.NotAnExtension;
import com.apexframe.core.fixture.ProcessSpawningExtension;
import com.apexframe.core.fixture.StreamingExtension;
import com.apexframe.core.manifest.EntryReference;
import com.apexframe.core.manifest.ExtensionManifest;
import com.apexframe.core.version.SemanticVersion;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("扩展加载器")
class ExtensionLoaderTest {

    @TempDir
    Path tempDir;

    @Mock
    private ExtensionContext context;

    private ExtensionLoader loader;
    private Path extDir;

    @BeforeEach
    void setUp() throws Exception {
        loader = new ExtensionLoader();
        extDir = Files.createDirectories(tempDir.resolve("ext"));
    }

    @AfterEach
    void tearDown() {
        loader.close();
    }

    private static ExtensionManifest manifest(String id, String entry) {
        return ExtensionManifest.builder()
                .id(id)
                .version(SemanticVersion.of(1, 0, 0))
                .entryReference(EntryReference.parse(entry))
                .build();
    }

    @Nested
    @DisplayName("实例化")
    class InstantiationTests {

        @Test
        @DisplayName("优先使用 (ExtensionContext) 构造器")
        void contextConstructor() {
            LoadedExtension loaded = loader.load(manifest("echo", EchoExtension.class.getName()), extDir, context);

            assertInstanceOf(EchoExtension.class, loaded.instance());
            assertTrue(loader.isLoaded("echo"));
            assertTrue(loaded.scanReport().requiredPermissions().isEmpty());
        }

        @Test
        @DisplayName("无参构造器")
        void noArgConstructor() {
            LoadedExtension loaded = loader.load(manifest("s", StreamingExtension.class.getName()), extDir, context);
            assertInstanceOf(StreamingExtension.class, loaded.instance());
        }

        @Test
        @DisplayName("入口类不存在或未实现接口时加载失败")
        void invalidEntry() {
            assertThrows(LoadException.class,
                    () -> loader.load(manifest("x", "com.example.DoesNotExist"), extDir, context));
            assertThrows(LoadException.class,
                    () -> loader.load(manifest("y", NotAnExtension.class.getName()), extDir, context));
            assertFalse(loader.isLoaded("x"));
            assertFalse(loader.isLoaded("y"));
        }

        @Test
        @DisplayName("代码单元不能越出扩展目录")
        void unitEscape() {
            assertThrows(LoadException.class,
                    () -> loader.load(manifest("z", "../outside.jar!" + EchoExtension.class.getName()), extDir,
                            context));
            assertThrows(LoadException.class,
                    () -> loader.load(manifest("z", "missing.jar!" + EchoExtension.class.getName()), extDir,
                            context));
        }
    }

    @Nested
    @DisplayName("隔离与扫描")
    class IsolationTests {

        @Test
        @DisplayName("代码单元内的类由扩展类加载器优先加载")
        void childFirst() {
            ExtensionFixtures.copyClass(extDir, EchoExtension.class);

            LoadedExtension loaded = loader.load(manifest("echo", EchoExtension.class.getName()), extDir, context);

            Class<?> loadedType = loaded.instance().getClass();
            assertEquals(EchoExtension.class.getName(), loadedType.getName());
            assertNotSame(EchoExtension.class, loadedType);
            assertInstanceOf(ExtensionClassLoader.class, loadedType.getClassLoader());
            assertSame(ExtensionContext.class, loadedType.getConstructors()[0].getParameterTypes()[0]);
        }

        @Test
        @DisplayName("清单声明的共享包改由宿主加载器定义")
        void sharedPackagesFromManifest() {
            ExtensionFixtures.copyClass(extDir, EchoExtension.class);
            ExtensionManifest shared = manifest("echo", EchoExtension.class.getName()).toBuilder()
                    .sharedPackage("com.apexframe.core.fixture.")
                    .build();

            LoadedExtension loaded = loader.load(shared, extDir, context);

            assertSame(EchoExtension.class, loaded.instance().getClass());
            ExtensionClassLoader classLoader = (ExtensionClassLoader) loaded.classLoader();
            assertTrue(classLoader.isShared(EchoExtension.class.getName()));
            assertTrue(classLoader.isShared("com.apexframe.api.extension.ApexExtension"));
            assertFalse(classLoader.isShared("com.apexframe.core.loader.CodeUnit"));
            assertNotNull(classLoader.getResource("com/apexframe/core/fixture/EchoExtension.class"));
        }

        @Test
        @DisplayName("调用 System.exit 的代码被拒绝加载")
        void forbiddenCall() {
            ExtensionFixtures.copyClass(extDir, ExitingExtension.class);

            LoadException e = assertThrows(LoadException.class,
                    () -> loader.load(manifest("exit", ExitingExtension.class.getName()), extDir, context));
            assertTrue(e.getMessage().contains("java/lang/System.exit"));
            assertFalse(loader.isLoaded("exit"));
        }

        @Test
        @DisplayName("扫描推导出代码所需权限")
        void requiredPermissions() {
            ExtensionFixtures.copyClass(extDir, ProcessSpawningExtension.class);

            LoadedExtension loaded = loader.load(manifest("proc", ProcessSpawningExtension.class.getName()),
                    extDir, context);

            assertTrue(loaded.scanReport().requiredPermissions().contains("system.execute"));
        }

        @Test
        @DisplayName("释放后重新加载得到新的类加载器")
        void release() {
            ExtensionFixtures.copyClass(extDir, EchoExtension.class);
            LoadedExtension first = loader.load(manifest("echo", EchoExtension.class.getName()), extDir, context);

            loader.release("echo");
            assertFalse(loader.isLoaded("echo"));

            LoadedExtension second = loader.load(manifest("echo", EchoExtension.class.getName()), extDir, context);
            assertNotSame(first.classLoader(), second.classLoader());
            assertNotSame(first.instance().getClass(), second.instance().getClass());
        }
    }
}
