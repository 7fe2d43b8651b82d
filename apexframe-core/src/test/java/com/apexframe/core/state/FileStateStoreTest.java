package com.apexframe.core.state;

import com.apexframe.api.exception.PluginStateException;
import com.apexframe.api.state.StateAccess;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("FileStateStore 持久化状态")
class FileStateStoreTest {

    @TempDir
    Path tempDir;

    private FileStateStore store;

    @BeforeEach
    void setUp() throws Exception {
        store = new FileStateStore(tempDir.resolve("state"));
        store.init();
    }

    @Nested
    @DisplayName("基本读写")
    class ReadWriteTests {

        @Test
        @DisplayName("保存后可读取，缺失的键返回默认值")
        void saveAndLoad() {
            store.save("a", "config", Map.of("mode", "fast", "level", 3));

            @SuppressWarnings("unchecked")
            Map<String, Object> loaded = store.load("a", "config", Map.class, null);
            assertEquals("fast", loaded.get("mode"));
            assertEquals(3, loaded.get("level"));
            assertEquals("fallback", store.load("a", "absent", String.class, "fallback"));
        }

        @Test
        @DisplayName("键可以包含任意字符")
        void arbitraryKeys() {
            store.save("a", "../../escape/key", 1);
            store.save("a", "中文 key", 2);

            assertEquals(Set.of("../../escape/key", "中文 key"), store.keys("a"));
            assertEquals(1, store.load("a", "../../escape/key", Integer.class, 0));
            assertFalse(Files.exists(tempDir.resolve("escape")));
        }

        @Test
        @DisplayName("超长的键以摘要命名文件，仍可读取、列出和删除")
        void longKeys() throws Exception {
            String longKey = "k".repeat(200);
            String otherLongKey = "键".repeat(120);
            store.save("a", longKey, 1);
            store.save("a", otherLongKey, Map.of("nested", List.of(1, 2)));
            store.save("a", longKey, 2);

            assertEquals(2, store.load("a", longKey, Integer.class, 0));
            @SuppressWarnings("unchecked")
            Map<String, Object> nested = store.load("a", otherLongKey, Map.class, null);
            assertEquals(List.of(1, 2), nested.get("nested"));
            assertEquals(Set.of(longKey, otherLongKey), store.keys("a"));
            try (Stream<Path> files = Files.list(store.namespace("a"))) {
                assertTrue(files.allMatch(f -> f.getFileName().toString().length() < 255));
            }

            assertTrue(store.delete("a", longKey));
            assertEquals(0, store.load("a", longKey, Integer.class, 0));
            assertEquals(Set.of(otherLongKey), store.keys("a"));
        }

        @Test
        @DisplayName("删除与存在性检查")
        void deleteAndContains() {
            store.save("a", "k", "v");
            assertTrue(store.contains("a", "k"));
            assertTrue(store.delete("a", "k"));
            assertFalse(store.contains("a", "k"));
            assertFalse(store.delete("a", "k"));
        }

        @Test
        @DisplayName("无法序列化的值被拒绝且不留下文件")
        void unserializableValue() {
            assertThrows(PluginStateException.class, () -> store.save("a", "k", new Object()));
            assertTrue(store.keys("a").isEmpty());
        }

        @Test
        @DisplayName("损坏的文档读取时报错")
        void corruptDocument() throws Exception {
            store.save("a", "k", "v");
            Files.writeString(store.namespace("a").resolve(FileStateStore.fileName("k")), "{not json");
            assertThrows(PluginStateException.class, () -> store.load("a", "k", String.class, null));
        }
    }

    @Nested
    @DisplayName("命名空间隔离")
    class NamespaceTests {

        @Test
        @DisplayName("扩展只能看到自己的键")
        void isolatedViews() {
            StateAccess a = store.access("a");
            StateAccess b = store.access("b");
            a.save("shared-name", "from-a");
            b.save("shared-name", "from-b");

            assertEquals("from-a", a.load("shared-name", String.class, null));
            assertEquals("from-b", b.load("shared-name", String.class, null));
            assertEquals(Set.of("shared-name"), a.keys());
        }

        @Test
        @DisplayName("purge 删除整个命名空间")
        void purge() {
            store.save("a", "k1", 1);
            store.save("a", "k2", 2);
            store.save("b", "k1", 1);

            store.purge("a");

            assertFalse(Files.exists(store.namespace("a")));
            assertTrue(store.keys("a").isEmpty());
            assertTrue(store.contains("b", "k1"));
        }
    }

    @Test
    @DisplayName("并发写入不同键互不干扰")
    void concurrentDistinctKeys() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch go = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < 32; i++) {
                int n = i;
                futures.add(pool.submit(() -> {
                    go.await();
                    store.save("a", "key-" + n, n);
                    return null;
                }));
            }
            go.countDown();
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(32, store.keys("a").size());
        for (int i = 0; i < 32; i++) {
            assertEquals(i, store.load("a", "key-" + i, Integer.class, -1));
        }
    }

    @Test
    @DisplayName("并发覆盖同一键总能读到完整文档")
    void concurrentSameKey() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 20; i++) {
                int n = i;
                futures.add(pool.submit(() -> store.save("a", "hot", Map.of("n", n, "pad", "x".repeat(4096)))));
                futures.add(pool.submit(() -> store.load("a", "hot", Map.class, null)));
            }
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }
        assertNotNull(store.load("a", "hot", Map.class, null));
    }
}
