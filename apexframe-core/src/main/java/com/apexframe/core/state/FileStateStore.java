package com.apexframe.core.state;

import com.apexframe.api.exception.PluginStateException;
import com.apexframe.api.state.StateAccess;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.jspecify.annotations.Nullable;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Stream;

/**
 * 基于文件的扩展状态存储
 * <p>
 * 布局：{root}/{extensionId}/{base64url(key)}.json，每个键一个 JSON 文档。
 * 编码后超过 {@value #MAX_ENCODED_LENGTH} 字符的键改用 ~{sha256(key)}.json，
 * 文档为 {"key": 原始键, "value": 值} 信封，keys() 从信封中还原键。
 * 写入先完成序列化，再写临时文件并原子替换目标文件。
 * </p>
 */
@Slf4j
public class FileStateStore {

    static final String SUFFIX = ".json";
    static final String DIGEST_PREFIX = "~";
    /** 文件系统单个文件名上限为 255 字节，保留余量 */
    static final int MAX_ENCODED_LENGTH = 200;
    private static final String TEMP_PREFIX = ".tmp-";
    private static final String ENVELOPE_KEY = "key";
    private static final String ENVELOPE_VALUE = "value";

    @Getter
    private final Path root;
    private final ObjectMapper mapper;

    public FileStateStore(Path root) {
        this(root, new ObjectMapper());
    }

    public FileStateStore(Path root, ObjectMapper mapper) {
        this.root = root.toAbsolutePath().normalize();
        this.mapper = mapper;
    }

    /**
     * 创建根目录并确认可写
     *
     * @throws IOException 根目录不可用
     */
    public void init() throws IOException {
        Files.createDirectories(root);
        if (!Files.isWritable(root)) {
            throw new IOException("State root is not writable: " + root);
        }
    }

    /**
     * 扩展的命名空间目录
     */
    public Path namespace(String extensionId) {
        return root.resolve(extensionId);
    }

    /**
     * 绑定到单个扩展的视图，扩展只能看到自己的键
     */
    public StateAccess access(String extensionId) {
        return new NamespacedStateAccess(this, extensionId);
    }

    public void save(String extensionId, String key, @Nullable Object value) {
        String fileName = fileName(key);
        byte[] document;
        try {
            if (isDigestName(fileName)) {
                Map<String, Object> envelope = new LinkedHashMap<>();
                envelope.put(ENVELOPE_KEY, key);
                envelope.put(ENVELOPE_VALUE, value);
                document = mapper.writeValueAsBytes(envelope);
            } else {
                document = mapper.writeValueAsBytes(value);
            }
        } catch (JsonProcessingException e) {
            throw new PluginStateException("[" + extensionId + "] value for key '" + key
                    + "' is not serializable: " + e.getOriginalMessage(), e);
        }

        Path dir = namespace(extensionId);
        Path target = dir.resolve(fileName);
        Path temp = null;
        try {
            Files.createDirectories(dir);
            temp = Files.createTempFile(dir, TEMP_PREFIX, ".part");
            Files.write(temp, document);
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            temp = null;
        } catch (IOException e) {
            throw new PluginStateException("[" + extensionId + "] failed to persist key '" + key + "'", e);
        } finally {
            if (temp != null) {
                try {
                    Files.deleteIfExists(temp);
                } catch (IOException e) {
                    log.warn("[{}] Failed to remove temp state file {}", extensionId, temp, e);
                }
            }
        }
    }

    public <T> @Nullable T load(String extensionId, String key, Class<T> type, @Nullable T defaultValue) {
        String fileName = fileName(key);
        Path file = namespace(extensionId).resolve(fileName);
        byte[] document;
        try {
            document = Files.readAllBytes(file);
        } catch (NoSuchFileException e) {
            return defaultValue;
        } catch (IOException e) {
            throw new PluginStateException("[" + extensionId + "] failed to read key '" + key + "'", e);
        }
        try {
            if (!isDigestName(fileName)) {
                return mapper.readValue(document, type);
            }
            JsonNode envelope = mapper.readTree(document);
            if (!key.equals(envelope.path(ENVELOPE_KEY).asText(null))) {
                log.warn("[{}] State file {} belongs to another key, treating '{}' as absent", extensionId,
                        fileName, key);
                return defaultValue;
            }
            return mapper.treeToValue(envelope.path(ENVELOPE_VALUE), type);
        } catch (IOException e) {
            throw new PluginStateException("[" + extensionId + "] corrupt state document for key '" + key + "': "
                    + new String(document, 0, Math.min(document.length, 64), StandardCharsets.UTF_8), e);
        }
    }

    public boolean delete(String extensionId, String key) {
        try {
            return Files.deleteIfExists(namespace(extensionId).resolve(fileName(key)));
        } catch (IOException e) {
            throw new PluginStateException("[" + extensionId + "] failed to delete key '" + key + "'", e);
        }
    }

    public boolean contains(String extensionId, String key) {
        return Files.isRegularFile(namespace(extensionId).resolve(fileName(key)));
    }

    public Set<String> keys(String extensionId) {
        Path dir = namespace(extensionId);
        Set<String> keys = new TreeSet<>();
        if (!Files.isDirectory(dir)) {
            return keys;
        }
        try (DirectoryStream<Path> files = Files.newDirectoryStream(dir, "*" + SUFFIX)) {
            for (Path file : files) {
                String name = file.getFileName().toString();
                if (name.startsWith(TEMP_PREFIX)) {
                    continue;
                }
                keys.add(isDigestName(name) ? envelopeKey(file) : keyOf(name));
            }
        } catch (IOException e) {
            throw new PluginStateException("[" + extensionId + "] failed to list state keys", e);
        }
        return keys;
    }

    /**
     * 删除扩展的全部状态（卸载安装时调用）
     */
    public void purge(String extensionId) {
        Path dir = namespace(extensionId);
        if (!Files.exists(dir)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(dir)) {
            for (Path path : (Iterable<Path>) walk.sorted(Comparator.reverseOrder())::iterator) {
                Files.deleteIfExists(path);
            }
            log.info("[{}] State namespace purged", extensionId);
        } catch (IOException e) {
            throw new PluginStateException("[" + extensionId + "] failed to purge state namespace", e);
        }
    }

    static String fileName(String key) {
        if (key == null || key.isEmpty()) {
            throw new PluginStateException("State key must not be empty");
        }
        byte[] raw = key.getBytes(StandardCharsets.UTF_8);
        String encoded = Base64.getUrlEncoder().withoutPadding().encodeToString(raw);
        if (encoded.length() <= MAX_ENCODED_LENGTH) {
            return encoded + SUFFIX;
        }
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(raw);
            return DIGEST_PREFIX + HexFormat.of().formatHex(digest) + SUFFIX;
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }

    static boolean isDigestName(String fileName) {
        return fileName.startsWith(DIGEST_PREFIX);
    }

    static String keyOf(String fileName) {
        String encoded = fileName.substring(0, fileName.length() - SUFFIX.length());
        return new String(Base64.getUrlDecoder().decode(encoded), StandardCharsets.UTF_8);
    }

    private String envelopeKey(Path file) throws IOException {
        String key = mapper.readTree(file.toFile()).path(ENVELOPE_KEY).asText(null);
        if (key == null) {
            throw new IOException("State envelope " + file + " has no key");
        }
        return key;
    }
}
