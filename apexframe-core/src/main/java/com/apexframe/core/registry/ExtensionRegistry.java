package com.apexframe.core.registry;

import com.apexframe.api.exception.ExtensionNotFoundException;
import com.apexframe.core.discovery.DuplicateIdWarning;
import com.apexframe.core.manifest.ExtensionManifest;
import com.apexframe.core.version.SemanticVersion;
import lombok.extern.slf4j.Slf4j;
import org.jspecify.annotations.Nullable;

import java.nio.file.Path;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;

/**
 * 扩展注册表：id -> 条目
 * <p>
 * 注册提交串行化；UNLOADED 墓碑可被同 ID 的新注册替换。
 * </p>
 */
@Slf4j
public class ExtensionRegistry {

    private final Map<String, RegistryEntry> entries = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();
    private final Object registrationLock = new Object();
    private final Function<String, Path> namespaceResolver;

    /**
     * @param namespaceResolver 扩展 ID -> 状态命名空间目录
     */
    public ExtensionRegistry(Function<String, Path> namespaceResolver) {
        this.namespaceResolver = namespaceResolver;
    }

    /**
     * 注册结果：新条目、同路径的既有条目或重复项
     */
    public record Registration(RegistryEntry entry, boolean created, @Nullable DuplicateIdWarning duplicate) {

        public boolean isDuplicate() {
            return duplicate != null;
        }
    }

    /**
     * 提交注册
     * <p>
     * 新建的条目在放入注册表之前已被加锁，调用方完成加载后负责解锁；
     * 其他线程对该条目的迁移会等待加载结束。
     * </p>
     */
    public Registration register(ExtensionManifest manifest, Path directory) {
        Path dir = directory.toAbsolutePath().normalize();
        synchronized (registrationLock) {
            RegistryEntry existing = entries.get(manifest.getId());
            if (existing != null && existing.getState() != LifecycleState.UNLOADED) {
                if (existing.getDirectory().equals(dir)) {
                    log.debug("[{}] Already registered from {}, skipping", manifest.getId(), dir);
                    return new Registration(existing, false, null);
                }
                DuplicateIdWarning warning = new DuplicateIdWarning(manifest.getId(),
                        existing.getVersion(), existing.getDirectory(),
                        manifest.getVersionString(), dir);
                log.warn(warning.describe());
                return new Registration(existing, false, warning);
            }
            if (existing != null) {
                log.info("[{}] Replacing unloaded tombstone ({}) with {}", manifest.getId(), existing.getVersion(),
                        manifest.getVersionString());
            }
            RegistryEntry entry = new RegistryEntry(manifest, dir,
                    namespaceResolver.apply(manifest.getId()), sequence.incrementAndGet());
            entry.getLock().lock();
            entries.put(manifest.getId(), entry);
            log.info("[{}] Registered version {} from {}", manifest.getId(), manifest.getVersionString(), dir);
            return new Registration(entry, true, null);
        }
    }

    public Optional<RegistryEntry> find(String id) {
        return Optional.ofNullable(entries.get(id));
    }

    public RegistryEntry get(String id) {
        RegistryEntry entry = entries.get(id);
        if (entry == null) {
            throw new ExtensionNotFoundException(id);
        }
        return entry;
    }

    /**
     * 全部条目（含墓碑），按注册顺序
     */
    public List<RegistryEntry> all() {
        return entries.values().stream()
                .sorted(Comparator.comparingLong(RegistryEntry::getRegistrationOrder))
                .toList();
    }

    public List<String> idsInState(LifecycleState state) {
        return all().stream().filter(e -> e.getState() == state).map(RegistryEntry::getId).toList();
    }

    /**
     * 处于 INITIALIZED 或 STARTED 的 (id -> version)，供启动依赖检查使用
     */
    public Map<String, SemanticVersion> activeVersions() {
        Map<String, SemanticVersion> result = new LinkedHashMap<>();
        for (RegistryEntry entry : all()) {
            if (entry.getState().isActive()) {
                result.put(entry.getId(), entry.getManifest().getVersion());
            }
        }
        return result;
    }

    /**
     * 除墓碑外的全部 (id -> version)
     */
    public Map<String, SemanticVersion> registeredVersions() {
        Map<String, SemanticVersion> result = new LinkedHashMap<>();
        for (RegistryEntry entry : all()) {
            if (entry.getState() != LifecycleState.UNLOADED) {
                result.put(entry.getId(), entry.getManifest().getVersion());
            }
        }
        return result;
    }

    public int size() {
        return entries.size();
    }
}
