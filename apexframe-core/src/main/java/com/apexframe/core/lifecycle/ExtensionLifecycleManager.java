package com.apexframe.core.lifecycle;

import com.apexframe.api.context.ExtensionContext;
import com.apexframe.api.event.ExtensionEvent;
import com.apexframe.api.event.LifecycleEvents;
import com.apexframe.api.exception.ApexException;
import com.apexframe.api.exception.DependencyResolutionException;
import com.apexframe.api.exception.IllegalTransitionException;
import com.apexframe.api.exception.LoadException;
import com.apexframe.api.exception.ManifestValidationException;
import com.apexframe.api.exception.PluginStateException;
import com.apexframe.api.extension.ApexExtension;
import com.apexframe.core.context.CoreExtensionContext;
import com.apexframe.core.event.EventBus;
import com.apexframe.core.event.ScopedEventChannel;
import com.apexframe.core.isolation.ActionExecutor;
import com.apexframe.core.isolation.ActionExecutorFactory;
import com.apexframe.core.loader.ExtensionLoader;
import com.apexframe.core.loader.LoadedExtension;
import com.apexframe.core.manifest.ExtensionManifest;
import com.apexframe.core.manifest.ManifestParser;
import com.apexframe.core.registry.ExtensionRegistry;
import com.apexframe.core.registry.LifecycleState;
import com.apexframe.core.registry.RegistryEntry;
import com.apexframe.core.security.ExtensionSecurityManager;
import com.apexframe.core.security.PermissionGrant;
import com.apexframe.core.security.PolicyDecision;
import com.apexframe.core.security.ViolationTracker;
import com.apexframe.core.state.FileStateStore;
import com.apexframe.core.stream.StreamReaper;
import com.apexframe.core.version.DependencyCheck;
import com.apexframe.core.version.DependencyGraph;
import com.apexframe.core.version.SemanticVersion;
import com.apexframe.core.version.VersionResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Semaphore;
import java.util.function.Consumer;

/**
 * 扩展生命周期管理器
 * <p>
 * 状态机：REGISTERED -> INITIALIZED -> STARTED <-> STOPPED，任意状态 -> UNLOADED，钩子失败 -> ERROR。
 * 每个条目的迁移由其自身的锁串行化，不同条目可并发迁移。
 * 每次成功迁移（以及进入 ERROR）都会在事件总线上发布 extension.* 事件。
 * </p>
 */
@Slf4j
@RequiredArgsConstructor
public class ExtensionLifecycleManager {

    private final ExtensionRegistry registry;
    private final ExtensionLoader loader;
    private final ExtensionSecurityManager securityManager;
    private final ActionExecutorFactory executorFactory;
    private final FileStateStore stateStore;
    private final EventBus eventBus;
    private final StreamReaper reaper;
    private final ViolationTracker violations;

    // ==================== 注册 ====================

    /**
     * 注册并加载扩展
     * <p>
     * 加载失败时条目仍被记录，处于 ERROR 状态。
     * </p>
     *
     * @throws LoadException 代码单元、入口类或构造失败
     */
    public ExtensionRegistry.Registration register(ExtensionManifest manifest, Path directory) {
        ExtensionRegistry.Registration registration = registry.register(manifest, directory);
        if (!registration.created()) {
            return registration;
        }
        // 注册表交回的新条目已加锁
        RegistryEntry entry = registration.entry();
        try {
            load(entry);
        } finally {
            entry.getLock().unlock();
        }
        return registration;
    }

    private void load(RegistryEntry entry) {
        String id = entry.getId();
        ScopedEventChannel channel = new ScopedEventChannel(id, eventBus, entry::grantedPermissions);
        ExtensionContext context = new CoreExtensionContext(entry.getManifest(), stateStore.access(id), channel);
        entry.setChannel(channel);
        entry.setContext(context);
        try {
            LoadedExtension loaded = loader.load(entry.getManifest(), entry.getDirectory(), context);
            entry.setInstance(loaded.instance());
            entry.setClassLoader(loaded.classLoader());
            entry.setScanReport(loaded.scanReport());
        } catch (LoadException e) {
            log.error("[{}] Load failed: {}", id, e.getMessage());
            toError(entry, "load", e);
            throw e;
        }
        publish(entry, LifecycleEvents.REGISTERED, null);
    }

    // ==================== 状态迁移 ====================

    /**
     * REGISTERED -> INITIALIZED
     *
     * @throws com.apexframe.api.exception.PermissionDeniedException 权限未被授予，状态保持 REGISTERED
     * @throws PluginStateException                                   onInitialize 失败，状态变为 ERROR
     */
    public void initialize(String id) {
        RegistryEntry entry = registry.get(id);
        entry.getLock().lock();
        try {
            requireState(entry, "initialize", LifecycleState.REGISTERED);
            ExtensionManifest manifest = entry.getManifest();
            PolicyDecision decision = securityManager.decide(manifest);
            PermissionGrant grant = securityManager.authorize(manifest, entry.getScanReport(), decision);
            entry.setGrant(grant);
            entry.setLimits(decision.limits());
            entry.setTrusted(decision.trusted());

            runHook(entry, "onInitialize", instance -> instance.onInitialize(entry.getContext()));
            transition(entry, LifecycleState.INITIALIZED, LifecycleEvents.INITIALIZED);
        } finally {
            entry.getLock().unlock();
        }
    }

    /**
     * INITIALIZED | STOPPED -> STARTED
     * <p>
     * 依赖必须已处于 INITIALIZED 或 STARTED 且版本满足范围；不会自动启动依赖。
     * </p>
     *
     * @throws DependencyResolutionException 依赖不满足，状态不变
     */
    public void start(String id) {
        RegistryEntry entry = registry.get(id);
        entry.getLock().lock();
        try {
            requireState(entry, "start", LifecycleState.INITIALIZED, LifecycleState.STOPPED);
            ExtensionManifest manifest = entry.getManifest();

            Map<String, SemanticVersion> active = new LinkedHashMap<>(registry.activeVersions());
            active.remove(id);
            List<DependencyCheck> checks = VersionResolver.resolve(active, manifest.getDependencies());
            List<String> unsatisfied = checks.stream()
                    .filter(c -> !c.isSatisfied())
                    .map(DependencyCheck::describe)
                    .toList();
            if (!unsatisfied.isEmpty()) {
                log.warn("[{}] Cannot start, unsatisfied dependencies: {}", id, unsatisfied);
                throw new DependencyResolutionException(id, unsatisfied);
            }

            ActionExecutor executor = executorFactory.create(manifest, entry.getDirectory(), entry.getInstance(),
                    entry.getClassLoader(), entry.grantedPermissions(), entry.getLimits(), entry.isTrusted());
            try {
                runHook(entry, "onStart", ApexExtension::onStart);
            } catch (RuntimeException e) {
                executor.close();
                throw e;
            }
            entry.setExecutor(executor);
            entry.setBulkhead(new Semaphore(Math.max(1, entry.getLimits().getMaxConcurrency())));
            log.info("[{}] Actions run {} (limits: {})", id, executor.mode(), entry.getLimits());
            transition(entry, LifecycleState.STARTED, LifecycleEvents.STARTED);
        } finally {
            entry.getLock().unlock();
        }
    }

    /**
     * STARTED -> STOPPED；仍有已启动的依赖方时拒绝
     *
     * @throws DependencyResolutionException 存在已启动的依赖方，状态不变
     */
    public void stop(String id) {
        stop(id, false);
    }

    /**
     * STARTED -> STOPPED；持久化状态与注册表条目保留
     *
     * @param force 为 true 时忽略仍在运行的依赖方
     * @throws DependencyResolutionException 未强制且存在已启动的依赖方，状态不变
     */
    public void stop(String id, boolean force) {
        RegistryEntry entry = registry.get(id);
        entry.getLock().lock();
        try {
            requireState(entry, "stop", LifecycleState.STARTED);
            List<String> dependents = startedDependentsOf(id);
            if (!dependents.isEmpty()) {
                if (!force) {
                    log.warn("[{}] Refusing to stop, started dependents: {}", id, dependents);
                    throw DependencyResolutionException.dependentsRunning(id, dependents);
                }
                log.warn("[{}] Forced stop while started dependents remain: {}", id, dependents);
            }
            deactivate(entry);
            runHook(entry, "onStop", ApexExtension::onStop);
            transition(entry, LifecycleState.STOPPED, LifecycleEvents.STOPPED);
        } finally {
            entry.getLock().unlock();
        }
    }

    /**
     * 从原目录重新读取清单并重新加载，随后恢复到重载前的阶段
     *
     * @see #reload(String, boolean)
     */
    public ExtensionRegistry.Registration reload(String id) {
        return reload(id, false);
    }

    /**
     * 重新加载扩展
     * <p>
     * 清单先于卸载解析，清单无效时旧实例保持不变。STARTED 的扩展先停止（遵循依赖方检查），
     * 再卸载、按同一目录重新注册，然后恢复到原阶段：INITIALIZED / STOPPED 恢复为 INITIALIZED，
     * STARTED 恢复为 STARTED，其余为 REGISTERED。持久化状态保留。
     * </p>
     *
     * @param force 停止时忽略仍在运行的依赖方
     * @throws IllegalTransitionException    条目已卸载
     * @throws DependencyResolutionException 未强制且存在已启动的依赖方，旧实例保持运行
     */
    public ExtensionRegistry.Registration reload(String id, boolean force) {
        RegistryEntry previous = registry.get(id);
        LifecycleState stage = previous.getState();
        if (stage == LifecycleState.UNLOADED) {
            throw new IllegalTransitionException(id, stage.name(), "reload");
        }
        Path directory = previous.getDirectory();
        ExtensionManifest manifest = readManifest(id, directory);

        if (stage == LifecycleState.STARTED) {
            stop(id, force);
        }
        unload(id);
        log.info("[{}] Reloading from {} (was {})", id, directory, stage);

        ExtensionRegistry.Registration registration = register(manifest, directory);
        if (stage == LifecycleState.INITIALIZED || stage == LifecycleState.STOPPED
                || stage == LifecycleState.STARTED) {
            initialize(id);
        }
        if (stage == LifecycleState.STARTED) {
            start(id);
        }
        log.info("[{}] Reloaded version {}, now {}", id, manifest.getVersionString(),
                registry.get(id).getState());
        return registration;
    }

    private static ExtensionManifest readManifest(String id, Path directory) {
        Path manifestFile = ManifestParser.findManifest(directory)
                .orElseThrow(() -> new ManifestValidationException(directory.toString(),
                        List.of("no manifest file found (expected one of " + ManifestParser.MANIFEST_FILE_NAMES + ")")));
        ExtensionManifest manifest = ManifestParser.parse(manifestFile);
        if (!manifest.getId().equals(id)) {
            throw new ManifestValidationException(manifestFile.toString(),
                    List.of("id changed from '" + id + "' to '" + manifest.getId() + "'"));
        }
        return manifest;
    }

    /**
     * 任意状态 -> UNLOADED（STARTED 时先停止）
     * <p>
     * 幂等：已卸载或未知 ID 直接返回。
     * </p>
     */
    public void unload(String id) {
        Optional<RegistryEntry> found = registry.find(id);
        if (found.isEmpty()) {
            log.debug("[{}] Unload requested for unknown extension, nothing to do", id);
            return;
        }
        RegistryEntry entry = found.get();
        entry.getLock().lock();
        try {
            if (entry.getState() == LifecycleState.UNLOADED) {
                return;
            }
            boolean wasStarted = entry.getState() == LifecycleState.STARTED;
            deactivate(entry);
            if (wasStarted) {
                quietHook(entry, "onStop", ApexExtension::onStop);
            }
            if (entry.getInstance() != null) {
                quietHook(entry, "onUnload", ApexExtension::onUnload);
            }
            release(entry);
            transition(entry, LifecycleState.UNLOADED, LifecycleEvents.UNLOADED);
        } finally {
            entry.getLock().unlock();
        }
    }

    /**
     * 卸载并删除扩展的全部持久化状态
     */
    public void uninstall(String id) {
        unload(id);
        stateStore.purge(id);
        log.info("[{}] Uninstalled", id);
    }

    // ==================== 批量操作 ====================

    public BulkOperationReport initializeAll() {
        List<String> succeeded = new ArrayList<>();
        Map<String, String> failed = new LinkedHashMap<>();
        for (String id : registry.idsInState(LifecycleState.REGISTERED)) {
            attempt(id, this::initialize, succeeded, failed);
        }
        return report("initializeAll", succeeded, failed);
    }

    /**
     * 按依赖顺序启动全部 INITIALIZED / STOPPED 扩展；循环依赖成员记为失败
     */
    public BulkOperationReport startAll() {
        List<String> succeeded = new ArrayList<>();
        Map<String, String> failed = new LinkedHashMap<>();
        DependencyGraph.Ordering ordering = graph().startupOrder();
        for (String id : ordering.cyclic()) {
            if (isStartable(id)) {
                failed.put(id, "dependency cycle among " + ordering.cyclic());
            }
        }
        for (String id : ordering.order()) {
            if (isStartable(id)) {
                attempt(id, this::start, succeeded, failed);
            }
        }
        return report("startAll", succeeded, failed);
    }

    /**
     * 按依赖逆序停止全部 STARTED 扩展
     */
    public BulkOperationReport stopAll() {
        List<String> succeeded = new ArrayList<>();
        Map<String, String> failed = new LinkedHashMap<>();
        for (String id : graph().shutdownOrder()) {
            if (registry.find(id).map(e -> e.getState() == LifecycleState.STARTED).orElse(false)) {
                attempt(id, target -> stop(target, true), succeeded, failed);
            }
        }
        return report("stopAll", succeeded, failed);
    }

    /**
     * 按依赖逆序把所有条目卸载到 UNLOADED
     */
    public BulkOperationReport shutdown() {
        List<String> succeeded = new ArrayList<>();
        Map<String, String> failed = new LinkedHashMap<>();
        for (String id : graph().shutdownOrder()) {
            attempt(id, this::unload, succeeded, failed);
        }
        return report("shutdown", succeeded, failed);
    }

    // ==================== 内部方法 ====================

    private DependencyGraph graph() {
        List<ExtensionManifest> manifests = registry.all().stream()
                .filter(e -> e.getState() != LifecycleState.UNLOADED)
                .map(RegistryEntry::getManifest)
                .toList();
        return new DependencyGraph(manifests);
    }

    private boolean isStartable(String id) {
        return registry.find(id)
                .map(e -> e.getState() == LifecycleState.INITIALIZED || e.getState() == LifecycleState.STOPPED)
                .orElse(false);
    }

    private List<String> startedDependentsOf(String id) {
        return registry.all().stream()
                .filter(e -> e.getState() == LifecycleState.STARTED)
                .filter(e -> e.getManifest().getDependencies().stream().anyMatch(d -> d.pluginId().equals(id)))
                .map(RegistryEntry::getId)
                .toList();
    }

    private void attempt(String id, Consumer<String> operation,
                         List<String> succeeded, Map<String, String> failed) {
        try {
            operation.accept(id);
            succeeded.add(id);
        } catch (ApexException e) {
            failed.put(id, e.getKind() + ": " + e.getMessage());
        } catch (RuntimeException e) {
            log.error("[{}] Unexpected failure in bulk operation", id, e);
            failed.put(id, e.toString());
        }
    }

    private BulkOperationReport report(String operation, List<String> succeeded, Map<String, String> failed) {
        BulkOperationReport report = new BulkOperationReport(operation, succeeded, failed);
        if (report.isAllSucceeded()) {
            log.info("{} finished: {} succeeded", operation, succeeded.size());
        } else {
            log.warn("{} finished: {} succeeded, {} failed {}", operation, succeeded.size(), failed.size(),
                    failed.keySet());
        }
        return report;
    }

    private void requireState(RegistryEntry entry, String operation, LifecycleState... allowed) {
        if (Arrays.asList(allowed).contains(entry.getState())) {
            return;
        }
        throw new IllegalTransitionException(entry.getId(), entry.getState().name(), operation);
    }

    private void transition(RegistryEntry entry, LifecycleState target, String eventType) {
        LifecycleState from = entry.getState();
        entry.setState(target);
        log.info("[{}] {} -> {}", entry.getId(), from, target);
        publish(entry, eventType, from);
    }

    /**
     * 停止接受调用：取消开放的流并关闭执行器
     */
    private void deactivate(RegistryEntry entry) {
        reaper.cancelAll(entry.getId());
        ActionExecutor executor = entry.getExecutor();
        entry.setExecutor(null);
        entry.setBulkhead(null);
        if (executor != null) {
            executor.close();
        }
    }

    private void release(RegistryEntry entry) {
        String id = entry.getId();
        reaper.cancelAll(id);
        ScopedEventChannel channel = entry.getChannel();
        if (channel != null) {
            channel.close();
        }
        loader.release(id);
        violations.reset(id);
        entry.setInstance(null);
        entry.setClassLoader(null);
        entry.setContext(null);
        entry.setChannel(null);
    }

    private void runHook(RegistryEntry entry, String hook, HookCall call) {
        try {
            invokeHook(entry, call);
        } catch (Exception e) {
            log.error("[{}] {} failed", entry.getId(), hook, e);
            toError(entry, hook, e);
            throw new PluginStateException("Extension [" + entry.getId() + "] " + hook + " failed: " + e, e);
        }
    }

    private void quietHook(RegistryEntry entry, String hook, HookCall call) {
        try {
            invokeHook(entry, call);
        } catch (Exception e) {
            log.warn("[{}] {} failed during unload, continuing", entry.getId(), hook, e);
        }
    }

    private void invokeHook(RegistryEntry entry, HookCall call) throws Exception {
        ApexExtension instance = entry.getInstance();
        if (instance == null) {
            throw new PluginStateException("Extension [" + entry.getId() + "] has no loaded instance");
        }
        Thread current = Thread.currentThread();
        ClassLoader previous = current.getContextClassLoader();
        if (entry.getClassLoader() != null) {
            current.setContextClassLoader(entry.getClassLoader());
        }
        try {
            call.apply(instance);
        } finally {
            current.setContextClassLoader(previous);
        }
    }

    private void toError(RegistryEntry entry, String during, Exception e) {
        LifecycleState from = entry.getState();
        entry.setLastError(during + ": " + e.getMessage());
        entry.setState(LifecycleState.ERROR);
        Map<String, Object> payload = basePayload(entry, from);
        payload.put("during", during);
        payload.put("error", String.valueOf(e.getMessage()));
        eventBus.publish(new ExtensionEvent(LifecycleEvents.ERROR, entry.getId(), payload));
    }

    private void publish(RegistryEntry entry, String eventType, LifecycleState from) {
        eventBus.publish(new ExtensionEvent(eventType, entry.getId(), basePayload(entry, from)));
    }

    private Map<String, Object> basePayload(RegistryEntry entry, LifecycleState from) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("version", entry.getVersion());
        payload.put("state", entry.getState().name());
        if (from != null) {
            payload.put("from", from.name());
        }
        return payload;
    }

    @FunctionalInterface
    private interface HookCall {
        void apply(ApexExtension instance) throws Exception;
    }
}
