package com.apexframe.core;

import com.apexframe.api.action.InvocationResult;
import com.apexframe.api.event.EventChannel;
import com.apexframe.api.event.LifecycleEvents;
import com.apexframe.api.exception.ApexException;
import com.apexframe.api.exception.ErrorKind;
import com.apexframe.api.exception.LoadException;
import com.apexframe.api.exception.ManifestValidationException;
import com.apexframe.api.security.Permissions;
import com.apexframe.core.config.ApexFrameConfig;
import com.apexframe.core.discovery.DiscoveredExtension;
import com.apexframe.core.discovery.DiscoveryReport;
import com.apexframe.core.discovery.DuplicateIdWarning;
import com.apexframe.core.discovery.ExtensionDiscoveryService;
import com.apexframe.core.event.EventBus;
import com.apexframe.core.event.ScopedEventChannel;
import com.apexframe.core.isolation.ActionExecutorFactory;
import com.apexframe.core.lifecycle.BulkOperationReport;
import com.apexframe.core.lifecycle.ExtensionLifecycleManager;
import com.apexframe.core.loader.ExtensionLoader;
import com.apexframe.core.manifest.ExtensionManifest;
import com.apexframe.core.manifest.ManifestParser;
import com.apexframe.core.registry.ExtensionRegistry;
import com.apexframe.core.registry.LifecycleState;
import com.apexframe.core.registry.RegistryEntry;
import com.apexframe.core.security.ExtensionHandle;
import com.apexframe.core.security.ExtensionSecurityManager;
import com.apexframe.core.security.HostPolicy;
import com.apexframe.core.security.ViolationPolicy;
import com.apexframe.core.security.ViolationTracker;
import com.apexframe.core.state.FileStateStore;
import com.apexframe.core.stream.StreamReaper;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 扩展运行时
 * <p>
 * 职责：
 * 1. 组装注册表、加载器、安全管理器、状态存储与事件总线
 * 2. 扫描扩展根目录并注册发现的扩展
 * 3. 生命周期操作与批量操作的入口
 * 4. 为调用方提供受治理的 {@link ExtensionHandle}
 * </p>
 */
@Slf4j
public class ExtensionRuntime implements AutoCloseable {

    @Getter
    private final ApexFrameConfig config;
    @Getter
    private final EventBus eventBus;
    @Getter
    private final FileStateStore stateStore;
    @Getter
    private final ExtensionRegistry registry;
    @Getter
    private final ViolationTracker violationTracker;

    private final AtomicReference<HostPolicy> policy;
    private final ExtensionLoader loader;
    private final ExtensionSecurityManager securityManager;
    private final StreamReaper reaper;
    private final ActionExecutorFactory executorFactory;
    private final ExtensionLifecycleManager lifecycle;
    private final ExecutorService discoveryExecutor;
    private final ScopedEventChannel hostChannel;
    private final AtomicBoolean initialized = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public ExtensionRuntime(ApexFrameConfig config, HostPolicy policy) {
        this.config = config;
        this.policy = new AtomicReference<>(policy);
        this.eventBus = new EventBus();
        this.stateStore = new FileStateStore(config.getStateDir());
        this.registry = new ExtensionRegistry(stateStore::namespace);
        this.loader = new ExtensionLoader();
        this.securityManager = new ExtensionSecurityManager(this.policy::get);
        this.violationTracker = new ViolationTracker(eventBus, ViolationPolicy.logOnly());
        this.reaper = new StreamReaper(config.getReaperInterval());
        this.executorFactory = new ActionExecutorFactory(config, eventBus, config.getStateDir());
        this.lifecycle = new ExtensionLifecycleManager(registry, loader, securityManager, executorFactory,
                stateStore, eventBus, reaper, violationTracker);
        AtomicInteger counter = new AtomicInteger(0);
        this.discoveryExecutor = Executors.newFixedThreadPool(Math.max(2, Runtime.getRuntime().availableProcessors()),
                r -> {
                    Thread t = new Thread(r, "apexframe-discovery-" + counter.incrementAndGet());
                    t.setDaemon(true);
                    return t;
                });
        this.hostChannel = new ScopedEventChannel(LifecycleEvents.HOST_SOURCE, eventBus,
                () -> Set.of(Permissions.EVENT_EMIT, Permissions.EVENT_SUBSCRIBE));
    }

    /**
     * 准备状态存储并启动空闲流回收
     *
     * @throws ApexException FATAL，状态根目录不可用
     */
    public void init() {
        if (!initialized.compareAndSet(false, true)) {
            return;
        }
        try {
            stateStore.init();
        } catch (IOException e) {
            initialized.set(false);
            throw new ApexException(ErrorKind.FATAL, "State root " + config.getStateDir() + " is not usable", e);
        }
        reaper.start();
        log.info("ApexFrame runtime initialized (state: {}, roots: {})", config.getStateDir(),
                config.getExtensionRoots());
    }

    // ==================== 发现与注册 ====================

    /**
     * 扫描全部根目录并注册接受的扩展
     * <p>
     * 加载失败的扩展仍在注册表中（ERROR），不会中断扫描。
     * </p>
     */
    public DiscoveryReport discoverAndRegister() {
        ensureInitialized();
        ExtensionDiscoveryService discovery = new ExtensionDiscoveryService(config.getExtensionRoots(),
                discoveryExecutor);
        DiscoveryReport report = discovery.discover();
        List<DuplicateIdWarning> registryDuplicates = new ArrayList<>();
        for (DiscoveredExtension found : report.accepted()) {
            try {
                ExtensionRegistry.Registration registration = lifecycle.register(found.manifest(), found.directory());
                if (registration.isDuplicate()) {
                    registryDuplicates.add(registration.duplicate());
                }
            } catch (LoadException e) {
                log.warn("[{}] Registered in ERROR state: {}", found.id(), e.getMessage());
            }
        }
        return report.withRegistryDuplicates(registryDuplicates);
    }

    /**
     * 从单个扩展目录注册
     *
     * @throws ManifestValidationException 目录中没有有效清单
     */
    public ExtensionRegistry.Registration registerDirectory(Path directory) {
        Path manifestFile = ManifestParser.findManifest(directory)
                .orElseThrow(() -> new ManifestValidationException(directory.toString(),
                        List.of("no manifest file found (expected one of " + ManifestParser.MANIFEST_FILE_NAMES + ")")));
        return register(ManifestParser.parse(manifestFile), directory);
    }

    public ExtensionRegistry.Registration register(ExtensionManifest manifest, Path directory) {
        ensureInitialized();
        return lifecycle.register(manifest, directory);
    }

    // ==================== 生命周期 ====================

    public void initialize(String id) {
        lifecycle.initialize(id);
    }

    public void start(String id) {
        lifecycle.start(id);
    }

    public void stop(String id) {
        lifecycle.stop(id);
    }

    public void stop(String id, boolean force) {
        lifecycle.stop(id, force);
    }

    /**
     * 从原目录重新加载扩展并恢复到之前的阶段
     */
    public ExtensionRegistry.Registration reload(String id) {
        ensureInitialized();
        return lifecycle.reload(id, false);
    }

    public ExtensionRegistry.Registration reload(String id, boolean force) {
        ensureInitialized();
        return lifecycle.reload(id, force);
    }

    public void unload(String id) {
        lifecycle.unload(id);
    }

    public void uninstall(String id) {
        lifecycle.uninstall(id);
    }

    public BulkOperationReport initializeAll() {
        return lifecycle.initializeAll();
    }

    public BulkOperationReport startAll() {
        return lifecycle.startAll();
    }

    public BulkOperationReport stopAll() {
        return lifecycle.stopAll();
    }

    // ==================== 查询与调用 ====================

    public Optional<LifecycleState> stateOf(String id) {
        return registry.find(id).map(RegistryEntry::getState);
    }

    public List<RegistryEntry> extensions() {
        return registry.all();
    }

    /**
     * 获取调用句柄；句柄在每次调用时检查状态，可长期持有
     *
     * @throws com.apexframe.api.exception.ExtensionNotFoundException 未注册
     */
    public ExtensionHandle handle(String id) {
        return new ExtensionHandle(registry.get(id), securityManager, violationTracker, reaper,
                config.getStreamIdleTimeout(), config.getConcurrencyAcquireTimeout());
    }

    public InvocationResult invoke(String id, String action, Map<String, Object> input) {
        return handle(id).invoke(action, input);
    }

    /**
     * 宿主自身的事件通道，事件源为 {@value LifecycleEvents#HOST_SOURCE}
     */
    public EventChannel hostEvents() {
        return hostChannel;
    }

    /**
     * 替换宿主策略；只影响之后的 initialize
     */
    public void reloadPolicy(HostPolicy newPolicy) {
        policy.set(newPolicy);
        log.info("[AUDIT] Host policy replaced, applies to subsequent initializations");
    }

    public void setViolationPolicy(ViolationPolicy violationPolicy) {
        violationTracker.setPolicy(violationPolicy);
    }

    // ==================== 关闭 ====================

    /**
     * 按依赖逆序卸载全部扩展并释放运行时资源
     */
    public BulkOperationReport shutdown() {
        if (!closed.compareAndSet(false, true)) {
            return new BulkOperationReport("shutdown", List.of(), Map.of());
        }
        log.info("ApexFrame runtime shutting down...");
        BulkOperationReport report = lifecycle.shutdown();
        hostChannel.close();
        reaper.close();
        executorFactory.close();
        loader.close();
        discoveryExecutor.shutdownNow();
        log.info("ApexFrame runtime stopped");
        return report;
    }

    @Override
    public void close() {
        shutdown();
    }

    private void ensureInitialized() {
        if (!initialized.get()) {
            init();
        }
    }
}
