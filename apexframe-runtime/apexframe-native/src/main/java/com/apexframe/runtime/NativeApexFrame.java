package com.apexframe.runtime;

import com.apexframe.api.exception.ApexException;
import com.apexframe.api.exception.ErrorKind;
import com.apexframe.core.ExtensionRuntime;
import com.apexframe.core.config.ApexFrameConfig;
import com.apexframe.core.config.ApexFrameConfigLoader;
import com.apexframe.core.discovery.DiscoveryReport;
import com.apexframe.core.discovery.RejectedExtension;
import com.apexframe.core.lifecycle.BulkOperationReport;
import com.apexframe.core.security.HostPolicy;
import com.apexframe.core.security.HostPolicyLoader;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * ApexFrame Native 启动器
 * 宿主应用通过此类一键启动运行时：加载配置与策略，扫描扩展，初始化并按依赖顺序启动
 */
@Slf4j
public class NativeApexFrame {

    public static final String DEFAULT_CONFIG_FILE = "apexframe.yml";

    private static final AtomicBoolean started = new AtomicBoolean(false);
    private static ExtensionRuntime GLOBAL_RUNTIME;
    private static Thread SHUTDOWN_HOOK;

    /**
     * 启动 ApexFrame (工作目录下的 apexframe.yml，缺失时使用默认配置)
     */
    public static synchronized ExtensionRuntime start() {
        Path configFile = Paths.get(DEFAULT_CONFIG_FILE);
        return start(Files.exists(configFile) ? loadConfig(configFile) : ApexFrameConfig.defaults());
    }

    /**
     * 启动 ApexFrame (自定义配置，策略从配置中的 policy_file 读取)
     */
    public static synchronized ExtensionRuntime start(ApexFrameConfig config) {
        return start(config, loadPolicy(config));
    }

    /**
     * 启动 ApexFrame (自定义配置与策略)
     */
    public static synchronized ExtensionRuntime start(ApexFrameConfig config, HostPolicy policy) {
        if (started.get()) {
            log.warn("ApexFrame is already started.");
            return GLOBAL_RUNTIME;
        }

        long start = System.currentTimeMillis();
        log.info("Starting ApexFrame Native Runtime...");

        ExtensionRuntime runtime = new ExtensionRuntime(config, policy);
        runtime.init();

        DiscoveryReport report = runtime.discoverAndRegister();
        for (RejectedExtension rejected : report.rejected()) {
            log.warn("Rejected extension at {}: {}", rejected.directory(), rejected.problems());
        }
        BulkOperationReport initialized = runtime.initializeAll();
        BulkOperationReport startedReport = runtime.startAll();

        SHUTDOWN_HOOK = new Thread(() -> {
            log.info("ApexFrame shutting down...");
            runtime.shutdown();
        }, "apexframe-shutdown");
        Runtime.getRuntime().addShutdownHook(SHUTDOWN_HOOK);

        GLOBAL_RUNTIME = runtime;
        started.set(true);

        log.info("ApexFrame Native started in {} ms. Registered: {}, initialized: {}, started: {}",
                System.currentTimeMillis() - start, runtime.getRegistry().size(),
                initialized.succeeded().size(), startedReport.succeeded().size());
        return runtime;
    }

    /**
     * 获取已启动的运行时
     */
    public static ExtensionRuntime getRuntime() {
        if (!started.get()) {
            throw new IllegalStateException("ApexFrame not started");
        }
        return GLOBAL_RUNTIME;
    }

    /**
     * 主动关闭运行时并移除关闭钩子
     */
    public static synchronized void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }
        try {
            Runtime.getRuntime().removeShutdownHook(SHUTDOWN_HOOK);
        } catch (IllegalStateException e) {
            // JVM 正在关闭，钩子会自行执行
            log.debug("Shutdown already in progress");
        }
        GLOBAL_RUNTIME.shutdown();
        GLOBAL_RUNTIME = null;
        SHUTDOWN_HOOK = null;
    }

    public static void main(String[] args) throws InterruptedException {
        ExtensionRuntime runtime = args.length > 0 ? start(loadConfig(Paths.get(args[0]))) : start();
        log.info("ApexFrame running with {} extensions, press Ctrl+C to exit", runtime.getRegistry().size());
        Thread.currentThread().join();
    }

    static ApexFrameConfig loadConfig(Path file) {
        try {
            return ApexFrameConfigLoader.load(file);
        } catch (IOException e) {
            throw new ApexException(ErrorKind.FATAL, "Cannot read configuration " + file, e);
        }
    }

    static HostPolicy loadPolicy(ApexFrameConfig config) {
        Path policyFile = config.getPolicyFile();
        if (policyFile == null || !Files.exists(policyFile)) {
            log.warn("[AUDIT] Policy file {} not found, no permissions will be granted", policyFile);
            return HostPolicy.denyAll(config.getDefaultLimits());
        }
        try {
            return HostPolicyLoader.load(policyFile, config.getDefaultLimits());
        } catch (IOException e) {
            throw new ApexException(ErrorKind.FATAL, "Cannot read policy " + policyFile, e);
        }
    }
}
