package com.apexframe.core.isolation;

import com.apexframe.api.event.ExtensionEvent;
import com.apexframe.api.extension.ApexExtension;
import com.apexframe.core.config.ApexFrameConfig;
import com.apexframe.core.event.EventBus;
import com.apexframe.core.manifest.ExtensionManifest;
import com.apexframe.core.security.ResourceLimitProfile;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 按信任级别选择动作执行器
 * <p>
 * 受信任扩展在宿主进程内执行；其余扩展在隔离进程中执行。
 * 关闭进程隔离或清单没有文件来源时，一律在宿主进程内执行。
 * </p>
 */
@Slf4j
public class ActionExecutorFactory implements AutoCloseable {

    private final ApexFrameConfig config;
    private final EventBus eventBus;
    private final Path stateRoot;
    private final ExecutorService pool;
    private final ResourceWatchdog watchdog;

    public ActionExecutorFactory(ApexFrameConfig config, EventBus eventBus, Path stateRoot) {
        this.config = config;
        this.eventBus = eventBus;
        this.stateRoot = stateRoot;
        AtomicInteger counter = new AtomicInteger(0);
        this.pool = new ThreadPoolExecutor(
                config.getExecutorCorePoolSize(),
                Math.max(config.getExecutorCorePoolSize(), config.getExecutorMaxPoolSize()),
                60L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(1024),
                r -> {
                    Thread t = new Thread(r, "apexframe-action-" + counter.incrementAndGet());
                    t.setDaemon(true);
                    return t;
                });
        this.watchdog = new ResourceWatchdog(config.getWatchdogInterval());
    }

    public ActionExecutor create(ExtensionManifest manifest, Path extensionDir, ApexExtension instance,
                                 ClassLoader classLoader, Set<String> granted,
                                 ResourceLimitProfile limits, boolean trusted) {
        String id = manifest.getId();
        if (trusted || !config.isProcessIsolationEnabled()) {
            return new InProcessActionExecutor(id, instance, classLoader, limits, pool, watchdog);
        }
        if (manifest.getSource() == null) {
            log.warn("[{}] Manifest has no file source, process isolation unavailable, running in-process", id);
            return new InProcessActionExecutor(id, instance, classLoader, limits, pool, watchdog);
        }
        WorkerLauncher launcher = WorkerLauncher.builder()
                .javaCommand(config.getWorkerJavaCommand())
                .jvmOptions(config.getWorkerJvmOptions())
                .classpath(System.getProperty("java.class.path"))
                .manifestFile(manifest.getSource())
                .extensionDir(extensionDir)
                .stateRoot(stateRoot)
                .grantedPermissions(granted)
                .startupTimeout(config.getWorkerStartupTimeout())
                .pollInterval(config.getWatchdogInterval())
                .build();
        return new ProcessActionExecutor(id, launcher, limits,
                message -> eventBus.publish(new ExtensionEvent(message.eventType(), id, message.payload())));
    }

    @Override
    public void close() {
        pool.shutdownNow();
        watchdog.close();
    }
}
