package com.apexframe.core.config;

import com.apexframe.core.security.ResourceLimitProfile;
import lombok.Builder;
import lombok.Data;
import lombok.Singular;
import lombok.ToString;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.List;

/**
 * ApexFrame 运行时全局配置
 * <p>
 * Core 层的唯一配置入口。由 {@link ApexFrameConfigLoader} 从 apexframe.yml 构建，
 * 也可在测试中直接通过 builder 构造。
 * </p>
 */
@Data
@Builder(toBuilder = true)
@ToString
public class ApexFrameConfig {

    // ================= 目录 =================

    /**
     * 扩展根目录，按顺序扫描
     */
    @Singular
    private List<Path> extensionRoots;

    /**
     * 状态存储根目录
     */
    @Builder.Default
    private Path stateDir = Paths.get("state");

    /**
     * 宿主策略文件（policy.yml）
     */
    @Builder.Default
    private Path policyFile = Paths.get("policy.yml");

    // ================= 流 =================

    /**
     * 流空闲超时：超过此时间未被拉取的流会被取消
     */
    @Builder.Default
    private Duration streamIdleTimeout = Duration.ofSeconds(60);

    /**
     * 空闲流回收间隔
     */
    @Builder.Default
    private Duration reaperInterval = Duration.ofSeconds(1);

    // ================= 隔离 =================

    /**
     * 是否为不受信任的扩展启用进程隔离；关闭时所有扩展在宿主进程内执行
     */
    @Builder.Default
    private boolean processIsolationEnabled = true;

    /**
     * 隔离进程使用的 java 可执行文件
     */
    @Builder.Default
    private String workerJavaCommand = Paths.get(System.getProperty("java.home"), "bin", "java").toString();

    /**
     * 隔离进程的额外 JVM 参数
     */
    @Singular
    private List<String> workerJvmOptions;

    /**
     * 隔离进程启动握手超时
     */
    @Builder.Default
    private Duration workerStartupTimeout = Duration.ofSeconds(30);

    /**
     * 资源看门狗检查间隔
     */
    @Builder.Default
    private Duration watchdogInterval = Duration.ofMillis(20);

    // ================= 执行器 =================

    /**
     * 进程内执行器核心线程数
     */
    @Builder.Default
    private int executorCorePoolSize = Math.max(2, Runtime.getRuntime().availableProcessors());

    /**
     * 进程内执行器最大线程数
     */
    @Builder.Default
    private int executorMaxPoolSize = Math.max(8, Runtime.getRuntime().availableProcessors() * 4);

    /**
     * 获取并发许可的等待时间
     */
    @Builder.Default
    private Duration concurrencyAcquireTimeout = Duration.ofMillis(500);

    /**
     * 策略未覆盖时的默认资源上限
     */
    @Builder.Default
    private ResourceLimitProfile defaultLimits = ResourceLimitProfile.defaults();

    public static ApexFrameConfig defaults() {
        return ApexFrameConfig.builder().build();
    }
}
