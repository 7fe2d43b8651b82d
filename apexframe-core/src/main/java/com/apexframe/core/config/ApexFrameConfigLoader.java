package com.apexframe.core.config;

import com.apexframe.core.security.ResourceLimitProfile;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 从 apexframe.yml 读取运行时配置，缺失的键保持默认值
 * <p>
 * 相对路径以配置文件所在目录为基准。
 * </p>
 */
@Slf4j
public final class ApexFrameConfigLoader {

    private ApexFrameConfigLoader() {
    }

    public static ApexFrameConfig load(Path file) throws IOException {
        if (!Files.isRegularFile(file)) {
            log.warn("Config file {} not found, using defaults", file);
            return ApexFrameConfig.defaults();
        }
        Path base = file.toAbsolutePath().getParent();
        YamlDocument doc = YamlDocument.read(file);
        ApexFrameConfig.ApexFrameConfigBuilder builder = ApexFrameConfig.builder();

        for (String root : doc.strings("extension_roots")) {
            builder.extensionRoot(base.resolve(root).normalize());
        }
        doc.string("state_dir").ifPresent(v -> builder.stateDir(base.resolve(v).normalize()));
        doc.string("policy_file").ifPresent(v -> builder.policyFile(base.resolve(v).normalize()));

        YamlDocument streams = doc.section("streams");
        if (streams != null) {
            streams.duration("idle_timeout").ifPresent(builder::streamIdleTimeout);
            streams.duration("reaper_interval").ifPresent(builder::reaperInterval);
        }

        YamlDocument isolation = doc.section("isolation");
        if (isolation != null) {
            isolation.bool("process_isolation").ifPresent(builder::processIsolationEnabled);
            isolation.string("java_command").ifPresent(builder::workerJavaCommand);
            builder.workerJvmOptions(isolation.strings("jvm_options"));
            isolation.duration("startup_timeout").ifPresent(builder::workerStartupTimeout);
            isolation.duration("watchdog_interval").ifPresent(builder::watchdogInterval);
        }

        YamlDocument executor = doc.section("executor");
        if (executor != null) {
            executor.integer("core_pool_size").ifPresent(builder::executorCorePoolSize);
            executor.integer("max_pool_size").ifPresent(builder::executorMaxPoolSize);
            executor.duration("acquire_timeout").ifPresent(builder::concurrencyAcquireTimeout);
        }

        YamlDocument limits = doc.section("default_limits");
        if (limits != null) {
            ResourceLimitProfile.ResourceLimitProfileBuilder profile = ResourceLimitProfile.builder();
            limits.duration("cpu_time").ifPresent(profile::cpuTime);
            limits.size("memory").ifPresent(profile::memoryBytes);
            limits.duration("timeout").ifPresent(profile::timeout);
            limits.size("max_output").ifPresent(profile::maxOutputBytes);
            limits.integer("max_concurrency").ifPresent(profile::maxConcurrency);
            builder.defaultLimits(profile.build());
        }

        ApexFrameConfig config = builder.build();
        log.info("Loaded config from {}: {}", file, config);
        return config;
    }
}
