package com.apexframe.core.isolation;

import com.apexframe.core.security.ResourceLimitProfile;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;

/**
 * 隔离进程的启动参数
 * <p>
 * 子进程使用与宿主相同的 classpath，通过 {@link IsolatedWorkerMain} 重建扩展：
 * 相同的清单、相同的代码单元、相同的状态命名空间。
 * </p>
 */
@Getter
@Builder
public class WorkerLauncher {

    private final String javaCommand;
    @Singular
    private final List<String> jvmOptions;
    private final String classpath;
    private final Path manifestFile;
    private final Path extensionDir;
    private final Path stateRoot;
    private final Set<String> grantedPermissions;
    private final Duration startupTimeout;
    private final Duration pollInterval;

    WorkerProcess launch(String extensionId, ResourceLimitProfile limits, Consumer<WorkerMessage> eventSink) {
        return WorkerProcess.launch(extensionId, command(limits), startupTimeout, pollInterval, eventSink);
    }

    List<String> command(ResourceLimitProfile limits) {
        List<String> command = new ArrayList<>();
        command.add(javaCommand);
        if (limits.limitsMemory()) {
            command.add("-Xmx" + Math.max(16, limits.getMemoryBytes() / (1024 * 1024)) + "m");
        }
        command.add("-XX:+ExitOnOutOfMemoryError");
        command.addAll(jvmOptions);
        command.add("-cp");
        command.add(classpath);
        command.add(IsolatedWorkerMain.class.getName());
        command.add(manifestFile.toString());
        command.add(extensionDir.toString());
        command.add(stateRoot.toString());
        command.add(String.join(",", grantedPermissions));
        return command;
    }
}
