package com.apexframe.core.registry;

import com.apexframe.api.context.ExtensionContext;
import com.apexframe.api.extension.ApexExtension;
import com.apexframe.core.event.ScopedEventChannel;
import com.apexframe.core.isolation.ActionExecutor;
import com.apexframe.core.loader.ScanReport;
import com.apexframe.core.manifest.ExtensionManifest;
import com.apexframe.core.security.PermissionGrant;
import com.apexframe.core.security.ResourceLimitProfile;
import lombok.Getter;
import lombok.Setter;
import org.jspecify.annotations.Nullable;

import java.nio.file.Path;
import java.util.Set;
import java.util.concurrent.Semaphore;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 注册表条目
 * <p>
 * 可变字段只在持有 {@link #getLock()} 时修改；state 与 grant 可无锁读取。
 * </p>
 */
@Getter
public class RegistryEntry {

    private final ExtensionManifest manifest;
    private final Path directory;
    private final Path stateNamespace;
    private final ReentrantLock lock = new ReentrantLock();
    private final long registrationOrder;

    private volatile LifecycleState state = LifecycleState.REGISTERED;

    @Setter
    private volatile @Nullable ApexExtension instance;
    @Setter
    private volatile @Nullable ClassLoader classLoader;
    @Setter
    private volatile @Nullable ExtensionContext context;
    @Setter
    private volatile @Nullable ScopedEventChannel channel;
    @Setter
    private volatile @Nullable ScanReport scanReport;
    @Setter
    private volatile @Nullable String lastError;

    // === 激活期 (initialize 起) ===
    @Setter
    private volatile @Nullable PermissionGrant grant;
    @Setter
    private volatile @Nullable ResourceLimitProfile limits;
    @Setter
    private volatile boolean trusted;

    // === 运行期 (start 起) ===
    @Setter
    private volatile @Nullable ActionExecutor executor;
    @Setter
    private volatile @Nullable Semaphore bulkhead;

    public RegistryEntry(ExtensionManifest manifest, Path directory, Path stateNamespace, long registrationOrder) {
        this.manifest = manifest;
        this.directory = directory;
        this.stateNamespace = stateNamespace;
        this.registrationOrder = registrationOrder;
    }

    public String getId() {
        return manifest.getId();
    }

    public String getVersion() {
        return manifest.getVersionString();
    }

    /**
     * 只应在持有锁时调用
     */
    public void setState(LifecycleState state) {
        this.state = state;
    }

    public Set<String> grantedPermissions() {
        PermissionGrant current = grant;
        return current == null ? Set.of() : current.permissions();
    }

    @Override
    public String toString() {
        return "RegistryEntry{" + getId() + "@" + getVersion() + ", state=" + state + ", dir=" + directory + "}";
    }
}
