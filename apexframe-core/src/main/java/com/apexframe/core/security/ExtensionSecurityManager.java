package com.apexframe.core.security;

import com.apexframe.api.exception.PermissionDeniedException;
import com.apexframe.core.loader.ScanReport;
import com.apexframe.core.manifest.ActionDescriptor;
import com.apexframe.core.manifest.ExtensionManifest;
import lombok.extern.slf4j.Slf4j;
import org.jspecify.annotations.Nullable;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.function.Supplier;

/**
 * 扩展安全管理器
 * <p>
 * initialize 时对照宿主策略计算授权：声明的权限必须全部可授予，否则拒绝（不做静默降级）；
 * 字节码扫描推导出的权限必须在声明范围内。所有裁决以 [AUDIT] 前缀记录。
 * </p>
 */
@Slf4j
public class ExtensionSecurityManager {

    private final Supplier<HostPolicy> policy;

    public ExtensionSecurityManager(Supplier<HostPolicy> policy) {
        this.policy = policy;
    }

    /**
     * 读取当前策略对扩展的裁决
     */
    public PolicyDecision decide(ExtensionManifest manifest) {
        return policy.get().decide(manifest.getId());
    }

    /**
     * 计算授权
     *
     * @throws PermissionDeniedException 声明的权限未被策略允许，或代码需要未声明的权限
     */
    public PermissionGrant authorize(ExtensionManifest manifest, @Nullable ScanReport scan, PolicyDecision decision) {
        String id = manifest.getId();
        Set<String> declared = manifest.getDeclaredPermissions();

        Set<String> denied = new LinkedHashSet<>();
        for (String permission : declared) {
            if (!decision.permits(permission)) {
                denied.add(permission);
            }
        }
        if (!denied.isEmpty()) {
            log.warn("[AUDIT] [{}] DENY {} (tier '{}')", id, denied, decision.tier());
            throw new PermissionDeniedException(id, denied, "Extension [" + id + "] requests permissions "
                    + denied + " not granted by tier '" + decision.tier() + "'");
        }

        if (scan != null) {
            Set<String> undeclared = new LinkedHashSet<>(scan.requiredPermissions());
            undeclared.removeAll(declared);
            if (!undeclared.isEmpty()) {
                log.warn("[AUDIT] [{}] DENY code requires undeclared {}", id, undeclared);
                throw new PermissionDeniedException(id, undeclared, "Extension [" + id
                        + "] code requires permissions it does not declare: " + undeclared);
            }
        }

        PermissionGrant grant = new PermissionGrant(id, decision.tier(), declared);
        log.info("[AUDIT] [{}] GRANT {} (tier '{}', trusted={})", id, declared, decision.tier(), decision.trusted());
        return grant;
    }

    /**
     * 调用前检查动作所需权限
     */
    public void checkAction(String extensionId, @Nullable PermissionGrant grant, ActionDescriptor action) {
        Set<String> missing = new LinkedHashSet<>(action.requiredPermissions());
        if (grant != null) {
            missing.removeAll(grant.permissions());
        }
        if (!missing.isEmpty()) {
            log.warn("[AUDIT] [{}] DENY action '{}' missing {}", extensionId, action.name(), missing);
            throw new PermissionDeniedException(extensionId, missing, "Action '" + action.name()
                    + "' of [" + extensionId + "] requires " + missing);
        }
    }
}
