package com.apexframe.api.exception;

import lombok.Getter;

import java.util.Set;

/**
 * 权限拒绝异常
 * 扩展申请的权限未被宿主策略授予，或调用了授权范围之外的动作。
 */
@Getter
public class PermissionDeniedException extends ApexException {

    private final String extensionId;
    private final Set<String> denied;

    public PermissionDeniedException(String extensionId, Set<String> denied, String message) {
        super(ErrorKind.PERMISSION_DENIED, message);
        this.extensionId = extensionId;
        this.denied = Set.copyOf(denied);
    }
}
