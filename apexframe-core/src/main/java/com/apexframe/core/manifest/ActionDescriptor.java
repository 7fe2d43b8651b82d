package com.apexframe.core.manifest;

import java.util.Map;
import java.util.Set;

/**
 * 动作签名
 *
 * @param name                动作名称
 * @param inputSchema         输入结构描述（JSON Schema 子集）
 * @param streamsOutput       是否流式输出
 * @param requiredPermissions 调用此动作需要的权限，必须是已声明权限的子集
 */
public record ActionDescriptor(String name,
                               Map<String, Object> inputSchema,
                               boolean streamsOutput,
                               Set<String> requiredPermissions) {

    public ActionDescriptor {
        inputSchema = inputSchema == null ? Map.of() : Map.copyOf(inputSchema);
        requiredPermissions = requiredPermissions == null ? Set.of() : Set.copyOf(requiredPermissions);
    }

    public static ActionDescriptor of(String name, boolean streamsOutput) {
        return new ActionDescriptor(name, Map.of(), streamsOutput, Set.of());
    }
}
