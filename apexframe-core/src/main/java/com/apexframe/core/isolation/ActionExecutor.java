package com.apexframe.core.isolation;

import com.apexframe.api.action.ActionResult;

import java.util.Map;

/**
 * 动作执行器：在资源上限内执行扩展的动作
 * <p>
 * 返回流式结果时，返回的 {@code ChunkSource} 的每次拉取同样受上限约束。
 * </p>
 */
public interface ActionExecutor extends AutoCloseable {

    /**
     * @throws com.apexframe.api.exception.ResourceLimitExceededException 超出资源上限
     * @throws com.apexframe.api.exception.ActionExecutionException       扩展代码失败
     */
    ActionResult execute(String action, Map<String, Object> input);

    /**
     * 执行器类型，用于日志
     */
    String mode();

    /**
     * 终止所有进行中的执行并释放资源
     */
    @Override
    void close();
}
