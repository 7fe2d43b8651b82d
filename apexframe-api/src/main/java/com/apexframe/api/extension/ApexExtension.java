package com.apexframe.api.extension;

import com.apexframe.api.action.ActionResult;
import com.apexframe.api.context.ExtensionContext;

import java.util.Map;

/**
 * 扩展能力接口
 * <p>
 * 所有扩展的入口类必须实现此接口。入口类需提供一个 public 构造器：
 * 优先使用 {@code (ExtensionContext)} 构造器注入上下文，否则使用无参构造器，
 * 上下文随后通过 {@link #onInitialize(ExtensionContext)} 传入。
 * </p>
 *
 * @author ApexFrame
 */
public interface ApexExtension {

    /**
     * 初始化回调，权限授予完成后调用
     *
     * @param context 扩展上下文，提供状态存储与事件能力
     */
    default void onInitialize(ExtensionContext context) {
        // Default empty implementation
    }

    /**
     * 启动回调，依赖检查通过后调用
     */
    default void onStart() {
        // Default empty implementation
    }

    /**
     * 停止回调，持久化状态不会被清除
     */
    default void onStop() {
        // Default empty implementation
    }

    /**
     * 卸载回调，用于释放资源
     */
    default void onUnload() {
        // Default empty implementation
    }

    /**
     * 动作分发
     * <p>
     * 声明为 {@code streams_output: true} 的动作必须返回 {@link ActionResult#stream}，
     * 其余动作返回 {@link ActionResult#value}。
     * </p>
     *
     * @param action 动作名称（与清单中声明的一致）
     * @param input  结构化输入，已按 input_schema 校验
     * @return 调用结果
     * @throws Exception 动作执行失败
     */
    ActionResult dispatch(String action, Map<String, Object> input) throws Exception;
}
