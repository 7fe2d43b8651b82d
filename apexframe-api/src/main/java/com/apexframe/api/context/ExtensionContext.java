package com.apexframe.api.context;

import com.apexframe.api.event.EventChannel;
import com.apexframe.api.state.StateAccess;

import java.util.Optional;

/**
 * 扩展上下文
 * 提供扩展运行时可用的全部宿主能力，扩展无法越过此边界访问宿主
 *
 * @author ApexFrame
 */
public interface ExtensionContext {

    /**
     * 获取当前扩展的唯一标识
     * @return 扩展ID
     */
    String getExtensionId();

    /**
     * 获取当前扩展的版本号
     * @return 语义化版本字符串
     */
    String getVersion();

    /**
     * 获取清单中声明的扩展属性
     * @param key 属性键
     * @return 属性值
     */
    Optional<String> getProperty(String key);

    /**
     * 获取绑定到本扩展命名空间的状态存储
     * @return 状态存储
     */
    StateAccess state();

    /**
     * 获取事件通道
     * @return 事件通道，发布时自动以本扩展作为事件源
     */
    EventChannel events();
}
