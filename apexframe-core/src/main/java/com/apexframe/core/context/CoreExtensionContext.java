package com.apexframe.core.context;

import com.apexframe.api.context.ExtensionContext;
import com.apexframe.api.event.EventChannel;
import com.apexframe.api.state.StateAccess;
import com.apexframe.core.manifest.ExtensionManifest;
import lombok.RequiredArgsConstructor;

import java.util.Optional;

/**
 * 注入扩展的上下文：清单属性、绑定 ID 的状态视图与事件通道
 */
@RequiredArgsConstructor
public class CoreExtensionContext implements ExtensionContext {

    private final ExtensionManifest manifest;
    private final StateAccess state;
    private final EventChannel events;

    @Override
    public String getExtensionId() {
        return manifest.getId();
    }

    @Override
    public String getVersion() {
        return manifest.getVersionString();
    }

    @Override
    public Optional<String> getProperty(String key) {
        // 只暴露清单中声明的属性，不读取宿主的系统属性
        return Optional.ofNullable(manifest.getProperties().get(key));
    }

    @Override
    public StateAccess state() {
        return state;
    }

    @Override
    public EventChannel events() {
        return events;
    }
}
