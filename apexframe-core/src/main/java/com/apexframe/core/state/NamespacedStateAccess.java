package com.apexframe.core.state;

import com.apexframe.api.state.StateAccess;
import lombok.RequiredArgsConstructor;
import org.jspecify.annotations.Nullable;

import java.util.Set;

/**
 * 绑定扩展 ID 的状态视图
 */
@RequiredArgsConstructor
class NamespacedStateAccess implements StateAccess {

    private final FileStateStore store;
    private final String extensionId;

    @Override
    public void save(String key, Object value) {
        store.save(extensionId, key, value);
    }

    @Override
    public <T> @Nullable T load(String key, Class<T> type, @Nullable T defaultValue) {
        return store.load(extensionId, key, type, defaultValue);
    }

    @Override
    public boolean delete(String key) {
        return store.delete(extensionId, key);
    }

    @Override
    public boolean contains(String key) {
        return store.contains(extensionId, key);
    }

    @Override
    public Set<String> keys() {
        return store.keys(extensionId);
    }
}
