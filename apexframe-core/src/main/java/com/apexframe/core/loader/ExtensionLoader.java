package com.apexframe.core.loader;

import com.apexframe.api.context.ExtensionContext;
import com.apexframe.api.exception.LoadException;
import com.apexframe.api.extension.ApexExtension;
import com.apexframe.core.manifest.ExtensionManifest;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Modifier;
import java.nio.file.Path;

/**
 * 扩展加载器
 * <p>
 * 解析代码单元、字节码扫描、加载入口类并实例化。每个扩展一个类加载器，
 * 缓存在 Caffeine 中，卸载时失效并关闭。
 * </p>
 */
@Slf4j
public class ExtensionLoader implements AutoCloseable {

    private final ClassLoader parent;
    private final BytecodeScanner scanner;
    private final Cache<String, ExtensionClassLoader> classLoaders;

    public ExtensionLoader() {
        this(ExtensionLoader.class.getClassLoader());
    }

    public ExtensionLoader(ClassLoader parent) {
        this.parent = parent;
        this.scanner = new BytecodeScanner();
        this.classLoaders = Caffeine.newBuilder()
                .executor(Runnable::run)
                .<String, ExtensionClassLoader>removalListener(this::onRemoval)
                .build();
    }

    /**
     * 扫描、加载并实例化扩展
     *
     * @param context 注入的扩展上下文
     * @throws LoadException 代码单元无效、存在禁止调用、入口类不满足约定或构造失败
     */
    public LoadedExtension load(ExtensionManifest manifest, Path extensionDir, ExtensionContext context) {
        String id = manifest.getId();
        CodeUnit unit = CodeUnit.resolve(manifest.getEntryReference(), extensionDir);

        ScanReport report;
        try {
            report = scanner.scan(unit.entries());
        } catch (IOException e) {
            throw new LoadException("Extension [" + id + "] code unit could not be scanned", e);
        }
        report.throwIfForbidden(id);

        ExtensionClassLoader classLoader = classLoaders.get(id,
                k -> new ExtensionClassLoader(id, unit.urls(), parent, manifest.getSharedPackages()));
        try {
            Class<? extends ApexExtension> type = loadEntryClass(id, manifest.getEntryReference().className(), classLoader);
            ApexExtension instance = instantiate(id, type, context);
            log.info("[{}] Loaded entry {} from {} ({} code unit entries)",
                    id, type.getName(), unit.extensionDir(), unit.entries().size());
            return new LoadedExtension(instance, classLoader, report);
        } catch (RuntimeException e) {
            release(id);
            throw e;
        }
    }

    /**
     * 失效并关闭扩展的类加载器
     */
    public void release(String extensionId) {
        classLoaders.invalidate(extensionId);
    }

    public boolean isLoaded(String extensionId) {
        return classLoaders.getIfPresent(extensionId) != null;
    }

    static Class<? extends ApexExtension> loadEntryClass(String id, String className, ClassLoader classLoader) {
        Class<?> raw;
        try {
            raw = Class.forName(className, false, classLoader);
        } catch (ClassNotFoundException | LinkageError e) {
            throw new LoadException("Extension [" + id + "] entry class " + className + " not found", e);
        }
        if (!ApexExtension.class.isAssignableFrom(raw)) {
            throw new LoadException("Extension [" + id + "] entry class " + className
                    + " does not implement " + ApexExtension.class.getName());
        }
        int modifiers = raw.getModifiers();
        if (raw.isInterface() || Modifier.isAbstract(modifiers) || !Modifier.isPublic(modifiers)) {
            throw new LoadException("Extension [" + id + "] entry class " + className
                    + " must be a public concrete class");
        }
        return raw.asSubclass(ApexExtension.class);
    }

    static ApexExtension instantiate(String id, Class<? extends ApexExtension> type, ExtensionContext context) {
        Constructor<? extends ApexExtension> constructor;
        Object[] args;
        try {
            constructor = type.getConstructor(ExtensionContext.class);
            args = new Object[]{context};
        } catch (NoSuchMethodException e) {
            try {
                constructor = type.getConstructor();
                args = new Object[0];
            } catch (NoSuchMethodException e2) {
                throw new LoadException("Extension [" + id + "] entry class " + type.getName()
                        + " needs a public (ExtensionContext) or no-arg constructor");
            }
        }
        try {
            return constructor.newInstance(args);
        } catch (InvocationTargetException e) {
            throw new LoadException("Extension [" + id + "] constructor failed: " + e.getCause(), e.getCause());
        } catch (ReflectiveOperationException | LinkageError e) {
            throw new LoadException("Extension [" + id + "] could not be instantiated", e);
        }
    }

    private void onRemoval(String id, ExtensionClassLoader classLoader, RemovalCause cause) {
        if (classLoader == null) {
            return;
        }
        try {
            classLoader.close();
            log.debug("[{}] Class loader closed ({})", id, cause);
        } catch (IOException e) {
            log.warn("[{}] Failed to close class loader", id, e);
        }
    }

    @Override
    public void close() {
        classLoaders.invalidateAll();
        classLoaders.cleanUp();
    }
}
