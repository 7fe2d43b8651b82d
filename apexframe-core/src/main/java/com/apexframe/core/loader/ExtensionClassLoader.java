package com.apexframe.core.loader;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URL;
import java.net.URLClassLoader;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Enumeration;
import java.util.List;

/**
 * 扩展类加载器
 * <p>
 * 代码单元内的类优先（child-first）。共享包由宿主加载器定义，
 * 包括 JDK、API 契约、日志门面，以及扩展清单 shared_packages 声明的前缀。
 * 共享包的资源同样先查宿主。
 * </p>
 */
@Slf4j
public class ExtensionClassLoader extends URLClassLoader {

    static final List<String> HOST_PACKAGES = List.of(
            "java.", "javax.", "jdk.", "sun.", "com.sun.", "org.w3c.", "org.xml.",
            "com.apexframe.api.",
            "org.slf4j.",
            "ch.qos.logback.",
            "org.jspecify.",
            // 返回值由宿主序列化
            "com.fasterxml.jackson."
    );

    @Getter
    private final String extensionId;
    @Getter
    private final List<String> sharedPackages;

    /**
     * @param extraShared 追加的共享包前缀，以 '.' 结尾
     */
    public ExtensionClassLoader(String extensionId, URL[] urls, ClassLoader parent, List<String> extraShared) {
        super("apexframe-" + extensionId, urls, parent);
        this.extensionId = extensionId;
        List<String> shared = new ArrayList<>(HOST_PACKAGES);
        shared.addAll(extraShared);
        this.sharedPackages = List.copyOf(shared);
    }

    @Override
    protected Class<?> loadClass(String name, boolean resolve) throws ClassNotFoundException {
        synchronized (getClassLoadingLock(name)) {
            Class<?> type = findLoadedClass(name);
            if (type == null) {
                type = isShared(name) ? hostFirst(name) : unitFirst(name);
            }
            if (resolve) {
                resolveClass(type);
            }
            return type;
        }
    }

    /**
     * 宿主可见时一律使用宿主定义，否则退回代码单元
     */
    private Class<?> hostFirst(String name) throws ClassNotFoundException {
        try {
            return getParent().loadClass(name);
        } catch (ClassNotFoundException e) {
            log.trace("[{}] Shared class {} missing on host, using code unit", extensionId, name);
            return findClass(name);
        }
    }

    private Class<?> unitFirst(String name) throws ClassNotFoundException {
        if (findResource(classFile(name)) != null) {
            return findClass(name);
        }
        return getParent().loadClass(name);
    }

    @Override
    public URL getResource(String name) {
        if (isShared(resourcePackage(name))) {
            URL host = getParent().getResource(name);
            return host != null ? host : findResource(name);
        }
        URL local = findResource(name);
        return local != null ? local : getParent().getResource(name);
    }

    @Override
    public Enumeration<URL> getResources(String name) throws IOException {
        List<URL> local = Collections.list(findResources(name));
        List<URL> host = Collections.list(getParent().getResources(name));
        List<URL> ordered = new ArrayList<>(local.size() + host.size());
        if (isShared(resourcePackage(name))) {
            ordered.addAll(host);
            ordered.addAll(local);
        } else {
            ordered.addAll(local);
            ordered.addAll(host);
        }
        return Collections.enumeration(ordered);
    }

    boolean isShared(String className) {
        return sharedPackages.stream().anyMatch(className::startsWith);
    }

    private static String classFile(String className) {
        return className.replace('.', '/') + ".class";
    }

    private static String resourcePackage(String resourceName) {
        String path = resourceName.startsWith("/") ? resourceName.substring(1) : resourceName;
        return path.replace('/', '.');
    }
}
