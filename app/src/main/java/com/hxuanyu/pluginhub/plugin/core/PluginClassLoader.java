package com.hxuanyu.pluginhub.plugin.core;

import com.hxuanyu.pluginhub.plugin.api.PluginFactory;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URL;
import java.net.URLClassLoader;
import java.util.Enumeration;
import java.util.Set;

/**
 * 插件类加载器
 * 采用 Parent-Last 策略，优先从插件包的 JAR 加载
 */
@Slf4j
public class PluginClassLoader extends URLClassLoader {

    private static final String FACTORY_SERVICE = "META-INF/services/" + PluginFactory.class.getName();

    private final String pluginName;
    private final Set<String> platformClasses;

    public PluginClassLoader(String pluginName, URL[] urls, ClassLoader parent) {
        super(urls, parent);
        this.pluginName = pluginName;

        // 定义必须从父加载器加载的类（平台 API 和核心库）
        this.platformClasses = Set.of(
                "com.hxuanyu.pluginhub.plugin.api.",
                "org.slf4j.",
                "javax.",
                "jakarta.",
                "java.",
                "sun.",
                "jdk."
        );
    }

    @Override
    protected Class<?> loadClass(String name, boolean resolve) throws ClassNotFoundException {
        synchronized (getClassLoadingLock(name)) {
            // 1. 检查是否已加载
            Class<?> clazz = findLoadedClass(name);
            if (clazz != null) {
                return clazz;
            }

            // 2. 平台类必须从父加载器加载
            if (isPlatformClass(name)) {
                return super.loadClass(name, resolve);
            }

            // 3. 先尝试从插件 JAR 加载
            try {
                clazz = findClass(name);
                if (resolve) {
                    resolveClass(clazz);
                }
                log.debug("Loaded class from plugin {}: {}", pluginName, name);
                return clazz;
            } catch (ClassNotFoundException e) {
                // 4. 插件找不到，再从父加载器加载
                return super.loadClass(name, resolve);
            }
        }
    }

    /**
     * 工厂声明只从插件自身的 JAR 查找，避免发现宿主类路径上的工厂
     */
    @Override
    public Enumeration<URL> getResources(String name) throws IOException {
        if (FACTORY_SERVICE.equals(name)) {
            return findResources(name);
        }
        return super.getResources(name);
    }

    private boolean isPlatformClass(String name) {
        return platformClasses.stream().anyMatch(name::startsWith);
    }

    public String getPluginName() {
        return pluginName;
    }
}
