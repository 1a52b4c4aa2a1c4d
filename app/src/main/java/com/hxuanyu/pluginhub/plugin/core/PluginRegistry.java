package com.hxuanyu.pluginhub.plugin.core;

import com.hxuanyu.pluginhub.plugin.api.IPlugin;
import com.hxuanyu.pluginhub.plugin.api.PluginFactory;
import com.hxuanyu.pluginhub.plugin.model.InvalidPluginExportException;
import com.hxuanyu.pluginhub.plugin.model.PluginNotFoundException;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 插件实例注册表
 * 按名称保存插件实例，遍历顺序即注册顺序；同名重新注册时替换实例但保留原有位置
 */
@Slf4j
public class PluginRegistry {

    static final String ANONYMOUS_PREFIX = "static-plugin-";

    private final String appName;
    private final Path dataRoot;
    private final Map<String, PluginInstance> instances = new LinkedHashMap<>();
    private final AtomicInteger anonymousCounter = new AtomicInteger();

    public PluginRegistry(String appName, Path dataRoot) {
        this.appName = appName;
        this.dataRoot = dataRoot;
    }

    /**
     * 通过工厂创建插件实例并注册
     *
     * @param classLoader 插件包类加载器，类路径上的插件传 null
     */
    public synchronized PluginInstance setInstance(PluginFactory factory, PluginClassLoader classLoader,
                                                   PluginInstanceOptions options) {
        String name = resolveName(factory, options.getName());
        if (factory == null) {
            throw new InvalidPluginExportException("plugin [" + name + "] must export a PluginFactory");
        }

        PluginInstance instance = new PluginInstance();
        instance.setName(name);
        instance.setEnabled(options.isEnabled());
        instance.setBuiltIn(options.isBuiltIn());
        instance.setFactory(factory);
        instance.setClassLoader(classLoader);
        instance.setCreateTime(LocalDateTime.now());

        PlatformContextImpl context = new PlatformContextImpl(appName, instance, options.getOptions(), dataRoot);
        instance.setPlatformContext(context);

        IPlugin plugin;
        try {
            plugin = factory.create(context);
        } catch (Exception e) {
            throw new InvalidPluginExportException("plugin [" + name + "] could not be constructed: " + e.getMessage(), e);
        }
        if (plugin == null) {
            throw new InvalidPluginExportException("factory of plugin [" + name + "] returned no instance");
        }
        instance.setPlugin(plugin);

        PluginInstance previous = instances.put(name, instance);
        if (previous != null && previous.getClassLoader() != null && previous.getClassLoader() != classLoader) {
            PluginFactoryLocator.closeQuietly(previous.getClassLoader());
        }
        log.debug("Registered plugin instance: {} (enabled={}, builtIn={})", name, instance.isEnabled(), instance.isBuiltIn());
        return instance;
    }

    public synchronized PluginInstance getInstance(String name) {
        PluginInstance instance = instances.get(name);
        if (instance == null) {
            throw new PluginNotFoundException(name + " plugin does not exist");
        }
        return instance;
    }

    public synchronized Optional<PluginInstance> find(String name) {
        return Optional.ofNullable(instances.get(name));
    }

    public synchronized boolean has(String name) {
        return instances.containsKey(name);
    }

    /**
     * 移除插件实例并关闭其类加载器
     */
    public synchronized Optional<PluginInstance> remove(String name) {
        PluginInstance removed = instances.remove(name);
        if (removed != null && removed.getClassLoader() != null) {
            PluginFactoryLocator.closeQuietly(removed.getClassLoader());
        }
        return Optional.ofNullable(removed);
    }

    /**
     * 按注册顺序返回实例快照
     */
    public synchronized List<PluginInstance> values() {
        return new ArrayList<>(instances.values());
    }

    public synchronized List<String> names() {
        return new ArrayList<>(instances.keySet());
    }

    public synchronized int size() {
        return instances.size();
    }

    // 未命名的静态插件依次生成 static-plugin-1、static-plugin-2 ...
    private String resolveName(PluginFactory factory, String name) {
        if (name != null && !name.isBlank()) {
            return name;
        }
        if (factory != null && factory.getName() != null && !factory.getName().isBlank()) {
            return factory.getName();
        }
        return ANONYMOUS_PREFIX + anonymousCounter.incrementAndGet();
    }
}
