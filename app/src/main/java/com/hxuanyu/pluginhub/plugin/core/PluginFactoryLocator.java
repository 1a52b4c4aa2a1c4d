package com.hxuanyu.pluginhub.plugin.core;

import com.hxuanyu.pluginhub.plugin.api.PluginFactory;
import com.hxuanyu.pluginhub.plugin.model.InvalidPluginExportException;
import com.hxuanyu.pluginhub.plugin.source.PluginPackageResolver;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.MalformedURLException;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 插件工厂定位
 * 查找顺序：宿主注册的工厂 Bean、类路径上的 ServiceLoader 声明、插件包目录中的 JAR。
 * 插件包目录约定为 &lt;包目录&gt;/*.jar 与 &lt;包目录&gt;/lib/*.jar，其中必须恰好声明一个工厂。
 */
@Component
@Slf4j
public class PluginFactoryLocator {

    private final ObjectProvider<PluginFactory> hostFactories;
    private final PluginPackageResolver packageResolver;
    private volatile Map<String, PluginFactory> classpathFactories;

    public PluginFactoryLocator(ObjectProvider<PluginFactory> hostFactories, PluginPackageResolver packageResolver) {
        this.hostFactories = hostFactories;
        this.packageResolver = packageResolver;
    }

    public LocatedFactory locate(String name) {
        for (PluginFactory factory : hostFactories) {
            if (name.equals(factory.getName())) {
                return new LocatedFactory(factory, null);
            }
        }

        PluginFactory onClasspath = getClasspathFactories().get(name);
        if (onClasspath != null) {
            return new LocatedFactory(onClasspath, null);
        }

        return loadFromPackage(name);
    }

    private LocatedFactory loadFromPackage(String name) {
        Path packageDir = packageResolver.getPackageDir(name);
        if (!Files.isDirectory(packageDir)) {
            throw new InvalidPluginExportException("plugin [" + name + "] has no factory and no package at " + packageDir);
        }

        List<Path> jars = resolveJars(name, packageDir);
        PluginClassLoader classLoader = new PluginClassLoader(name, toUrls(name, jars), getClass().getClassLoader());

        List<PluginFactory> discovered = new ArrayList<>();
        try {
            ServiceLoader.load(PluginFactory.class, classLoader).forEach(discovered::add);
        } catch (Throwable t) {
            closeQuietly(classLoader);
            throw new InvalidPluginExportException("Failed to discover PluginFactory of plugin [" + name + "]", t);
        }

        if (discovered.size() != 1) {
            closeQuietly(classLoader);
            throw new InvalidPluginExportException("plugin [" + name + "] must export exactly one PluginFactory, found "
                    + discovered.size());
        }

        PluginFactory factory = discovered.get(0);
        if (factory.getName() != null && !factory.getName().isBlank() && !name.equals(factory.getName())) {
            log.warn("Factory of package {} declares name {}, using package name", name, factory.getName());
        }
        log.debug("Loaded PluginFactory {} for plugin {} from {} jar(s)", factory.getClass().getName(), name, jars.size());
        return new LocatedFactory(factory, classLoader);
    }

    private Map<String, PluginFactory> getClasspathFactories() {
        Map<String, PluginFactory> factories = classpathFactories;
        if (factories == null) {
            factories = new LinkedHashMap<>();
            for (PluginFactory factory : ServiceLoader.load(PluginFactory.class, getClass().getClassLoader())) {
                if (factory.getName() != null && !factory.getName().isBlank()) {
                    factories.putIfAbsent(factory.getName(), factory);
                }
            }
            classpathFactories = factories;
            log.debug("Discovered {} PluginFactory provider(s) on the class path", factories.size());
        }
        return factories;
    }

    private List<Path> resolveJars(String name, Path packageDir) {
        List<Path> jars = new ArrayList<>();
        collectJars(name, packageDir, jars);
        Path libDir = packageDir.resolve("lib");
        if (Files.isDirectory(libDir)) {
            collectJars(name, libDir, jars);
        }
        if (jars.isEmpty()) {
            throw new InvalidPluginExportException("No jar found in package of plugin [" + name + "]: " + packageDir);
        }
        return jars;
    }

    private void collectJars(String name, Path directory, List<Path> target) {
        try (Stream<Path> stream = Files.list(directory)) {
            target.addAll(stream.filter(Files::isRegularFile)
                    .filter(path -> path.getFileName().toString().endsWith(".jar"))
                    .sorted(Comparator.comparing(Path::toString))
                    .collect(Collectors.toList()));
        } catch (IOException e) {
            throw new InvalidPluginExportException("Failed to list jars of plugin [" + name + "] under " + directory, e);
        }
    }

    private URL[] toUrls(String name, List<Path> jars) {
        URL[] urls = new URL[jars.size()];
        for (int i = 0; i < jars.size(); i++) {
            try {
                urls[i] = jars.get(i).toUri().toURL();
            } catch (MalformedURLException e) {
                throw new InvalidPluginExportException("Invalid jar path of plugin [" + name + "]: " + jars.get(i), e);
            }
        }
        return urls;
    }

    static void closeQuietly(PluginClassLoader classLoader) {
        if (classLoader == null) {
            return;
        }
        try {
            classLoader.close();
        } catch (IOException e) {
            log.warn("Error closing class loader of plugin {}: {}", classLoader.getPluginName(), e.getMessage());
        }
    }

    /**
     * 定位结果：工厂及其所在的类加载器（类路径工厂为 null）
     */
    @Getter
    @AllArgsConstructor
    public static class LocatedFactory {
        private final PluginFactory factory;
        private final PluginClassLoader classLoader;
    }
}
