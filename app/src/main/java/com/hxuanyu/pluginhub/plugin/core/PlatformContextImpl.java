package com.hxuanyu.pluginhub.plugin.core;

import com.hxuanyu.pluginhub.plugin.api.PlatformContext;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * 平台上下文实现
 * 启用状态直接读取所属 {@link PluginInstance}，始终与平台一致
 */
@Slf4j
public class PlatformContextImpl implements PlatformContext {

    private final String appName;
    private final PluginInstance instance;
    private final Map<String, Object> options;
    private final Path dataDirectory;
    private final Logger logger;

    public PlatformContextImpl(String appName, PluginInstance instance, Map<String, Object> options, Path dataRoot) {
        this.appName = appName;
        this.instance = instance;
        this.options = options == null ? Collections.emptyMap() : Collections.unmodifiableMap(new HashMap<>(options));
        this.dataDirectory = dataRoot.resolve(instance.getName()).normalize();
        // 为当前插件创建独立的 Logger
        this.logger = LoggerFactory.getLogger("plugin." + instance.getName());
    }

    @Override
    public String getAppName() {
        return appName;
    }

    @Override
    public String getPluginName() {
        return instance.getName();
    }

    @Override
    public boolean isEnabled() {
        return instance.isEnabled();
    }

    @Override
    public boolean isBuiltIn() {
        return instance.isBuiltIn();
    }

    @Override
    public Map<String, Object> getOptions() {
        return options;
    }

    /**
     * 首次访问时创建目录
     */
    @Override
    public Path getDataDirectory() {
        if (!Files.isDirectory(dataDirectory)) {
            try {
                Files.createDirectories(dataDirectory);
                log.debug("Created data directory for plugin {}: {}", getPluginName(), dataDirectory);
            } catch (IOException e) {
                log.warn("Failed to create data directory for plugin {}: {}", getPluginName(), e.getMessage());
            }
        }
        return dataDirectory;
    }

    @Override
    public void log(String message) {
        logger.info("[Plugin:{}] {}", getPluginName(), message);
    }

    @Override
    public void error(String message, Throwable throwable) {
        logger.error("[Plugin:{}] {}", getPluginName(), message, throwable);
    }

    @Override
    public Logger getLogger() {
        return logger;
    }
}
