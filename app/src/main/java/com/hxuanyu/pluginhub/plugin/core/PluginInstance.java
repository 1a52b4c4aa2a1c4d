package com.hxuanyu.pluginhub.plugin.core;

import com.hxuanyu.pluginhub.plugin.api.IPlugin;
import com.hxuanyu.pluginhub.plugin.api.PluginFactory;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 插件运行时实例
 * 由 {@link PluginRegistry} 独占持有，按名称索引
 */
@Data
public class PluginInstance {

    private String name;
    private volatile boolean enabled;
    private boolean builtIn;

    // 插件实例
    private IPlugin plugin;

    private PluginFactory factory;

    private PlatformContextImpl platformContext;

    // 插件包类加载器，类路径上的插件为 null
    private PluginClassLoader classLoader;

    private LocalDateTime createTime;
}
