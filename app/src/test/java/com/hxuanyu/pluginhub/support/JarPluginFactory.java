package com.hxuanyu.pluginhub.support;

import com.hxuanyu.pluginhub.plugin.api.IPlugin;
import com.hxuanyu.pluginhub.plugin.api.PlatformContext;
import com.hxuanyu.pluginhub.plugin.api.PluginFactory;

/**
 * 通过插件包 JAR 中的服务声明发现的工厂
 */
public class JarPluginFactory implements PluginFactory {

    @Override
    public String getName() {
        return "jar-demo";
    }

    @Override
    public IPlugin create(PlatformContext context) {
        return new IPlugin() {
        };
    }

    public static class Another extends JarPluginFactory {
    }
}
