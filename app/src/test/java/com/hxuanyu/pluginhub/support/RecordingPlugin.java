package com.hxuanyu.pluginhub.support;

import com.hxuanyu.pluginhub.plugin.api.IPlugin;
import com.hxuanyu.pluginhub.plugin.api.InstallOptions;

import java.util.List;

/**
 * 记录每个钩子调用的测试插件
 */
public class RecordingPlugin implements IPlugin {

    private final String name;
    private final PluginCallLog callLog;
    private final List<String> requiredPlugins;
    private final boolean failOnLoad;

    public RecordingPlugin(String name, PluginCallLog callLog, List<String> requiredPlugins, boolean failOnLoad) {
        this.name = name;
        this.callLog = callLog;
        this.requiredPlugins = requiredPlugins;
        this.failOnLoad = failOnLoad;
    }

    @Override
    public void afterAdd() {
        callLog.add(name + ".afterAdd");
    }

    @Override
    public void beforeLoad() {
        callLog.add(name + ".beforeLoad");
    }

    @Override
    public void load() throws Exception {
        callLog.add(name + ".load");
        if (failOnLoad) {
            throw new IllegalStateException(name + " failed to load");
        }
    }

    @Override
    public void install(InstallOptions options) {
        callLog.add(name + ".install");
    }

    @Override
    public void afterEnable() {
        callLog.add(name + ".afterEnable");
    }

    @Override
    public void afterDisable() {
        callLog.add(name + ".afterDisable");
    }

    @Override
    public void remove() {
        callLog.add(name + ".remove");
    }

    @Override
    public List<String> requiredPlugins() {
        return requiredPlugins;
    }
}
