package com.hxuanyu.pluginhub.plugin.event;

/**
 * 插件生命周期事件类型
 */
public enum PluginEventType {
    BEFORE_LOAD_PLUGIN("beforeLoadPlugin"),
    AFTER_LOAD_PLUGIN("afterLoadPlugin"),
    BEFORE_INSTALL_PLUGIN("beforeInstallPlugin"),
    AFTER_INSTALL_PLUGIN("afterInstallPlugin"),
    AFTER_ENABLE_PLUGIN("afterEnablePlugin"),
    AFTER_DISABLE_PLUGIN("afterDisablePlugin");

    private final String eventName;

    PluginEventType(String eventName) {
        this.eventName = eventName;
    }

    public String getEventName() {
        return eventName;
    }
}
