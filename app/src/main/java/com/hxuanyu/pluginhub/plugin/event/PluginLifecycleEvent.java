package com.hxuanyu.pluginhub.plugin.event;

import com.hxuanyu.pluginhub.plugin.core.PluginInstance;
import lombok.Getter;
import org.springframework.context.ApplicationEvent;

/**
 * 插件生命周期事件，由宿主应用在插件状态变化时同步发布
 */
@Getter
public class PluginLifecycleEvent extends ApplicationEvent {

    private final String appName;
    private final PluginEventType type;
    private final String pluginName;
    private final transient PluginInstance instance;
    // 安装选项或加载选项，可能为 null
    private final transient Object options;

    public PluginLifecycleEvent(Object source, String appName, PluginEventType type,
                                PluginInstance instance, Object options) {
        super(source);
        this.appName = appName;
        this.type = type;
        this.pluginName = instance.getName();
        this.instance = instance;
        this.options = options;
    }

    @Override
    public String toString() {
        return type.getEventName() + "[" + pluginName + "@" + appName + "]";
    }
}
