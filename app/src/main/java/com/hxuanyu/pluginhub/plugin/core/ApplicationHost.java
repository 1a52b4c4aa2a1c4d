package com.hxuanyu.pluginhub.plugin.core;

import com.hxuanyu.pluginhub.config.PluginManagerProperties;
import com.hxuanyu.pluginhub.plugin.event.ApplicationLoadEvent;
import com.hxuanyu.pluginhub.plugin.event.ApplicationUpgradeEvent;
import com.hxuanyu.pluginhub.plugin.event.PluginEventType;
import com.hxuanyu.pluginhub.plugin.event.PluginLifecycleEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * 宿主应用
 * 持有应用名称，并通过 Spring 事件总线同步发布应用级与插件级事件
 */
@Component
@Slf4j
public class ApplicationHost {

    private final PluginManagerProperties properties;
    private final ApplicationEventPublisher publisher;

    public ApplicationHost(PluginManagerProperties properties, ApplicationEventPublisher publisher) {
        this.properties = properties;
        this.publisher = publisher;
    }

    public String getName() {
        return properties.getAppName();
    }

    /**
     * 发布插件事件，监听器在当前线程内依次执行，抛出的异常会中断调用方
     */
    public void emit(PluginEventType type, PluginInstance instance, Object options) {
        log.debug("Emit {} for plugin {}", type.getEventName(), instance.getName());
        publisher.publishEvent(new PluginLifecycleEvent(this, getName(), type, instance, options));
    }

    /**
     * 发布 beforeLoad 事件
     */
    public void beforeLoad(String method, boolean reload) {
        log.info("Application {} before load (method={}, reload={})", getName(), method, reload);
        publisher.publishEvent(new ApplicationLoadEvent(this, getName(), method, reload));
    }

    /**
     * 发布 beforeUpgrade 事件
     */
    public void beforeUpgrade() {
        log.info("Application {} before upgrade", getName());
        publisher.publishEvent(new ApplicationUpgradeEvent(this, getName()));
    }
}
