package com.hxuanyu.pluginhub.support;

import com.hxuanyu.pluginhub.plugin.api.PluginFactory;
import com.hxuanyu.pluginhub.plugin.core.StaticPluginDefinition;
import com.hxuanyu.pluginhub.plugin.event.PluginLifecycleEvent;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.event.EventListener;

import java.util.List;

/**
 * 测试用插件工厂与事件记录
 */
@TestConfiguration
public class TestPluginConfig {

    private final PluginCallLog callLog = new PluginCallLog();

    @Bean
    public PluginCallLog pluginCallLog() {
        return callLog;
    }

    @Bean
    public PluginFactory fooPluginFactory() {
        return new RecordingPluginFactory("foo", callLog);
    }

    @Bean
    public PluginFactory barPluginFactory() {
        return new RecordingPluginFactory("bar", callLog);
    }

    @Bean
    public PluginFactory needsBarPluginFactory() {
        return new RecordingPluginFactory("needs-bar", callLog, List.of("bar"), false);
    }

    @Bean
    public PluginFactory alphaPluginFactory() {
        return new RecordingPluginFactory("alpha", callLog);
    }

    @Bean
    public PluginFactory failingPluginFactory() {
        return new RecordingPluginFactory("failing", callLog, List.of(), true);
    }

    @Bean
    public PluginFactory gammaPluginFactory() {
        return new RecordingPluginFactory("gamma", callLog);
    }

    @Bean
    public PluginFactory npmDemoPluginFactory() {
        return new RecordingPluginFactory("npm-demo", callLog);
    }

    /**
     * 未命名的静态插件，注册时获得生成名称
     */
    @Bean
    public StaticPluginDefinition anonymousStaticPlugin() {
        return StaticPluginDefinition.builder()
                .factory(new RecordingPluginFactory(null, callLog))
                .enabled(true)
                .builtIn(true)
                .build();
    }

    @EventListener
    public void onPluginEvent(PluginLifecycleEvent event) {
        callLog.add("event:" + event.getType().getEventName() + ":" + event.getPluginName());
    }
}
