package com.hxuanyu.pluginhub.plugin.core;

import com.hxuanyu.pluginhub.plugin.api.PluginFactory;
import lombok.Builder;
import lombok.Data;

import java.util.Map;

/**
 * 静态插件定义
 * 以 Bean 形式声明，应用启动时先于数据库中的插件注册；name 为空时使用工厂名称或生成名称
 */
@Data
@Builder
public class StaticPluginDefinition {
    private PluginFactory factory;
    private String name;
    private boolean enabled;
    private boolean builtIn;
    private Map<String, Object> options;
}
