package com.hxuanyu.pluginhub.plugin.core;

import lombok.Builder;
import lombok.Data;

import java.util.Map;

/**
 * 创建插件实例时绑定的属性
 */
@Data
@Builder
public class PluginInstanceOptions {
    private String name;
    private boolean enabled;
    private boolean builtIn;
    private Map<String, Object> options;
}
