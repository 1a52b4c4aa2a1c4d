package com.hxuanyu.pluginhub.plugin.model;

/**
 * 依赖插件未启用，无法启用当前插件
 */
public class RequiredPluginNotEnabledException extends PluginException {

    public RequiredPluginNotEnabledException(String message) {
        super(message);
    }
}
