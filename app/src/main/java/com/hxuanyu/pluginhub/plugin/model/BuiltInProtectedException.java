package com.hxuanyu.pluginhub.plugin.model;

/**
 * 内置插件不允许禁用或移除
 */
public class BuiltInProtectedException extends PluginException {

    public BuiltInProtectedException(String message) {
        super(message);
    }
}
