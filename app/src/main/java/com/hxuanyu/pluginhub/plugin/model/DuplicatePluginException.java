package com.hxuanyu.pluginhub.plugin.model;

/**
 * 插件名称已存在
 */
public class DuplicatePluginException extends PluginException {

    public DuplicatePluginException(String message) {
        super(message);
    }
}
