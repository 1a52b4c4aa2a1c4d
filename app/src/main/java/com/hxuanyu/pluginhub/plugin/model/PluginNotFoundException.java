package com.hxuanyu.pluginhub.plugin.model;

/**
 * 插件实例或插件记录不存在
 */
public class PluginNotFoundException extends PluginException {

    public PluginNotFoundException(String message) {
        super(message);
    }
}
