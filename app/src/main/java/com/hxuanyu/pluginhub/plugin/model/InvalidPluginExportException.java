package com.hxuanyu.pluginhub.plugin.model;

/**
 * 插件包未提供可用的 PluginFactory
 */
public class InvalidPluginExportException extends PluginException {

    public InvalidPluginExportException(String message) {
        super(message);
    }

    public InvalidPluginExportException(String message, Throwable cause) {
        super(message, cause);
    }
}
