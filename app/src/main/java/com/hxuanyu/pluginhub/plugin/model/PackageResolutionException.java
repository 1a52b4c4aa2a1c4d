package com.hxuanyu.pluginhub.plugin.model;

/**
 * 插件包下载、解压或读取失败
 */
public class PackageResolutionException extends PluginException {

    public PackageResolutionException(String message) {
        super(message);
    }

    public PackageResolutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
