package com.hxuanyu.pluginhub.plugin.api;

/**
 * 插件工厂
 * 插件包通过 META-INF/services/com.hxuanyu.pluginhub.plugin.api.PluginFactory 声明唯一实现，
 * 平台据此创建插件实例。
 */
public interface PluginFactory {

    /**
     * 插件名称，返回 null 或空串时由平台生成名称（仅限静态插件）
     */
    String getName();

    /**
     * 创建插件实例
     *
     * @param context 平台上下文
     */
    IPlugin create(PlatformContext context) throws Exception;
}
