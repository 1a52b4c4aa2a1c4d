package com.hxuanyu.pluginhub.plugin.api;

import org.slf4j.Logger;

import java.nio.file.Path;
import java.util.Map;

/**
 * 平台上下文
 * 平台提供给插件的服务接口，创建插件实例时传入
 */
public interface PlatformContext {

    /**
     * 获取宿主应用名称
     */
    String getAppName();

    /**
     * 获取插件名称
     */
    String getPluginName();

    /**
     * 插件当前是否已启用
     */
    boolean isEnabled();

    /**
     * 是否为内置插件（不可禁用、不可移除）
     */
    boolean isBuiltIn();

    /**
     * 获取插件记录中保存的选项
     */
    Map<String, Object> getOptions();

    /**
     * 获取插件数据目录
     * 插件可以在此目录下存储数据文件
     */
    Path getDataDirectory();

    /**
     * 记录日志
     */
    void log(String message);

    /**
     * 记录错误
     */
    void error(String message, Throwable throwable);

    /**
     * 获取 SLF4J 日志对象，日志名为 plugin.&lt;插件名&gt;
     */
    Logger getLogger();
}
