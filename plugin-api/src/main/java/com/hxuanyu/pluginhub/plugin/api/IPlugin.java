package com.hxuanyu.pluginhub.plugin.api;

import java.util.Collections;
import java.util.List;

/**
 * 插件接口
 * 所有插件由 {@link PluginFactory} 创建，平台按固定顺序回调以下钩子。
 * 钩子均可抛出异常，异常会中断当前生命周期操作并原样返回给调用方。
 */
public interface IPlugin {

    /**
     * 插件被添加到平台后调用（新增或升级）
     */
    default void afterAdd() throws Exception {
    }

    /**
     * 应用启动阶段、开始处理请求之前调用
     */
    default void beforeLoad() throws Exception {
    }

    /**
     * 插件加载时调用，仅对已启用插件生效
     */
    default void load() throws Exception {
    }

    /**
     * 插件安装时调用
     * 可以在此初始化数据表、默认数据等
     *
     * @param options 安装选项
     */
    default void install(InstallOptions options) throws Exception {
    }

    /**
     * 插件启用后调用
     */
    default void afterEnable() throws Exception {
    }

    /**
     * 插件禁用后调用
     * 应该在此清理资源
     */
    default void afterDisable() throws Exception {
    }

    /**
     * 插件移除前调用
     * 应该在此执行最终的清理工作
     */
    default void remove() throws Exception {
    }

    /**
     * 启用本插件前必须已启用的插件名称
     */
    default List<String> requiredPlugins() {
        return Collections.emptyList();
    }
}
