package com.hxuanyu.pluginhub.plugin.source;

import com.hxuanyu.pluginhub.plugin.model.PluginDescriptor;
import com.hxuanyu.pluginhub.plugin.model.PluginRecord;

import java.nio.file.Path;
import java.util.Optional;

/**
 * 插件包来源解析
 * 负责从仓库、zip 地址或本地目录获取插件包，并安装到插件包目录。
 * 所有下载、解压、读取失败均以 {@link com.hxuanyu.pluginhub.plugin.model.PackageResolutionException} 抛出。
 */
public interface PluginPackageResolver {

    /**
     * 从 npm 风格仓库下载并安装插件包
     *
     * @param version 为 null 时安装最新版本
     */
    PluginPackageInfo resolveFromNpm(String name, String registry, String version);

    /**
     * 下载并安装 zip 插件包
     *
     * @param name 为 null 时使用包内 plugin.yml 声明的名称
     */
    PluginPackageInfo resolveFromZip(String zipUrl, String name);

    /**
     * 读取本地插件包的名称与版本，不复制文件
     */
    PluginPackageInfo resolveFromLocal(Path localPath);

    /**
     * 将本地插件包复制到插件包目录
     */
    PluginPackageInfo installLocalPackage(Path localPath);

    /**
     * 仓库中存在比记录更新的版本时返回该版本
     */
    Optional<String> getNewVersion(PluginRecord record);

    /**
     * 插件包缺失时按记录中的来源重新获取
     */
    void checkPluginPackage(PluginRecord record);

    void removePackage(String name);

    Path getPackageDir(String name);

    boolean packageExists(String name);

    Optional<PluginDescriptor> readDescriptor(String name);

    String getClientStaticUrl(String name);
}
