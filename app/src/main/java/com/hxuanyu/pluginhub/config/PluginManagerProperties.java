package com.hxuanyu.pluginhub.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * 插件管理配置，从 application.yaml 的 platform.plugin 读取。
 */
@Component
@ConfigurationProperties(prefix = "platform.plugin")
public class PluginManagerProperties {

    /** 当前应用实例名称，插件记录按此隔离 */
    private String appName = "main";

    /** 已安装插件包目录，每个插件占用一个子目录 */
    private String packagesDir = "./storage/plugins";

    /** 本地开发插件目录（pm create / pm add 使用） */
    private String localPackagesDir = "./packages/plugins";

    /** 插件数据目录 */
    private String dataDir = "./storage/data/plugins";

    /** 控制通道 socket 文件路径 */
    private String pmSock = "./storage/pm.sock";

    /** 未指定 registry 时使用的默认仓库地址 */
    private String defaultRegistry = "https://registry.npmjs.org";

    /** 插件前端静态资源地址前缀 */
    private String clientUrlPrefix = "/static/plugins/";

    /** 启动时是否自动加载插件并监听控制通道 */
    private boolean autoLoad = true;

    public String getAppName() {
        return appName;
    }

    public void setAppName(String appName) {
        this.appName = appName;
    }

    public String getPackagesDir() {
        return packagesDir;
    }

    public void setPackagesDir(String packagesDir) {
        this.packagesDir = packagesDir;
    }

    public String getLocalPackagesDir() {
        return localPackagesDir;
    }

    public void setLocalPackagesDir(String localPackagesDir) {
        this.localPackagesDir = localPackagesDir;
    }

    public String getDataDir() {
        return dataDir;
    }

    public void setDataDir(String dataDir) {
        this.dataDir = dataDir;
    }

    public String getPmSock() {
        return pmSock;
    }

    public void setPmSock(String pmSock) {
        this.pmSock = pmSock;
    }

    public String getDefaultRegistry() {
        return defaultRegistry;
    }

    public void setDefaultRegistry(String defaultRegistry) {
        this.defaultRegistry = defaultRegistry;
    }

    public String getClientUrlPrefix() {
        return clientUrlPrefix;
    }

    public void setClientUrlPrefix(String clientUrlPrefix) {
        this.clientUrlPrefix = clientUrlPrefix;
    }

    public boolean isAutoLoad() {
        return autoLoad;
    }

    public void setAutoLoad(boolean autoLoad) {
        this.autoLoad = autoLoad;
    }
}
