package com.hxuanyu.pluginhub.plugin.api;

import java.util.Collections;
import java.util.List;

/**
 * 安装选项
 */
public class InstallOptions {

    private static final InstallOptions DEFAULT = new InstallOptions(false, false, Collections.emptyList());

    private final boolean clean;
    private final boolean sync;
    private final List<String> cliArgs;

    public InstallOptions(boolean clean, boolean sync, List<String> cliArgs) {
        this.clean = clean;
        this.sync = sync;
        this.cliArgs = cliArgs == null ? Collections.emptyList() : List.copyOf(cliArgs);
    }

    public static InstallOptions defaults() {
        return DEFAULT;
    }

    /**
     * 是否清空已有数据后重新安装
     */
    public boolean isClean() {
        return clean;
    }

    /**
     * 是否在安装前同步数据表结构
     */
    public boolean isSync() {
        return sync;
    }

    public List<String> getCliArgs() {
        return cliArgs;
    }

    @Override
    public String toString() {
        return "InstallOptions{clean=" + clean + ", sync=" + sync + ", cliArgs=" + cliArgs + '}';
    }
}
