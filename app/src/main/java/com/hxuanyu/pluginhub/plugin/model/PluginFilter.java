package com.hxuanyu.pluginhub.plugin.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 插件记录查询条件，值为 null 的字段不参与匹配
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class PluginFilter {

    private String name;
    private String appName;
    private Boolean enabled;
    private Boolean installed;
    private Boolean builtIn;

    public static PluginFilter of(String name, String appName) {
        return PluginFilter.builder().name(name).appName(appName).build();
    }

    /**
     * 转换为按例查询使用的探针对象
     */
    public PluginRecord toProbe() {
        PluginRecord probe = new PluginRecord();
        probe.setName(name);
        probe.setAppName(appName);
        probe.setEnabled(enabled);
        probe.setInstalled(installed);
        probe.setBuiltIn(builtIn);
        probe.setOptions(null);
        return probe;
    }
}
