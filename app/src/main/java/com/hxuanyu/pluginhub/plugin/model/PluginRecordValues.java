package com.hxuanyu.pluginhub.plugin.model;

import lombok.Builder;
import lombok.Data;

import java.util.Map;

/**
 * 插件记录的局部更新值，仅写入非 null 字段
 */
@Data
@Builder
public class PluginRecordValues {

    private String version;
    private String registry;
    private String zipUrl;
    private String clientUrl;
    private Boolean enabled;
    private Boolean installed;
    private Map<String, Object> options;

    public void applyTo(PluginRecord record) {
        if (version != null) record.setVersion(version);
        if (registry != null) record.setRegistry(registry);
        if (zipUrl != null) record.setZipUrl(zipUrl);
        if (clientUrl != null) record.setClientUrl(clientUrl);
        if (enabled != null) record.setEnabled(enabled);
        if (installed != null) record.setInstalled(installed);
        if (options != null) record.setOptions(options);
    }
}
