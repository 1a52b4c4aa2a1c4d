package com.hxuanyu.pluginhub.plugin.model;

import lombok.Data;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * 插件列表项
 * 插件记录与插件包描述信息合并后的结果，用于管理接口展示
 */
@Data
public class PluginInfoDTO {
    private String name;
    private String appName;
    private String version;
    private String registry;
    private String zipUrl;
    private String clientUrl;
    private boolean enabled;
    private boolean installed;
    private boolean builtIn;
    private boolean official;
    private Map<String, Object> options;
    private Instant createdAt;
    private Instant updatedAt;

    private String displayName;
    private String description;
    private String author;
    private List<String> tags;
    private boolean packageExists;
}
