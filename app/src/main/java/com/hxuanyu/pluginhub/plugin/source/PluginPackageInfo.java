package com.hxuanyu.pluginhub.plugin.source;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.nio.file.Path;

/**
 * 插件包解析结果
 */
@Data
@AllArgsConstructor
public class PluginPackageInfo {
    private String name;
    private String version;
    private Path packageDir;
}
