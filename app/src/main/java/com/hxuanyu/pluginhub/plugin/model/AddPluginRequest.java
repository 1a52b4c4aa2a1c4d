package com.hxuanyu.pluginhub.plugin.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 添加插件的参数
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AddPluginRequest {

    private String name;

    // npm 仓库地址，为空时使用默认仓库
    private String registry;

    private String zipUrl;

    private boolean builtIn;

    private boolean official;
}
