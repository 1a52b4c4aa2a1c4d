package com.hxuanyu.pluginhub.cli;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 控制通道响应，命令执行结束后写回一行
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PluginControlResponse {

    private boolean ok;
    private String error;

    public static PluginControlResponse success() {
        return new PluginControlResponse(true, null);
    }

    public static PluginControlResponse failure(String error) {
        return new PluginControlResponse(false, error);
    }
}
