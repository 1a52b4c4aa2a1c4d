package com.hxuanyu.pluginhub.cli;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 控制通道消息，每行一个 JSON 对象
 * plugins 可以是单个名称或名称数组
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PluginControlMessage {

    private String method;

    @JsonFormat(with = JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY)
    private List<String> plugins;
}
