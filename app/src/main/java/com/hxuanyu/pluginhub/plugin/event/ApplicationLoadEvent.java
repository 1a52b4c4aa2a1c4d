package com.hxuanyu.pluginhub.plugin.event;

import lombok.Getter;
import org.springframework.context.ApplicationEvent;

/**
 * 应用加载前事件（beforeLoad）
 * method 为触发加载的命令，例如 start、install、upgrade；reload 表示重新加载
 */
@Getter
public class ApplicationLoadEvent extends ApplicationEvent {

    private final String appName;
    private final String method;
    private final boolean reload;

    public ApplicationLoadEvent(Object source, String appName, String method, boolean reload) {
        super(source);
        this.appName = appName;
        this.method = method;
        this.reload = reload;
    }
}
