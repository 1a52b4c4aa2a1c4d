package com.hxuanyu.pluginhub.plugin.event;

import lombok.Getter;
import org.springframework.context.ApplicationEvent;

/**
 * 应用升级前事件（beforeUpgrade）
 */
@Getter
public class ApplicationUpgradeEvent extends ApplicationEvent {

    private final String appName;

    public ApplicationUpgradeEvent(Object source, String appName) {
        super(source);
        this.appName = appName;
    }
}
