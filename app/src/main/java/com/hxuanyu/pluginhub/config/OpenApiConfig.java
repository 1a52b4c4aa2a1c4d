package com.hxuanyu.pluginhub.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI 配置
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI pluginHubOpenAPI() {
        Info info = new Info()
                .title("Plugin Hub API")
                .description("插件管理接口：添加、启用、禁用、升级与移除插件")
                .version("v1.0.0");

        return new OpenAPI()
                .info(info)
                .servers(List.of(new Server().url("/").description("默认服务")))
                .components(new Components());
    }
}
