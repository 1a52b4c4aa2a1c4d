package com.hxuanyu.pluginhub;

import com.hxuanyu.pluginhub.cli.PlatformCommandRunner;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;

@SpringBootApplication
@Slf4j
public class PluginHubApplication {

    public static void main(String[] args) {
        SpringApplication application = new SpringApplication(PluginHubApplication.class);
        // 除 start 以外的命令执行完即退出，不启动 Web 服务
        boolean oneShot = isOneShotCommand(args);
        if (oneShot) {
            application.setWebApplicationType(WebApplicationType.NONE);
        }
        ConfigurableApplicationContext ctx = application.run(args);
        if (oneShot) {
            System.exit(SpringApplication.exit(ctx));
        }

        var env = ctx.getEnvironment();
        String port = env.getProperty("server.port", "8080");
        String contextPath = env.getProperty("server.servlet.context-path", "");
        String baseUrl = "http://localhost:" + port + contextPath;

        log.info("===========================================");
        log.info("🎉 Plugin Hub Started Successfully!");
        log.info("🌐 Access: {}", baseUrl);
        log.info("📘 OpenAPI JSON: {}/v3/api-docs", baseUrl);
        log.info("🧭 Swagger UI  : {}/swagger-ui/index.html", baseUrl);
        log.info("===========================================");
    }

    static boolean isOneShotCommand(String[] args) {
        for (String arg : args) {
            if (!arg.startsWith("--")) {
                return !PlatformCommandRunner.COMMAND_START.equals(arg);
            }
        }
        return false;
    }
}
