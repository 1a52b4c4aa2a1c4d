package com.hxuanyu.pluginhub.cli;

import com.hxuanyu.pluginhub.config.PluginManagerProperties;
import com.hxuanyu.pluginhub.plugin.api.InstallOptions;
import com.hxuanyu.pluginhub.plugin.core.ApplicationHost;
import com.hxuanyu.pluginhub.plugin.core.PluginManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 启动命令
 * <ul>
 *     <li>start（默认）：加载插件并监听控制通道</li>
 *     <li>install [--clean] [--sync]：安装已启用插件</li>
 *     <li>upgrade：同步表结构并重新安装已启用插件</li>
 *     <li>pm &lt;create|add|enable|disable|remove&gt; &lt;name...&gt;：插件管理命令</li>
 * </ul>
 */
@Component
@Slf4j
public class PlatformCommandRunner implements ApplicationRunner {

    public static final String COMMAND_START = "start";
    public static final String COMMAND_INSTALL = "install";
    public static final String COMMAND_UPGRADE = "upgrade";
    public static final String COMMAND_PM = "pm";

    private final ApplicationHost host;
    private final PluginManager pluginManager;
    private final PluginControlServer controlServer;
    private final PluginControlClient controlClient;
    private final PluginManagerProperties properties;

    public PlatformCommandRunner(ApplicationHost host, PluginManager pluginManager,
                                 PluginControlServer controlServer, PluginControlClient controlClient,
                                 PluginManagerProperties properties) {
        this.host = host;
        this.pluginManager = pluginManager;
        this.controlServer = controlServer;
        this.controlClient = controlClient;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) throws Exception {
        if (!properties.isAutoLoad()) {
            log.info("Auto-load is disabled");
            return;
        }
        List<String> commandArgs = args.getNonOptionArgs();
        String command = commandArgs.isEmpty() ? COMMAND_START : commandArgs.get(0);

        switch (command) {
            case COMMAND_START:
                start();
                break;
            case COMMAND_INSTALL:
                install(new InstallOptions(args.containsOption("clean"), args.containsOption("sync"),
                        commandArgs.subList(1, commandArgs.size())));
                break;
            case COMMAND_UPGRADE:
                upgrade();
                break;
            case COMMAND_PM:
                pm(commandArgs.subList(1, commandArgs.size()));
                break;
            default:
                log.error("Unknown command: {}", command);
        }
    }

    public void start() throws Exception {
        log.info("🔌 Loading plugins...");
        host.beforeLoad(COMMAND_START, false);
        pluginManager.loadAll(null);
        controlServer.listen();
    }

    public void install(InstallOptions options) throws Exception {
        log.info("Installing app {} with {}", host.getName(), options);
        host.beforeLoad(COMMAND_INSTALL, false);
        pluginManager.install(options);
        host.beforeLoad(COMMAND_INSTALL, true);
        pluginManager.loadAll(null);
        log.info("✅ App {} installed", host.getName());
    }

    public void upgrade() throws Exception {
        log.info("Upgrading app {}", host.getName());
        host.beforeUpgrade();
        host.beforeLoad(COMMAND_UPGRADE, false);
        pluginManager.install(new InstallOptions(false, true, List.of()));
        pluginManager.loadAll(null);
        log.info("✅ App {} upgraded", host.getName());
    }

    /**
     * 执行 pm 命令，返回结果不影响进程退出码
     */
    public PluginControlResponse pm(List<String> pmArgs) {
        if (pmArgs.isEmpty()) {
            log.error("Usage: pm <create|add|enable|disable|remove> <name...>");
            return PluginControlResponse.failure("method is required");
        }
        String method = pmArgs.get(0);
        List<String> names = pmArgs.subList(1, pmArgs.size());
        log.info("{} {}", method, String.join(" ", names));
        if (!PluginManager.METHOD_CREATE.equals(method)) {
            // 本地执行时需要数据库中的插件实例；个别记录初始化失败时仍继续下发命令
            try {
                host.beforeLoad(COMMAND_PM, false);
            } catch (RuntimeException e) {
                log.error(e.getMessage());
            }
        }
        return controlClient.clientWrite(new PluginControlMessage(method, List.copyOf(names)));
    }
}
