package com.hxuanyu.pluginhub.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hxuanyu.pluginhub.config.PluginManagerProperties;
import com.hxuanyu.pluginhub.plugin.core.PluginManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.net.StandardProtocolFamily;
import java.net.UnixDomainSocketAddress;
import java.nio.ByteBuffer;
import java.nio.channels.Channels;
import java.nio.channels.SocketChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Paths;
import java.util.List;

/**
 * 插件管理控制通道客户端
 * 优先把命令发给运行中的服务端，连接失败时在当前进程内执行
 */
@Component
@Slf4j
public class PluginControlClient {

    private final PluginManager pluginManager;
    private final ObjectMapper objectMapper;
    private final PluginManagerProperties properties;

    public PluginControlClient(PluginManager pluginManager, ObjectMapper objectMapper,
                               PluginManagerProperties properties) {
        this.pluginManager = pluginManager;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    public PluginControlResponse clientWrite(PluginControlMessage message) {
        List<String> plugins = message.getPlugins() == null ? List.of() : message.getPlugins();
        log.info("{} {}", message.getMethod(), plugins);

        // create 只涉及本地文件，总是在当前进程执行
        if (PluginManager.METHOD_CREATE.equals(message.getMethod())) {
            return runLocally(message.getMethod(), plugins);
        }

        SocketChannel channel;
        try {
            channel = connect();
        } catch (IOException e) {
            log.debug("Control channel unavailable ({}), running locally", e.getMessage());
            return runLocally(message.getMethod(), plugins);
        }

        try (SocketChannel connected = channel) {
            byte[] payload = (objectMapper.writeValueAsString(message) + "\n").getBytes(StandardCharsets.UTF_8);
            ByteBuffer buffer = ByteBuffer.wrap(payload);
            while (buffer.hasRemaining()) {
                connected.write(buffer);
            }
            connected.shutdownOutput();

            BufferedReader reader = new BufferedReader(
                    new InputStreamReader(Channels.newInputStream(connected), StandardCharsets.UTF_8));
            String line = reader.readLine();
            if (line == null) {
                return PluginControlResponse.success();
            }
            PluginControlResponse response = objectMapper.readValue(line, PluginControlResponse.class);
            if (!response.isOk()) {
                log.error(response.getError());
            }
            return response;
        } catch (IOException e) {
            log.error(e.getMessage());
            return PluginControlResponse.failure(e.getMessage());
        }
    }

    private SocketChannel connect() throws IOException {
        SocketChannel channel = SocketChannel.open(StandardProtocolFamily.UNIX);
        try {
            channel.connect(UnixDomainSocketAddress.of(Paths.get(properties.getPmSock()).toAbsolutePath().normalize()));
            return channel;
        } catch (IOException e) {
            channel.close();
            throw e;
        }
    }

    private PluginControlResponse runLocally(String method, List<String> plugins) {
        try {
            pluginManager.doCliCommand(method, plugins);
            return PluginControlResponse.success();
        } catch (Exception e) {
            log.error(e.getMessage());
            return PluginControlResponse.failure(e.getMessage());
        }
    }
}
