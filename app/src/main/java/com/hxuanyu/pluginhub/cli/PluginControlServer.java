package com.hxuanyu.pluginhub.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hxuanyu.pluginhub.config.PluginManagerProperties;
import com.hxuanyu.pluginhub.plugin.core.PluginManager;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.net.StandardProtocolFamily;
import java.net.UnixDomainSocketAddress;
import java.nio.channels.AsynchronousCloseException;
import java.nio.channels.Channels;
import java.nio.channels.ServerSocketChannel;
import java.nio.channels.SocketChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 插件管理控制通道服务端
 * 监听 Unix 域套接字，逐行读取控制消息并交给 {@link PluginManager#doCliCommand} 执行
 */
@Component
@Slf4j
public class PluginControlServer {

    private final PluginManager pluginManager;
    private final ObjectMapper objectMapper;
    private final PluginManagerProperties properties;

    private volatile ServerSocketChannel serverChannel;
    private volatile ExecutorService workers;
    private volatile Path socketPath;

    public PluginControlServer(PluginManager pluginManager, ObjectMapper objectMapper,
                               PluginManagerProperties properties) {
        this.pluginManager = pluginManager;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    /**
     * 删除残留的 socket 文件后重新监听
     */
    public synchronized void listen() throws IOException {
        if (serverChannel != null) {
            return;
        }
        Path path = Paths.get(properties.getPmSock()).toAbsolutePath().normalize();
        Files.deleteIfExists(path);
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }

        ServerSocketChannel channel = ServerSocketChannel.open(StandardProtocolFamily.UNIX);
        channel.bind(UnixDomainSocketAddress.of(path));
        this.serverChannel = channel;
        this.socketPath = path;

        AtomicInteger counter = new AtomicInteger();
        this.workers = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "pm-sock-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        Thread acceptor = new Thread(() -> acceptLoop(channel), "pm-sock-acceptor");
        acceptor.setDaemon(true);
        acceptor.start();
        log.info("✅ Plugin control channel listening on {}", path);
    }

    public boolean isListening() {
        return serverChannel != null && serverChannel.isOpen();
    }

    /**
     * 停止监听并删除 socket 文件
     */
    @PreDestroy
    public synchronized void close() {
        ServerSocketChannel channel = serverChannel;
        if (channel == null) {
            return;
        }
        serverChannel = null;
        try {
            channel.close();
        } catch (IOException e) {
            log.warn("Error closing control channel: {}", e.getMessage());
        }
        if (workers != null) {
            workers.shutdownNow();
            workers = null;
        }
        try {
            Files.deleteIfExists(socketPath);
        } catch (IOException e) {
            log.warn("Failed to delete socket file {}: {}", socketPath, e.getMessage());
        }
        log.info("Plugin control channel closed");
    }

    private void acceptLoop(ServerSocketChannel channel) {
        while (channel.isOpen()) {
            try {
                SocketChannel client = channel.accept();
                ExecutorService pool = workers;
                if (pool == null) {
                    client.close();
                    return;
                }
                pool.submit(() -> serve(client));
            } catch (AsynchronousCloseException e) {
                return;
            } catch (IOException e) {
                if (channel.isOpen()) {
                    log.warn("Accept failed on control channel: {}", e.getMessage());
                }
            }
        }
    }

    // 同一连接上的消息按顺序处理
    private void serve(SocketChannel client) {
        try (SocketChannel channel = client;
             BufferedReader reader = new BufferedReader(new InputStreamReader(Channels.newInputStream(channel), StandardCharsets.UTF_8));
             BufferedWriter writer = new BufferedWriter(new OutputStreamWriter(Channels.newOutputStream(channel), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isBlank()) {
                    continue;
                }
                PluginControlResponse response = handle(line);
                writer.write(objectMapper.writeValueAsString(response));
                writer.newLine();
                writer.flush();
            }
        } catch (IOException e) {
            log.warn("Control channel connection error: {}", e.getMessage());
        }
    }

    PluginControlResponse handle(String line) {
        PluginControlMessage message;
        try {
            message = objectMapper.readValue(line, PluginControlMessage.class);
        } catch (JsonProcessingException e) {
            log.error("Malformed control message: {}", e.getOriginalMessage());
            return PluginControlResponse.failure("malformed message: " + e.getOriginalMessage());
        }
        if (message.getMethod() == null || message.getMethod().isBlank()) {
            return PluginControlResponse.failure("method is required");
        }

        List<String> plugins = message.getPlugins() == null ? List.of() : message.getPlugins();
        log.info("{} {}", message.getMethod(), plugins);
        try {
            pluginManager.doCliCommand(message.getMethod(), plugins);
            return PluginControlResponse.success();
        } catch (Exception e) {
            log.error(e.getMessage());
            return PluginControlResponse.failure(e.getMessage());
        }
    }
}
