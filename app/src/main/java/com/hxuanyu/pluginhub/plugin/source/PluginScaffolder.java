package com.hxuanyu.pluginhub.plugin.source;

import com.hxuanyu.pluginhub.plugin.model.PackageResolutionException;
import com.hxuanyu.pluginhub.plugin.model.PluginDescriptor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 本地插件包脚手架
 * 生成 &lt;目录&gt;/plugin.yml 与 &lt;目录&gt;/lib/，插件 JAR 放入 lib 后即可通过 pm add 添加
 */
@Component
@Slf4j
public class PluginScaffolder {

    static final String INITIAL_VERSION = "0.1.0";

    /**
     * @return 新建的包目录；目录已存在时返回 null
     */
    public Path scaffold(Path localPackagesDir, String name) {
        Path packageDir = localPackagesDir.resolve(name).toAbsolutePath().normalize();
        if (!packageDir.startsWith(localPackagesDir.toAbsolutePath().normalize())) {
            throw new PackageResolutionException("Illegal plugin name: " + name);
        }
        if (Files.exists(packageDir)) {
            return null;
        }

        Map<String, Object> descriptor = new LinkedHashMap<>();
        descriptor.put("name", name);
        descriptor.put("version", INITIAL_VERSION);
        descriptor.put("displayName", name);
        descriptor.put("description", "");

        DumperOptions options = new DumperOptions();
        options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        options.setPrettyFlow(true);

        try {
            Files.createDirectories(packageDir.resolve("lib"));
            try (Writer writer = Files.newBufferedWriter(packageDir.resolve(PluginDescriptor.FILE_NAME), StandardCharsets.UTF_8)) {
                new Yaml(options).dump(descriptor, writer);
            }
        } catch (IOException e) {
            throw new PackageResolutionException("Failed to scaffold plugin package " + packageDir, e);
        }
        log.info("Scaffolded plugin package: {}", packageDir);
        return packageDir;
    }
}
