package com.hxuanyu.pluginhub.plugin.model;

import lombok.Data;
import org.yaml.snakeyaml.Yaml;

import java.io.InputStream;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 插件描述符
 * 对应插件包根目录下 plugin.yml 的内容
 */
@Data
public class PluginDescriptor {

    public static final String FILE_NAME = "plugin.yml";

    private String name;
    private String version;
    private String displayName;
    private String description;
    private String author;
    // 插件在描述符中声明的标签
    private List<String> tags;

    /**
     * 从 YAML 加载
     */
    @SuppressWarnings("unchecked")
    public static PluginDescriptor load(InputStream yamlStream) {
        Yaml yaml = new Yaml();
        Object loaded = yaml.load(yamlStream);
        if (!(loaded instanceof Map)) {
            throw new PackageResolutionException(FILE_NAME + " must be a mapping");
        }
        Map<String, Object> data = (Map<String, Object>) loaded;

        PluginDescriptor descriptor = new PluginDescriptor();
        descriptor.setName(asString(data.get("name")));
        descriptor.setVersion(asString(data.get("version")));
        descriptor.setDisplayName(asString(data.get("displayName")));
        descriptor.setDescription(asString(data.get("description")));
        descriptor.setAuthor(asString(data.get("author")));

        // 标签支持 YAML 列表或逗号分隔的字符串
        Object tagsObj = data.get("tags");
        if (tagsObj instanceof List) {
            descriptor.setTags(((List<?>) tagsObj).stream()
                    .filter(Objects::nonNull)
                    .map(Object::toString)
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .toList());
        } else if (tagsObj instanceof String) {
            String csv = ((String) tagsObj).trim();
            if (!csv.isEmpty()) {
                descriptor.setTags(java.util.Arrays.stream(csv.split(","))
                        .map(String::trim)
                        .filter(s -> !s.isEmpty())
                        .distinct()
                        .toList());
            }
        }

        if (descriptor.getName() == null || descriptor.getName().isBlank()) {
            throw new PackageResolutionException(FILE_NAME + " is missing required field: name");
        }
        return descriptor;
    }

    // 版本号在 YAML 中可能被解析为数字，例如 version: 1.0
    private static String asString(Object value) {
        return value == null ? null : String.valueOf(value);
    }
}
