package com.hxuanyu.pluginhub.plugin.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hxuanyu.pluginhub.plugin.model.PackageResolutionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.net.URI;

/**
 * npm 风格仓库客户端
 * 仅使用包元数据中的 dist-tags.latest 与 versions[v].dist.tarball 两部分
 */
@Component
@Slf4j
public class NpmRegistryClient {

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;

    public NpmRegistryClient(RestTemplate restTemplate, ObjectMapper objectMapper) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
    }

    public PackageMetadata getMetadata(String registry, String name) {
        return new PackageMetadata(registry, name, fetchMetadata(registry, name));
    }

    public byte[] download(String url) {
        try {
            byte[] body = restTemplate.getForObject(URI.create(url), byte[].class);
            if (body == null || body.length == 0) {
                throw new PackageResolutionException("Empty response from " + url);
            }
            log.debug("Downloaded {} bytes from {}", body.length, url);
            return body;
        } catch (RestClientException e) {
            throw new PackageResolutionException("Failed to download " + url, e);
        }
    }

    private JsonNode fetchMetadata(String registry, String name) {
        String url = metadataUrl(registry, name);
        try {
            String body = restTemplate.getForObject(URI.create(url), String.class);
            if (body == null) {
                throw new PackageResolutionException("Empty metadata response from " + url);
            }
            return objectMapper.readTree(body);
        } catch (RestClientException | IOException e) {
            throw new PackageResolutionException("Failed to fetch metadata of [" + name + "] from " + registry, e);
        }
    }

    // 带 scope 的包名中的 / 需要编码，例如 @acme/plugin-foo -> @acme%2Fplugin-foo
    static String metadataUrl(String registry, String name) {
        String base = registry.endsWith("/") ? registry.substring(0, registry.length() - 1) : registry;
        return base + "/" + name.replace("/", "%2F");
    }

    /**
     * 单个包的仓库元数据
     */
    public static class PackageMetadata {

        private final String registry;
        private final String name;
        private final JsonNode root;

        PackageMetadata(String registry, String name, JsonNode root) {
            this.registry = registry;
            this.name = name;
            this.root = root;
        }

        public String getLatestVersion() {
            JsonNode latest = root.path("dist-tags").path("latest");
            if (latest.isMissingNode() || latest.isNull()) {
                throw new PackageResolutionException("No latest version of [" + name + "] in " + registry);
            }
            return latest.asText();
        }

        public String getTarballUrl(String version) {
            JsonNode tarball = root.path("versions").path(version).path("dist").path("tarball");
            if (tarball.isMissingNode() || tarball.isNull()) {
                throw new PackageResolutionException("Version " + version + " of [" + name + "] not found in " + registry);
            }
            return tarball.asText();
        }
    }
}
