package com.hxuanyu.pluginhub.plugin.source;

import com.hxuanyu.pluginhub.config.PluginManagerProperties;
import com.hxuanyu.pluginhub.plugin.model.PackageResolutionException;
import com.hxuanyu.pluginhub.plugin.model.PluginDescriptor;
import com.hxuanyu.pluginhub.plugin.model.PluginRecord;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.springframework.stereotype.Service;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * 插件包来源解析的默认实现
 * 插件包安装在 platform.plugin.packages-dir/&lt;插件名&gt; 下
 */
@Service
@Slf4j
public class DefaultPluginPackageResolver implements PluginPackageResolver {

    private final PluginManagerProperties properties;
    private final NpmRegistryClient registryClient;

    public DefaultPluginPackageResolver(PluginManagerProperties properties, NpmRegistryClient registryClient) {
        this.properties = properties;
        this.registryClient = registryClient;
    }

    @Override
    public PluginPackageInfo resolveFromNpm(String name, String registry, String version) {
        String effectiveRegistry = (registry == null || registry.isBlank()) ? properties.getDefaultRegistry() : registry;
        NpmRegistryClient.PackageMetadata metadata = registryClient.getMetadata(effectiveRegistry, name);
        String effectiveVersion = version != null ? version : metadata.getLatestVersion();
        String tarballUrl = metadata.getTarballUrl(effectiveVersion);

        log.info("Downloading plugin {}@{} from {}", name, effectiveVersion, effectiveRegistry);
        byte[] tarball = registryClient.download(tarballUrl);

        Path tempDir = null;
        try {
            tempDir = Files.createTempDirectory("plugin-npm-");
            PluginArchives.untarGzip(new ByteArrayInputStream(tarball), tempDir);
            Path target = getPackageDir(name);
            PluginArchives.replaceDirectory(tempDir, target);
            log.info("✅ Installed package {}@{} -> {}", name, effectiveVersion, target);
            return new PluginPackageInfo(name, effectiveVersion, target);
        } catch (IOException e) {
            throw new PackageResolutionException("Failed to unpack plugin [" + name + "]", e);
        } finally {
            PluginArchives.deleteQuietly(tempDir);
        }
    }

    @Override
    public PluginPackageInfo resolveFromZip(String zipUrl, String name) {
        Path zipFile = null;
        Path tempDir = null;
        try {
            zipFile = fetchZip(zipUrl);
            tempDir = Files.createTempDirectory("plugin-zip-");
            PluginArchives.unzip(zipFile, tempDir);

            Path root = PluginArchives.findPackageRoot(tempDir);
            PluginDescriptor descriptor = PluginArchives.readDescriptor(root);
            if (name != null && !name.equals(descriptor.getName())) {
                throw new PackageResolutionException("zip package declares plugin [" + descriptor.getName()
                        + "], expected [" + name + "]");
            }

            Path target = getPackageDir(descriptor.getName());
            PluginArchives.replaceDirectory(root, target);
            log.info("✅ Installed package {}@{} from {}", descriptor.getName(), descriptor.getVersion(), zipUrl);
            return new PluginPackageInfo(descriptor.getName(), descriptor.getVersion(), target);
        } catch (IOException e) {
            throw new PackageResolutionException("Failed to unpack zip " + zipUrl, e);
        } finally {
            PluginArchives.deleteQuietly(tempDir);
            if (zipFile != null && !isLocalReference(zipUrl)) {
                PluginArchives.deleteQuietly(zipFile);
            }
        }
    }

    @Override
    public PluginPackageInfo resolveFromLocal(Path localPath) {
        Path dir = localPath.toAbsolutePath().normalize();
        if (!Files.isDirectory(dir)) {
            throw new PackageResolutionException("Local plugin path is not a directory: " + dir);
        }
        PluginDescriptor descriptor = PluginArchives.readDescriptor(dir);
        return new PluginPackageInfo(descriptor.getName(), descriptor.getVersion(), dir);
    }

    @Override
    public PluginPackageInfo installLocalPackage(Path localPath) {
        PluginPackageInfo local = resolveFromLocal(localPath);
        Path target = getPackageDir(local.getName());
        if (target.equals(local.getPackageDir())) {
            return local;
        }
        try {
            PluginArchives.replaceDirectory(local.getPackageDir(), target);
        } catch (IOException e) {
            throw new PackageResolutionException("Failed to copy local package " + localPath, e);
        }
        log.info("Copied local package {} -> {}", local.getPackageDir(), target);
        return new PluginPackageInfo(local.getName(), local.getVersion(), target);
    }

    @Override
    public Optional<String> getNewVersion(PluginRecord record) {
        if (record.getRegistry() == null || record.getRegistry().isBlank()) {
            return Optional.empty();
        }
        String latest = registryClient.getMetadata(record.getRegistry(), record.getName()).getLatestVersion();
        if (record.getVersion() == null || compareVersions(latest, record.getVersion()) > 0) {
            return Optional.of(latest);
        }
        return Optional.empty();
    }

    @Override
    public void checkPluginPackage(PluginRecord record) {
        if (packageExists(record.getName())) {
            return;
        }
        if (record.getRegistry() != null && !record.getRegistry().isBlank()) {
            log.warn("Package of plugin {} is missing, downloading from {}", record.getName(), record.getRegistry());
            resolveFromNpm(record.getName(), record.getRegistry(), record.getVersion());
        } else if (record.getZipUrl() != null && !record.getZipUrl().isBlank()) {
            log.warn("Package of plugin {} is missing, downloading from {}", record.getName(), record.getZipUrl());
            resolveFromZip(record.getZipUrl(), record.getName());
        } else {
            log.debug("No package directory for plugin {}, expecting a factory on the class path", record.getName());
        }
    }

    @Override
    public void removePackage(String name) {
        Path dir = getPackageDir(name);
        if (!Files.exists(dir)) {
            return;
        }
        try {
            FileUtils.deleteDirectory(dir.toFile());
            log.info("Deleted plugin package: {}", dir);
        } catch (IOException e) {
            throw new PackageResolutionException("Failed to delete plugin package " + dir, e);
        }
    }

    @Override
    public Path getPackageDir(String name) {
        Path base = Paths.get(properties.getPackagesDir()).toAbsolutePath().normalize();
        Path dir = base.resolve(name).normalize();
        if (!dir.startsWith(base) || dir.equals(base)) {
            throw new PackageResolutionException("Illegal plugin name: " + name);
        }
        return dir;
    }

    @Override
    public boolean packageExists(String name) {
        return Files.isRegularFile(getPackageDir(name).resolve(PluginDescriptor.FILE_NAME));
    }

    @Override
    public Optional<PluginDescriptor> readDescriptor(String name) {
        if (!packageExists(name)) {
            return Optional.empty();
        }
        try {
            return Optional.of(PluginArchives.readDescriptor(getPackageDir(name)));
        } catch (PackageResolutionException e) {
            log.warn("Read descriptor failed for {}: {}", name, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public String getClientStaticUrl(String name) {
        String prefix = properties.getClientUrlPrefix();
        if (!prefix.endsWith("/")) {
            prefix = prefix + "/";
        }
        return prefix + name + "/dist/client/index.js";
    }

    private Path fetchZip(String zipUrl) throws IOException {
        if (isLocalReference(zipUrl)) {
            Path local = zipUrl.startsWith("file:") ? Paths.get(URI.create(zipUrl)) : Paths.get(zipUrl);
            if (!Files.isRegularFile(local)) {
                throw new PackageResolutionException("zip file not found: " + zipUrl);
            }
            return local;
        }
        Path tempFile = Files.createTempFile("plugin-download-", ".zip");
        try (InputStream in = new ByteArrayInputStream(registryClient.download(zipUrl))) {
            Files.copy(in, tempFile, StandardCopyOption.REPLACE_EXISTING);
        }
        return tempFile;
    }

    private static boolean isLocalReference(String zipUrl) {
        return !(zipUrl.startsWith("http://") || zipUrl.startsWith("https://"));
    }

    /**
     * 先按数字段比较版本号主体；主体相同时正式版高于预发布版（如 1.0.0 &gt; 1.0.0-beta），预发布标签按段比较
     */
    static int compareVersions(String left, String right) {
        String[] l = splitPrerelease(left);
        String[] r = splitPrerelease(right);
        int cmp = compareSegments(l[0].split("\\."), r[0].split("\\."));
        if (cmp != 0) {
            return cmp;
        }
        if (l[1] == null || r[1] == null) {
            return l[1] == null ? (r[1] == null ? 0 : 1) : -1;
        }
        return compareSegments(l[1].split("\\."), r[1].split("\\."));
    }

    private static String[] splitPrerelease(String version) {
        String core = version.trim();
        int plus = core.indexOf('+');
        if (plus >= 0) {
            core = core.substring(0, plus);
        }
        int dash = core.indexOf('-');
        if (dash < 0) {
            return new String[]{core, null};
        }
        return new String[]{core.substring(0, dash), core.substring(dash + 1)};
    }

    private static int compareSegments(String[] a, String[] b) {
        for (int i = 0; i < Math.max(a.length, b.length); i++) {
            String x = i < a.length ? a[i] : "0";
            String y = i < b.length ? b[i] : "0";
            int cmp;
            if (x.matches("\\d+") && y.matches("\\d+")) {
                cmp = Long.compare(Long.parseLong(x), Long.parseLong(y));
            } else if (x.matches("\\d+") != y.matches("\\d+")) {
                // 数字标识低于字母标识
                cmp = x.matches("\\d+") ? -1 : 1;
            } else {
                cmp = x.compareTo(y);
            }
            if (cmp != 0) {
                return cmp;
            }
        }
        return 0;
    }
}
