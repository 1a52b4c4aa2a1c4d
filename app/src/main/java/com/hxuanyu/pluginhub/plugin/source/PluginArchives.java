package com.hxuanyu.pluginhub.plugin.source;

import com.hxuanyu.pluginhub.plugin.model.PackageResolutionException;
import com.hxuanyu.pluginhub.plugin.model.PluginDescriptor;
import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveInputStream;
import org.apache.commons.compress.compressors.gzip.GzipCompressorInputStream;
import org.apache.commons.io.FileUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Enumeration;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;

/**
 * 插件包解压工具
 */
final class PluginArchives {

    private PluginArchives() {
    }

    /**
     * 解压 zip 到目标目录，跳过可能逃逸出目标目录的条目
     */
    static void unzip(Path zipFile, Path targetDir) throws IOException {
        Files.createDirectories(targetDir);
        try (ZipFile zip = new ZipFile(zipFile.toFile())) {
            Enumeration<? extends ZipEntry> entries = zip.entries();
            while (entries.hasMoreElements()) {
                ZipEntry entry = entries.nextElement();
                Path outPath = safeResolve(targetDir, entry.getName());
                if (outPath == null) continue;

                if (entry.isDirectory()) {
                    Files.createDirectories(outPath);
                } else {
                    Files.createDirectories(outPath.getParent());
                    try (InputStream is = zip.getInputStream(entry)) {
                        Files.copy(is, outPath, StandardCopyOption.REPLACE_EXISTING);
                    }
                }
            }
        }
    }

    /**
     * 解压 npm 风格的 .tgz 包，去掉首层目录（通常为 package/）
     */
    static void untarGzip(InputStream tgz, Path targetDir) throws IOException {
        Files.createDirectories(targetDir);
        try (TarArchiveInputStream tar = new TarArchiveInputStream(new GzipCompressorInputStream(tgz))) {
            TarArchiveEntry entry;
            while ((entry = tar.getNextEntry()) != null) {
                String name = entry.getName();
                int slash = name.indexOf('/');
                if (slash < 0) {
                    continue;
                }
                String relative = name.substring(slash + 1);
                Path outPath = safeResolve(targetDir, relative);
                if (outPath == null) continue;

                if (entry.isDirectory()) {
                    Files.createDirectories(outPath);
                } else if (entry.isFile()) {
                    Files.createDirectories(outPath.getParent());
                    Files.copy(tar, outPath, StandardCopyOption.REPLACE_EXISTING);
                }
            }
        }
    }

    /**
     * 查找包含 plugin.yml 的包根目录：解压目录本身或其唯一的子目录
     */
    static Path findPackageRoot(Path extractedDir) throws IOException {
        if (Files.isRegularFile(extractedDir.resolve(PluginDescriptor.FILE_NAME))) {
            return extractedDir;
        }
        List<Path> children;
        try (Stream<Path> stream = Files.list(extractedDir)) {
            children = stream.filter(Files::isDirectory).collect(Collectors.toList());
        }
        if (children.size() == 1 && Files.isRegularFile(children.get(0).resolve(PluginDescriptor.FILE_NAME))) {
            return children.get(0);
        }
        throw new PackageResolutionException(PluginDescriptor.FILE_NAME + " not found in package");
    }

    static PluginDescriptor readDescriptor(Path packageDir) {
        Path file = packageDir.resolve(PluginDescriptor.FILE_NAME);
        if (!Files.isRegularFile(file)) {
            throw new PackageResolutionException(PluginDescriptor.FILE_NAME + " not found in " + packageDir);
        }
        try (InputStream is = Files.newInputStream(file)) {
            return PluginDescriptor.load(is);
        } catch (IOException e) {
            throw new PackageResolutionException("Failed to read " + file, e);
        }
    }

    /**
     * 用新内容替换目标目录
     */
    static void replaceDirectory(Path source, Path target) throws IOException {
        if (Files.exists(target)) {
            FileUtils.deleteDirectory(target.toFile());
        }
        Files.createDirectories(target.getParent());
        FileUtils.copyDirectory(source.toFile(), target.toFile());
    }

    static void deleteQuietly(Path path) {
        if (path != null) {
            FileUtils.deleteQuietly(path.toFile());
        }
    }

    // 基础的路径穿越防护
    private static Path safeResolve(Path targetDir, String relative) {
        if (relative == null || relative.isEmpty()) return null;
        if (relative.startsWith("/")) return null;
        Path base = targetDir.toAbsolutePath().normalize();
        Path outPath = base.resolve(relative).normalize();
        return outPath.startsWith(base) ? outPath : null;
    }
}
