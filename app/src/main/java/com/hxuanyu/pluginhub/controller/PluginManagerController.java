package com.hxuanyu.pluginhub.controller;

import com.hxuanyu.pluginhub.common.Result;
import com.hxuanyu.pluginhub.config.PluginManagerProperties;
import com.hxuanyu.pluginhub.plugin.core.PluginManager;
import com.hxuanyu.pluginhub.plugin.model.AddPluginRequest;
import com.hxuanyu.pluginhub.plugin.model.BuiltInProtectedException;
import com.hxuanyu.pluginhub.plugin.model.DuplicatePluginException;
import com.hxuanyu.pluginhub.plugin.model.PluginInfoDTO;
import com.hxuanyu.pluginhub.plugin.model.PluginNotFoundException;
import com.hxuanyu.pluginhub.plugin.model.PluginRecord;
import com.hxuanyu.pluginhub.plugin.model.RequiredPluginNotEnabledException;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * 插件管理接口
 */
@RestController
@RequestMapping("/api/pm")
@Slf4j
@Tag(name = "插件管理", description = "插件的添加、启用、禁用、升级与移除")
public class PluginManagerController {

    private final PluginManager pluginManager;
    private final PluginManagerProperties properties;

    public PluginManagerController(PluginManager pluginManager, PluginManagerProperties properties) {
        this.pluginManager = pluginManager;
        this.properties = properties;
    }

    @Operation(summary = "获取插件列表", description = "返回当前应用的插件记录及插件包描述信息")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "成功",
                    content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE,
                            schema = @Schema(implementation = PluginInfoDTO.class)))
    })
    @GetMapping("/plugins")
    public Result<List<PluginInfoDTO>> listPlugins() {
        return Result.success(pluginManager.list());
    }

    @Operation(summary = "前端入口", description = "已启用插件的名称与前端入口地址")
    @GetMapping("/client-files")
    public Result<Map<String, String>> clientFiles() {
        return Result.success(pluginManager.getPluginsClientFiles());
    }

    @Operation(summary = "从仓库添加插件", description = "从 npm 风格仓库下载插件包并添加，添加后处于未启用状态")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "添加成功"),
            @ApiResponse(responseCode = "409", description = "插件已存在"),
            @ApiResponse(responseCode = "500", description = "添加失败")
    })
    @PostMapping("/plugins/npm")
    public Result<PluginRecord> addByNpm(@RequestBody AddPluginRequest request) {
        if (request.getName() == null || request.getName().isBlank()) {
            return Result.error(400, "插件名称不能为空");
        }
        try {
            return Result.success(pluginManager.addByNpm(request), "插件已添加");
        } catch (Exception e) {
            log.error("Failed to add plugin: {}", request.getName(), e);
            return toError("添加失败", e);
        }
    }

    @Operation(summary = "上传插件包", description = "上传 zip 插件包，包根目录或唯一子目录中需包含 plugin.yml")
    @PostMapping(value = "/plugins/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public Result<PluginRecord> upload(
            @Parameter(description = "插件包文件（.zip）", required = true,
                    content = @Content(mediaType = MediaType.APPLICATION_OCTET_STREAM_VALUE,
                            schema = @Schema(type = "string", format = "binary")))
            @RequestParam("file") MultipartFile file) {
        if (file.isEmpty()) {
            return Result.error(400, "文件不能为空");
        }
        String fileName = file.getOriginalFilename();
        if (fileName == null || !fileName.toLowerCase().endsWith(".zip")) {
            return Result.error(400, "仅支持上传 ZIP 插件包");
        }
        // 上传文件保留在 uploads 目录，插件包缺失时可据此重新解压
        Path uploadDir = Paths.get(properties.getPackagesDir()).toAbsolutePath().normalize().resolveSibling("uploads");
        Path target = uploadDir.resolve(UUID.randomUUID() + ".zip");
        try {
            Files.createDirectories(uploadDir);
            try (InputStream in = file.getInputStream()) {
                Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
            }
            AddPluginRequest request = AddPluginRequest.builder().zipUrl(target.toString()).build();
            return Result.success(pluginManager.addByUpload(request), "插件已添加");
        } catch (Exception e) {
            log.error("Failed to add uploaded plugin: {}", fileName, e);
            FileUtils.deleteQuietly(target.toFile());
            return toError("添加失败", e);
        }
    }

    @Operation(summary = "启用插件")
    @PostMapping("/plugins/{name}/enable")
    public Result<Void> enable(@Parameter(name = "name", description = "插件名称") @PathVariable("name") String name) {
        try {
            pluginManager.enable(name);
            return Result.success(null, "插件已启用");
        } catch (Exception e) {
            log.error("Failed to enable plugin: {}", name, e);
            return toError("启用失败", e);
        }
    }

    @Operation(summary = "禁用插件", description = "内置插件不可禁用")
    @PostMapping("/plugins/{name}/disable")
    public Result<Void> disable(@Parameter(name = "name", description = "插件名称") @PathVariable("name") String name) {
        try {
            pluginManager.disable(name);
            return Result.success(null, "插件已禁用");
        } catch (Exception e) {
            log.error("Failed to disable plugin: {}", name, e);
            return toError("禁用失败", e);
        }
    }

    @Operation(summary = "升级插件", description = "指定 zipUrl 时使用 zip 包升级，否则从记录中的仓库升级到最新版本")
    @PostMapping("/plugins/{name}/upgrade")
    public Result<PluginRecord> upgrade(
            @Parameter(name = "name", description = "插件名称") @PathVariable("name") String name,
            @Parameter(description = "zip 包地址") @RequestParam(value = "zipUrl", required = false) String zipUrl) {
        try {
            PluginRecord record = (zipUrl == null || zipUrl.isBlank())
                    ? pluginManager.upgradeByNpm(name)
                    : pluginManager.upgradeByZip(name, zipUrl);
            return Result.success(record, "插件已升级");
        } catch (Exception e) {
            log.error("Failed to upgrade plugin: {}", name, e);
            return toError("升级失败", e);
        }
    }

    @Operation(summary = "移除插件", description = "删除插件记录与插件包，内置插件不可移除")
    @DeleteMapping("/plugins/{name}")
    public Result<Void> remove(@Parameter(name = "name", description = "插件名称") @PathVariable("name") String name) {
        try {
            pluginManager.remove(name);
            return Result.success(null, "插件已移除");
        } catch (Exception e) {
            log.error("Failed to remove plugin: {}", name, e);
            return toError("移除失败", e);
        }
    }

    private static <T> Result<T> toError(String prefix, Exception e) {
        int code = 500;
        if (e instanceof PluginNotFoundException) {
            code = 404;
        } else if (e instanceof DuplicatePluginException) {
            code = 409;
        } else if (e instanceof BuiltInProtectedException || e instanceof RequiredPluginNotEnabledException) {
            code = 400;
        }
        return Result.error(code, prefix + ": " + e.getMessage());
    }
}
