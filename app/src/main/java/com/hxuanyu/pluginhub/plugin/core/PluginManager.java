package com.hxuanyu.pluginhub.plugin.core;

import com.hxuanyu.pluginhub.config.PluginManagerProperties;
import com.hxuanyu.pluginhub.plugin.api.IPlugin;
import com.hxuanyu.pluginhub.plugin.api.InstallOptions;
import com.hxuanyu.pluginhub.plugin.event.ApplicationLoadEvent;
import com.hxuanyu.pluginhub.plugin.event.ApplicationUpgradeEvent;
import com.hxuanyu.pluginhub.plugin.event.PluginEventType;
import com.hxuanyu.pluginhub.plugin.model.AddPluginRequest;
import com.hxuanyu.pluginhub.plugin.model.BuiltInProtectedException;
import com.hxuanyu.pluginhub.plugin.model.DuplicatePluginException;
import com.hxuanyu.pluginhub.plugin.model.PluginDescriptor;
import com.hxuanyu.pluginhub.plugin.model.PluginFilter;
import com.hxuanyu.pluginhub.plugin.model.PluginInfoDTO;
import com.hxuanyu.pluginhub.plugin.model.PluginNotFoundException;
import com.hxuanyu.pluginhub.plugin.model.PluginRecord;
import com.hxuanyu.pluginhub.plugin.model.PluginRecordValues;
import com.hxuanyu.pluginhub.plugin.model.RequiredPluginNotEnabledException;
import com.hxuanyu.pluginhub.plugin.repository.PluginRecordStore;
import com.hxuanyu.pluginhub.plugin.repository.PluginSchemaManager;
import com.hxuanyu.pluginhub.plugin.source.PluginPackageInfo;
import com.hxuanyu.pluginhub.plugin.source.PluginPackageResolver;
import com.hxuanyu.pluginhub.plugin.source.PluginScaffolder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 插件管理器
 * 负责插件的添加、启用、禁用、升级、移除与加载，所有状态变更按顺序串行执行，
 * 任一步骤失败即中断后续步骤，已完成的步骤不回滚。
 */
@Service
@Slf4j
public class PluginManager {

    public static final String METHOD_CREATE = "create";
    public static final String METHOD_ADD = "add";
    public static final String METHOD_ENABLE = "enable";
    public static final String METHOD_DISABLE = "disable";
    public static final String METHOD_REMOVE = "remove";

    private final ApplicationHost host;
    private final PluginRecordStore store;
    private final PluginSchemaManager schemaManager;
    private final PluginPackageResolver packageResolver;
    private final PluginFactoryLocator factoryLocator;
    private final PluginScaffolder scaffolder;
    private final PluginManagerProperties properties;
    private final PluginRegistry registry;

    @Autowired
    public PluginManager(ApplicationHost host,
                         PluginRecordStore store,
                         PluginSchemaManager schemaManager,
                         PluginPackageResolver packageResolver,
                         PluginFactoryLocator factoryLocator,
                         PluginScaffolder scaffolder,
                         PluginManagerProperties properties,
                         ObjectProvider<StaticPluginDefinition> staticPlugins) {
        this(host, store, schemaManager, packageResolver, factoryLocator, scaffolder, properties,
                staticPlugins.orderedStream().collect(Collectors.toList()));
    }

    private PluginManager(ApplicationHost host,
                          PluginRecordStore store,
                          PluginSchemaManager schemaManager,
                          PluginPackageResolver packageResolver,
                          PluginFactoryLocator factoryLocator,
                          PluginScaffolder scaffolder,
                          PluginManagerProperties properties,
                          List<StaticPluginDefinition> staticPlugins) {
        this.host = host;
        this.store = store;
        this.schemaManager = schemaManager;
        this.packageResolver = packageResolver;
        this.factoryLocator = factoryLocator;
        this.scaffolder = scaffolder;
        this.properties = properties;
        this.registry = new PluginRegistry(host.getName(), Paths.get(properties.getDataDir()));
        initStaticPlugins(staticPlugins);
    }

    /**
     * 应用 beforeLoad 事件：同步表结构、初始化数据库中的插件并调用 beforeLoad 钩子
     */
    @EventListener
    public synchronized void onBeforeLoad(ApplicationLoadEvent event) throws Exception {
        String method = event.getMethod();
        if ("install".equals(method) || "upgrade".equals(method)) {
            schemaManager.sync();
        }
        if (!schemaManager.tableExists()) {
            log.warn("{} table not exists in app {}", PluginSchemaManager.TABLE_NAME, host.getName());
            return;
        }
        if (!"install".equals(method) || event.isReload()) {
            initDatabasePlugins();
            for (PluginInstance instance : registry.values()) {
                instance.getPlugin().beforeLoad();
            }
        }
    }

    @EventListener
    public void onBeforeUpgrade(ApplicationUpgradeEvent event) {
        schemaManager.sync();
    }

    private void initStaticPlugins(List<StaticPluginDefinition> definitions) {
        for (StaticPluginDefinition definition : definitions) {
            PluginInstance instance = registry.setInstance(definition.getFactory(), null, PluginInstanceOptions.builder()
                    .name(definition.getName())
                    .enabled(definition.isEnabled())
                    .builtIn(definition.isBuiltIn())
                    .options(definition.getOptions())
                    .build());
            log.info("Registered static plugin: {}", instance.getName());
        }
    }

    /**
     * 按记录顺序为数据库中的插件创建实例，缺失的插件包按记录来源重新获取
     */
    public synchronized void initDatabasePlugins() {
        List<PluginRecord> records = store.list(host.getName());
        for (PluginRecord record : records) {
            packageResolver.checkPluginPackage(record);
            setDatabasePlugin(record);
        }
        log.info("Initialized {} database plugin(s) for app {}", records.size(), host.getName());
    }

    /**
     * 已启用且已安装插件的前端入口地址
     */
    public synchronized Map<String, String> getPluginsClientFiles() {
        PluginFilter filter = PluginFilter.builder().enabled(true).installed(true).build();
        Map<String, String> files = new LinkedHashMap<>();
        for (PluginRecord record : store.list(host.getName(), filter)) {
            files.put(record.getName(), record.getClientUrl());
        }
        return files;
    }

    /**
     * 插件列表，合并插件包描述信息
     */
    public List<PluginInfoDTO> list() {
        List<PluginInfoDTO> result = new ArrayList<>();
        for (PluginRecord record : store.list(host.getName())) {
            result.add(toInfo(record));
        }
        return result;
    }

    /**
     * 从 npm 仓库添加插件
     */
    public synchronized PluginRecord addByNpm(AddPluginRequest request) throws Exception {
        String name = request.getName();
        if (registry.has(name)) {
            throw new DuplicatePluginException("plugin name [" + name + "] already exists");
        }
        String npmRegistry = blankToDefault(request.getRegistry(), properties.getDefaultRegistry());
        log.info("Adding plugin {} from {}", name, npmRegistry);

        store.create(PluginRecord.builder()
                .name(name)
                .appName(host.getName())
                .registry(npmRegistry)
                .enabled(false)
                .installed(false)
                .builtIn(request.isBuiltIn())
                .isOfficial(request.isOfficial())
                .options(new HashMap<>())
                .build());

        PluginPackageInfo info = packageResolver.resolveFromNpm(name, npmRegistry, null);
        PluginRecord record = store.update(filterOf(name), PluginRecordValues.builder()
                        .version(info.getVersion())
                        .clientUrl(packageResolver.getClientStaticUrl(name))
                        .installed(true)
                        .build())
                .orElseThrow(() -> new PluginNotFoundException("plugin [" + name + "] not exists"));

        PluginInstance instance = setDatabasePlugin(record);
        instance.getPlugin().afterAdd();
        log.info("✅ Plugin added: {} v{}", name, info.getVersion());
        return record;
    }

    /**
     * 从本地插件包目录添加插件，插件包需已位于可被定位的位置
     */
    public synchronized PluginRecord addByLocalPath(Path localPath, AddPluginRequest request) throws Exception {
        PluginPackageInfo info = packageResolver.resolveFromLocal(localPath);
        String name = info.getName();
        if (registry.has(name)) {
            throw new DuplicatePluginException("plugin [" + name + "] already exists");
        }
        AddPluginRequest effective = request == null ? new AddPluginRequest() : request;

        PluginRecord record = store.create(PluginRecord.builder()
                .name(name)
                .appName(host.getName())
                .version(info.getVersion())
                .zipUrl(effective.getZipUrl())
                .clientUrl(packageResolver.getClientStaticUrl(name))
                .enabled(false)
                .installed(true)
                .builtIn(effective.isBuiltIn())
                .isOfficial(effective.isOfficial())
                .options(new HashMap<>())
                .build());

        PluginInstance instance = setDatabasePlugin(record);
        instance.getPlugin().afterAdd();
        log.info("✅ Plugin added: {} v{} from {}", name, info.getVersion(), localPath);
        return record;
    }

    /**
     * 通过上传的 zip 包添加插件
     */
    public synchronized PluginRecord addByUpload(AddPluginRequest request) throws Exception {
        PluginPackageInfo info = packageResolver.resolveFromZip(request.getZipUrl(), null);
        return addByLocalPath(info.getPackageDir(), request);
    }

    /**
     * 从 npm 仓库升级插件，没有新版本时仅重建实例
     */
    public synchronized PluginRecord upgradeByNpm(String name) throws Exception {
        PluginRecord record = getPluginData(name);
        Optional<String> newVersion = packageResolver.getNewVersion(record);
        if (newVersion.isPresent()) {
            log.info("Upgrading plugin {} {} -> {}", name, record.getVersion(), newVersion.get());
            packageResolver.resolveFromNpm(name, record.getRegistry(), newVersion.get());
            record = store.update(filterOf(name), PluginRecordValues.builder().version(newVersion.get()).build())
                    .orElse(record);
        } else {
            log.info("Plugin {} is already the latest version {}", name, record.getVersion());
        }
        return reloadUpgraded(record);
    }

    /**
     * 使用 zip 包升级插件
     */
    public synchronized PluginRecord upgradeByZip(String name, String zipUrl) throws Exception {
        PluginRecord record = getPluginData(name);
        PluginPackageInfo info = packageResolver.resolveFromZip(zipUrl, name);
        log.info("Upgrading plugin {} {} -> {} from {}", name, record.getVersion(), info.getVersion(), zipUrl);
        record = store.update(filterOf(name), PluginRecordValues.builder()
                        .version(info.getVersion())
                        .zipUrl(zipUrl)
                        .build())
                .orElse(record);
        return reloadUpgraded(record);
    }

    private PluginRecord reloadUpgraded(PluginRecord record) throws Exception {
        PluginInstance instance = setDatabasePlugin(record);
        instance.getPlugin().afterAdd();
        // 升级后直接加载新实例，不发布 beforeLoadPlugin/afterLoadPlugin 事件
        if (Boolean.TRUE.equals(record.getEnabled())) {
            instance.getPlugin().load();
        }
        log.info("✅ Plugin upgraded: {} v{}", record.getName(), record.getVersion());
        return record;
    }

    /**
     * 启用插件
     */
    public synchronized void enable(String name) throws Exception {
        PluginInstance instance = registry.getInstance(name);
        IPlugin plugin = instance.getPlugin();

        for (String required : plugin.requiredPlugins()) {
            boolean enabled = registry.find(required).map(PluginInstance::isEnabled).orElse(false);
            if (!enabled) {
                throw new RequiredPluginNotEnabledException(name + " plugin need " + required + " plugin enabled");
            }
        }

        log.info("Enabling plugin: {}", name);
        store.update(filterOf(name), PluginRecordValues.builder().enabled(true).build());
        instance.setEnabled(true);

        plugin.install(InstallOptions.defaults());
        plugin.afterEnable();
        host.emit(PluginEventType.AFTER_ENABLE_PLUGIN, instance, null);
        load(instance, null);
        log.info("✅ Plugin enabled: {}", name);
    }

    /**
     * 禁用插件，内置插件不可禁用
     */
    public synchronized void disable(String name) throws Exception {
        PluginInstance instance = registry.getInstance(name);
        if (instance.isBuiltIn()) {
            throw new BuiltInProtectedException(name + " plugin is builtIn, can not disable");
        }

        log.info("Disabling plugin: {}", name);
        store.update(filterOf(name).toBuilder().builtIn(false).build(),
                PluginRecordValues.builder().enabled(false).build());
        instance.setEnabled(false);

        instance.getPlugin().afterDisable();
        host.emit(PluginEventType.AFTER_DISABLE_PLUGIN, instance, null);
        log.info("✅ Plugin disabled: {}", name);
    }

    /**
     * 移除插件，删除记录、实例与插件包文件，内置插件不可移除
     */
    public synchronized void remove(String name) throws Exception {
        PluginInstance instance = registry.getInstance(name);
        if (instance.isBuiltIn()) {
            throw new BuiltInProtectedException(name + " plugin is builtIn, can not remove");
        }

        log.info("Removing plugin: {}", name);
        instance.getPlugin().remove();
        store.destroy(filterOf(name).toBuilder().builtIn(false).build());
        registry.remove(name);
        packageResolver.removePackage(name);
        log.info("✅ Plugin removed: {}", name);
    }

    /**
     * 加载单个插件，未启用时不做任何事
     */
    public synchronized void load(PluginInstance instance, Object options) throws Exception {
        if (!instance.isEnabled()) {
            return;
        }
        host.emit(PluginEventType.BEFORE_LOAD_PLUGIN, instance, options);
        instance.getPlugin().load();
        host.emit(PluginEventType.AFTER_LOAD_PLUGIN, instance, options);
        log.debug("Plugin loaded: {}", instance.getName());
    }

    /**
     * 按注册顺序加载全部插件，遇到第一个失败即中断
     */
    public synchronized void loadAll(Object options) throws Exception {
        for (PluginInstance instance : registry.values()) {
            load(instance, options);
        }
        log.info("✅ Loaded plugins of app {}: {}", host.getName(), registry.names());
    }

    /**
     * 对全部已启用插件执行安装
     */
    public synchronized void install(InstallOptions options) throws Exception {
        InstallOptions effective = options == null ? InstallOptions.defaults() : options;
        for (PluginInstance instance : registry.values()) {
            if (!instance.isEnabled()) {
                continue;
            }
            host.emit(PluginEventType.BEFORE_INSTALL_PLUGIN, instance, effective);
            instance.getPlugin().install(effective);
            host.emit(PluginEventType.AFTER_INSTALL_PLUGIN, instance, effective);
            log.info("✅ Plugin installed: {}", instance.getName());
        }
    }

    public PluginRecord getPluginData(String name) {
        return store.getOne(filterOf(name));
    }

    public PluginInstance getPluginInstance(String name) {
        return registry.getInstance(name);
    }

    public List<PluginInstance> getPluginInstances() {
        return registry.values();
    }

    /**
     * 创建共享存储与插件包来源、但注册表为空的新管理器
     */
    public PluginManager clone() {
        return new PluginManager(host, store, schemaManager, packageResolver, factoryLocator, scaffolder, properties,
                new ArrayList<>());
    }

    /**
     * 在本地插件目录下生成插件包骨架
     */
    public synchronized void createByCli(String name) {
        log.info("creating {} plugin...", name);
        Path created = scaffolder.scaffold(Paths.get(properties.getLocalPackagesDir()), name);
        if (created == null) {
            log.warn("[{}] plugin already exists.", name);
            return;
        }
        log.info("✅ Plugin package created: {}", created);
    }

    /**
     * 添加本地插件目录中的插件包
     */
    public synchronized PluginRecord addByCli(String name) throws Exception {
        Path localPackage = Paths.get(properties.getLocalPackagesDir()).resolve(name);
        if (!Files.isDirectory(localPackage)) {
            throw new PluginNotFoundException("plugin [" + name + "] not exists, Please use 'pm create "
                    + name + "' to create first.");
        }
        PluginPackageInfo installed = packageResolver.installLocalPackage(localPackage);
        return addByLocalPath(installed.getPackageDir(), null);
    }

    /**
     * 依次对每个插件执行命令
     */
    public synchronized void doCliCommand(String method, List<String> names) throws Exception {
        for (String name : names) {
            switch (method) {
                case METHOD_CREATE:
                    createByCli(name);
                    break;
                case METHOD_ADD:
                    addByCli(name);
                    break;
                case METHOD_ENABLE:
                    enable(name);
                    break;
                case METHOD_DISABLE:
                    disable(name);
                    break;
                case METHOD_REMOVE:
                    remove(name);
                    break;
                default:
                    throw new IllegalArgumentException("Unknown pm method: " + method);
            }
        }
    }

    private PluginInstance setDatabasePlugin(PluginRecord record) {
        PluginFactoryLocator.LocatedFactory located = factoryLocator.locate(record.getName());
        try {
            return registry.setInstance(located.getFactory(), located.getClassLoader(), PluginInstanceOptions.builder()
                    .name(record.getName())
                    .enabled(Boolean.TRUE.equals(record.getEnabled()))
                    .builtIn(Boolean.TRUE.equals(record.getBuiltIn()))
                    .options(record.getOptions())
                    .build());
        } catch (RuntimeException e) {
            PluginFactoryLocator.closeQuietly(located.getClassLoader());
            throw e;
        }
    }

    private PluginInfoDTO toInfo(PluginRecord record) {
        PluginInfoDTO dto = new PluginInfoDTO();
        dto.setName(record.getName());
        dto.setAppName(record.getAppName());
        dto.setVersion(record.getVersion());
        dto.setRegistry(record.getRegistry());
        dto.setZipUrl(record.getZipUrl());
        dto.setClientUrl(record.getClientUrl());
        dto.setEnabled(Boolean.TRUE.equals(record.getEnabled()));
        dto.setInstalled(Boolean.TRUE.equals(record.getInstalled()));
        dto.setBuiltIn(Boolean.TRUE.equals(record.getBuiltIn()));
        dto.setOfficial(Boolean.TRUE.equals(record.getIsOfficial()));
        dto.setOptions(record.getOptions());
        dto.setCreatedAt(record.getCreatedAt());
        dto.setUpdatedAt(record.getUpdatedAt());
        dto.setPackageExists(packageResolver.packageExists(record.getName()));

        Optional<PluginDescriptor> descriptor = packageResolver.readDescriptor(record.getName());
        descriptor.ifPresent(d -> {
            dto.setDisplayName(d.getDisplayName());
            dto.setDescription(d.getDescription());
            dto.setAuthor(d.getAuthor());
            dto.setTags(d.getTags());
        });
        return dto;
    }

    private PluginFilter filterOf(String name) {
        return PluginFilter.of(name, host.getName());
    }

    private static String blankToDefault(String value, String defaultValue) {
        return (value == null || value.isBlank()) ? defaultValue : value;
    }
}
