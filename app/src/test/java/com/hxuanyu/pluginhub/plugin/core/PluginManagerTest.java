package com.hxuanyu.pluginhub.plugin.core;

import com.hxuanyu.pluginhub.config.PluginManagerProperties;
import com.hxuanyu.pluginhub.plugin.model.AddPluginRequest;
import com.hxuanyu.pluginhub.plugin.model.BuiltInProtectedException;
import com.hxuanyu.pluginhub.plugin.model.DuplicatePluginException;
import com.hxuanyu.pluginhub.plugin.model.PluginFilter;
import com.hxuanyu.pluginhub.plugin.model.PluginInfoDTO;
import com.hxuanyu.pluginhub.plugin.model.PluginNotFoundException;
import com.hxuanyu.pluginhub.plugin.model.PluginRecord;
import com.hxuanyu.pluginhub.plugin.model.PluginRecordValues;
import com.hxuanyu.pluginhub.plugin.model.RequiredPluginNotEnabledException;
import com.hxuanyu.pluginhub.plugin.repository.PluginRecordStore;
import com.hxuanyu.pluginhub.plugin.repository.PluginSchemaManager;
import com.hxuanyu.pluginhub.support.PluginCallLog;
import com.hxuanyu.pluginhub.support.TestPackages;
import com.hxuanyu.pluginhub.support.TestPluginConfig;
import org.apache.commons.io.FileUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

@SpringBootTest
@Import(TestPluginConfig.class)
class PluginManagerTest {

    @Autowired
    private PluginManager sharedManager;

    @Autowired
    private PluginRecordStore store;

    @Autowired
    private PluginSchemaManager schemaManager;

    @Autowired
    private PluginManagerProperties properties;

    @Autowired
    private PluginCallLog callLog;

    @Autowired
    private RestTemplate restTemplate;

    @TempDir
    Path tempDir;

    private PluginManager manager;

    @BeforeEach
    void setUp() throws Exception {
        schemaManager.sync();
        store.destroy(PluginFilter.builder().build());
        FileUtils.deleteDirectory(new File(properties.getPackagesDir()));
        FileUtils.deleteDirectory(new File(properties.getLocalPackagesDir()));
        callLog.clear();
        manager = sharedManager.clone();
    }

    private PluginRecord addLocal(String name) throws Exception {
        return addLocal(name, new AddPluginRequest());
    }

    private PluginRecord addLocal(String name, AddPluginRequest request) throws Exception {
        Path dir = TestPackages.writePackageDir(tempDir, name, "1.0.0");
        return manager.addByLocalPath(dir, request);
    }

    @Test
    @DisplayName("添加本地插件后记录已安装、未启用，并调用 afterAdd")
    void addByLocalPathCreatesInstalledRecord() throws Exception {
        PluginRecord record = addLocal("foo");

        assertEquals("foo", record.getName());
        assertEquals("test", record.getAppName());
        assertEquals("1.0.0", record.getVersion());
        assertTrue(record.getInstalled());
        assertFalse(record.getEnabled());
        assertEquals("/static/plugins/foo/dist/client/index.js", record.getClientUrl());
        assertFalse(manager.getPluginInstance("foo").isEnabled());
        assertEquals(List.of("foo.afterAdd"), callLog.snapshot());
    }

    @Test
    @DisplayName("启用插件按 install、afterEnable、afterEnablePlugin、load 的顺序执行")
    void enableRunsStepsInOrder() throws Exception {
        addLocal("foo");
        callLog.clear();

        manager.enable("foo");

        assertEquals(List.of(
                "foo.install",
                "foo.afterEnable",
                "event:afterEnablePlugin:foo",
                "event:beforeLoadPlugin:foo",
                "foo.load",
                "event:afterLoadPlugin:foo"), callLog.snapshot());
        assertTrue(manager.getPluginInstance("foo").isEnabled());
        assertTrue(manager.getPluginData("foo").getEnabled());
        assertTrue(manager.getPluginInstance("foo").getPlatformContext().isEnabled());
    }

    @Test
    @DisplayName("依赖插件未启用时拒绝启用")
    void enableRequiresDependencies() throws Exception {
        addLocal("needs-bar");

        // 依赖插件不存在
        assertThrows(RequiredPluginNotEnabledException.class, () -> manager.enable("needs-bar"));

        addLocal("bar");
        // 依赖插件存在但未启用
        RequiredPluginNotEnabledException e =
                assertThrows(RequiredPluginNotEnabledException.class, () -> manager.enable("needs-bar"));
        assertEquals("needs-bar plugin need bar plugin enabled", e.getMessage());
        assertFalse(manager.getPluginData("needs-bar").getEnabled());
        assertFalse(callLog.snapshot().contains("needs-bar.install"));

        manager.enable("bar");
        manager.enable("needs-bar");
        assertTrue(manager.getPluginData("needs-bar").getEnabled());
    }

    @Test
    @DisplayName("内置插件不可禁用、不可移除")
    void builtInPluginIsProtected() throws Exception {
        addLocal("foo", AddPluginRequest.builder().builtIn(true).build());
        manager.enable("foo");
        callLog.clear();

        assertThrows(BuiltInProtectedException.class, () -> manager.disable("foo"));
        assertThrows(BuiltInProtectedException.class, () -> manager.remove("foo"));

        assertTrue(manager.getPluginData("foo").getEnabled());
        assertTrue(manager.getPluginInstance("foo").isEnabled());
        assertTrue(callLog.snapshot().isEmpty());
    }

    @Test
    @DisplayName("同名插件重复添加失败且不写入第二条记录")
    void duplicateAddIsRejected() throws Exception {
        addLocal("foo");
        Path again = TestPackages.writePackageDir(tempDir.resolve("again"), "foo", "2.0.0");

        assertThrows(DuplicatePluginException.class, () -> manager.addByLocalPath(again, null));

        List<PluginRecord> records = store.list("test");
        assertEquals(1, records.size());
        assertEquals("1.0.0", records.get(0).getVersion());
    }

    @Test
    @DisplayName("禁用插件后记录与实例均为未启用")
    void disableMarksRecordAndInstance() throws Exception {
        addLocal("foo");
        manager.enable("foo");
        callLog.clear();

        manager.disable("foo");

        assertFalse(manager.getPluginData("foo").getEnabled());
        assertFalse(manager.getPluginInstance("foo").isEnabled());
        assertEquals(List.of("foo.afterDisable", "event:afterDisablePlugin:foo"), callLog.snapshot());
    }

    @Test
    @DisplayName("移除插件删除记录、实例与插件包")
    void removeDeletesEverything() throws Exception {
        addLocal("foo");
        Path packageDir = Paths.get(properties.getPackagesDir()).resolve("foo");
        Files.createDirectories(packageDir);

        manager.remove("foo");

        assertTrue(callLog.snapshot().contains("foo.remove"));
        assertThrows(PluginNotFoundException.class, () -> manager.getPluginInstance("foo"));
        assertThrows(PluginNotFoundException.class, () -> manager.getPluginData("foo"));
        assertFalse(Files.exists(packageDir));
    }

    @Test
    @DisplayName("加载全部插件时遇到失败立即中断")
    void loadAllStopsAtFirstFailure() throws Exception {
        addLocal("alpha");
        addLocal("failing");
        addLocal("gamma");
        store.update(PluginFilter.builder().appName("test").build(), PluginRecordValues.builder().enabled(true).build());
        manager.initDatabasePlugins();
        callLog.clear();

        Exception e = assertThrows(IllegalStateException.class, () -> manager.loadAll(null));
        assertEquals("failing failed to load", e.getMessage());

        List<String> calls = callLog.snapshot();
        assertTrue(calls.contains("alpha.load"));
        assertTrue(calls.contains("failing.load"));
        assertFalse(calls.contains("gamma.load"));
    }

    @Test
    @DisplayName("批量安装只处理已启用插件")
    void installOnlyTouchesEnabledPlugins() throws Exception {
        addLocal("alpha");
        addLocal("gamma");
        manager.enable("alpha");
        callLog.clear();

        manager.install(null);

        assertEquals(List.of(
                "event:beforeInstallPlugin:alpha",
                "alpha.install",
                "event:afterInstallPlugin:alpha"), callLog.snapshot());
    }

    @Test
    @DisplayName("从仓库添加插件后列表中为已安装、未启用")
    void addByNpmThenList() throws Exception {
        String registry = "http://registry.test";
        MockRestServiceServer server = MockRestServiceServer.bindTo(restTemplate).build();
        server.expect(requestTo(registry + "/npm-demo"))
                .andExpect(method(org.springframework.http.HttpMethod.GET))
                .andRespond(withSuccess("{\"dist-tags\":{\"latest\":\"1.2.0\"},"
                        + "\"versions\":{\"1.2.0\":{\"dist\":{\"tarball\":\"" + registry + "/npm-demo/-/npm-demo-1.2.0.tgz\"}}}}",
                        MediaType.APPLICATION_JSON));
        server.expect(requestTo(registry + "/npm-demo/-/npm-demo-1.2.0.tgz"))
                .andRespond(withSuccess(TestPackages.tarball("npm-demo", "1.2.0"), MediaType.APPLICATION_OCTET_STREAM));

        PluginRecord record = manager.addByNpm(AddPluginRequest.builder().name("npm-demo").registry(registry).build());
        server.verify();

        assertEquals("1.2.0", record.getVersion());
        List<PluginInfoDTO> plugins = manager.list();
        assertEquals(1, plugins.size());
        PluginInfoDTO info = plugins.get(0);
        assertEquals("npm-demo", info.getName());
        assertTrue(info.isInstalled());
        assertFalse(info.isEnabled());
        assertTrue(info.isPackageExists());
        assertEquals("npm-demo display", info.getDisplayName());
        assertEquals(registry, info.getRegistry());
        assertTrue(callLog.snapshot().contains("npm-demo.afterAdd"));
    }

    private static String npmMetadata(String registry, String name, String version) {
        return "{\"dist-tags\":{\"latest\":\"" + version + "\"},"
                + "\"versions\":{\"" + version + "\":{\"dist\":{\"tarball\":\""
                + registry + "/" + name + "/-/" + name + "-" + version + ".tgz\"}}}}";
    }

    @Test
    @DisplayName("仓库有新版本时升级：重新下载插件包、更新版本、替换实例并重新加载")
    void upgradeByNpmToNewerVersion() throws Exception {
        String registry = "http://registry.test";
        MockRestServiceServer server = MockRestServiceServer.bindTo(restTemplate).build();
        server.expect(requestTo(registry + "/npm-demo"))
                .andRespond(withSuccess(npmMetadata(registry, "npm-demo", "1.0.0"), MediaType.APPLICATION_JSON));
        server.expect(requestTo(registry + "/npm-demo/-/npm-demo-1.0.0.tgz"))
                .andRespond(withSuccess(TestPackages.tarball("npm-demo", "1.0.0"), MediaType.APPLICATION_OCTET_STREAM));
        manager.addByNpm(AddPluginRequest.builder().name("npm-demo").registry(registry).build());
        server.verify();
        manager.enable("npm-demo");
        PluginInstance before = manager.getPluginInstance("npm-demo");

        server = MockRestServiceServer.bindTo(restTemplate).build();
        server.expect(requestTo(registry + "/npm-demo"))
                .andRespond(withSuccess(npmMetadata(registry, "npm-demo", "1.2.0"), MediaType.APPLICATION_JSON));
        server.expect(requestTo(registry + "/npm-demo"))
                .andRespond(withSuccess(npmMetadata(registry, "npm-demo", "1.2.0"), MediaType.APPLICATION_JSON));
        server.expect(requestTo(registry + "/npm-demo/-/npm-demo-1.2.0.tgz"))
                .andRespond(withSuccess(TestPackages.tarball("npm-demo", "1.2.0"), MediaType.APPLICATION_OCTET_STREAM));
        callLog.clear();

        PluginRecord upgraded = manager.upgradeByNpm("npm-demo");
        server.verify();

        assertEquals("1.2.0", upgraded.getVersion());
        assertEquals("1.2.0", manager.getPluginData("npm-demo").getVersion());
        assertTrue(manager.getPluginData("npm-demo").getEnabled());
        PluginInstance after = manager.getPluginInstance("npm-demo");
        assertNotSame(before, after);
        assertTrue(after.isEnabled());
        assertEquals(List.of("npm-demo.afterAdd", "npm-demo.load"), callLog.snapshot());
    }

    @Test
    @DisplayName("已添加的插件不能再从仓库添加")
    void addByNpmRejectsRegisteredName() throws Exception {
        addLocal("foo");
        assertThrows(DuplicatePluginException.class,
                () -> manager.addByNpm(AddPluginRequest.builder().name("foo").build()));
        assertEquals(1, store.list("test").size());
    }

    @Test
    @DisplayName("前端入口只包含已启用且已安装的插件")
    void clientFilesOfEnabledPlugins() throws Exception {
        addLocal("foo");
        addLocal("bar");
        manager.enable("bar");

        Map<String, String> files = manager.getPluginsClientFiles();
        assertEquals(Map.of("bar", "/static/plugins/bar/dist/client/index.js"), files);
    }

    @Test
    @DisplayName("zip 升级更新版本，已启用插件重新加载")
    void upgradeByZipReloadsEnabledPlugin() throws Exception {
        addLocal("foo");
        manager.enable("foo");
        PluginInstance before = manager.getPluginInstance("foo");
        callLog.clear();

        Path zip = TestPackages.zipFile(tempDir.resolve("foo-2.0.0.zip"), "foo", "2.0.0");
        PluginRecord upgraded = manager.upgradeByZip("foo", zip.toString());

        assertEquals("2.0.0", upgraded.getVersion());
        assertEquals("2.0.0", manager.getPluginData("foo").getVersion());
        assertNotSame(before, manager.getPluginInstance("foo"));
        assertTrue(manager.getPluginInstance("foo").isEnabled());
        assertEquals(List.of("foo.afterAdd", "foo.load"), callLog.snapshot());
    }

    @Test
    @DisplayName("升级不存在的插件失败")
    void upgradeUnknownPluginFails() {
        assertThrows(PluginNotFoundException.class, () -> manager.upgradeByNpm("nope"));
    }

    @Test
    @DisplayName("pm create 生成插件包骨架，pm add 复制并添加")
    void createAndAddByCli() throws Exception {
        assertThrows(PluginNotFoundException.class, () -> manager.addByCli("foo"));

        manager.doCliCommand(PluginManager.METHOD_CREATE, List.of("foo"));
        Path localPackage = Paths.get(properties.getLocalPackagesDir()).resolve("foo");
        assertTrue(Files.isRegularFile(localPackage.resolve("plugin.yml")));
        assertTrue(Files.isDirectory(localPackage.resolve("lib")));

        manager.doCliCommand(PluginManager.METHOD_ADD, List.of("foo"));
        manager.doCliCommand(PluginManager.METHOD_ENABLE, List.of("foo"));

        PluginRecord record = manager.getPluginData("foo");
        assertEquals("0.1.0", record.getVersion());
        assertTrue(record.getEnabled());
        assertTrue(Files.isRegularFile(Paths.get(properties.getPackagesDir()).resolve("foo").resolve("plugin.yml")));
    }

    @Test
    @DisplayName("未知命令抛出 IllegalArgumentException")
    void unknownCliMethod() {
        assertThrows(IllegalArgumentException.class, () -> manager.doCliCommand("explode", List.of("foo")));
    }

    @Test
    @DisplayName("克隆的管理器拥有独立的空注册表")
    void cloneHasEmptyRegistry() throws Exception {
        addLocal("foo");
        PluginManager other = manager.clone();
        assertTrue(other.getPluginInstances().isEmpty());
        assertEquals(1, manager.getPluginInstances().size());
    }
}
