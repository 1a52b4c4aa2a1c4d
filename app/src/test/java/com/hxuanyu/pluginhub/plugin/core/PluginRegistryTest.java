package com.hxuanyu.pluginhub.plugin.core;

import com.hxuanyu.pluginhub.plugin.api.IPlugin;
import com.hxuanyu.pluginhub.plugin.api.PlatformContext;
import com.hxuanyu.pluginhub.plugin.api.PluginFactory;
import com.hxuanyu.pluginhub.plugin.model.InvalidPluginExportException;
import com.hxuanyu.pluginhub.plugin.model.PluginNotFoundException;
import com.hxuanyu.pluginhub.support.PluginCallLog;
import com.hxuanyu.pluginhub.support.RecordingPluginFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PluginRegistryTest {

    @TempDir
    Path dataRoot;

    private PluginRegistry registry;
    private PluginCallLog callLog;

    @BeforeEach
    void setUp() {
        registry = new PluginRegistry("main", dataRoot);
        callLog = new PluginCallLog();
    }

    private static PluginInstanceOptions named(String name) {
        return PluginInstanceOptions.builder().name(name).build();
    }

    @Test
    @DisplayName("注册实例并绑定平台上下文")
    void setInstanceBindsContext() {
        PluginInstance instance = registry.setInstance(new RecordingPluginFactory("foo", callLog), null,
                PluginInstanceOptions.builder().name("foo").enabled(true).options(Map.of("color", "red")).build());

        assertSame(instance, registry.getInstance("foo"));
        PlatformContext context = instance.getPlatformContext();
        assertEquals("main", context.getAppName());
        assertEquals("foo", context.getPluginName());
        assertTrue(context.isEnabled());
        assertEquals("red", context.getOptions().get("color"));
        assertEquals("plugin.foo", context.getLogger().getName());

        Path data = context.getDataDirectory();
        assertEquals(dataRoot.resolve("foo").normalize(), data);
        assertTrue(Files.isDirectory(data));
    }

    @Test
    @DisplayName("未命名的插件使用工厂名称或生成名称")
    void anonymousPluginsReceiveSyntheticNames() {
        PluginInstance fromFactory = registry.setInstance(new RecordingPluginFactory("named", callLog), null, named(null));
        PluginInstance first = registry.setInstance(new RecordingPluginFactory(null, callLog), null, named(null));
        PluginInstance second = registry.setInstance(new RecordingPluginFactory("", callLog), null, named(" "));

        assertEquals("named", fromFactory.getName());
        assertEquals("static-plugin-1", first.getName());
        assertEquals("static-plugin-2", second.getName());
        assertEquals(List.of("named", "static-plugin-1", "static-plugin-2"), registry.names());
    }

    @Test
    @DisplayName("缺少工厂、工厂返回空或构造失败时抛出 InvalidPluginExportException")
    void invalidFactories() {
        assertThrows(InvalidPluginExportException.class, () -> registry.setInstance(null, null, named("a")));

        PluginFactory returnsNull = new PluginFactory() {
            @Override
            public String getName() {
                return "b";
            }

            @Override
            public IPlugin create(PlatformContext context) {
                return null;
            }
        };
        assertThrows(InvalidPluginExportException.class, () -> registry.setInstance(returnsNull, null, named("b")));

        PluginFactory throwing = new PluginFactory() {
            @Override
            public String getName() {
                return "c";
            }

            @Override
            public IPlugin create(PlatformContext context) throws Exception {
                throw new Exception("boom");
            }
        };
        InvalidPluginExportException e = assertThrows(InvalidPluginExportException.class,
                () -> registry.setInstance(throwing, null, named("c")));
        assertEquals("boom", e.getCause().getMessage());
        assertEquals(0, registry.size());
    }

    @Test
    @DisplayName("同名注册替换实例并保留原有顺序")
    void replaceKeepsPosition() {
        registry.setInstance(new RecordingPluginFactory("a", callLog), null, named("a"));
        PluginInstance oldB = registry.setInstance(new RecordingPluginFactory("b", callLog), null, named("b"));
        registry.setInstance(new RecordingPluginFactory("c", callLog), null, named("c"));

        PluginInstance newB = registry.setInstance(new RecordingPluginFactory("b", callLog), null,
                PluginInstanceOptions.builder().name("b").enabled(true).build());

        assertNotSame(oldB, newB);
        assertSame(newB, registry.getInstance("b"));
        assertEquals(List.of("a", "b", "c"), registry.names());
        assertEquals(3, registry.values().size());
    }

    @Test
    @DisplayName("查询或移除不存在的实例")
    void missingInstances() {
        assertThrows(PluginNotFoundException.class, () -> registry.getInstance("nope"));
        assertFalse(registry.has("nope"));
        assertTrue(registry.find("nope").isEmpty());
        assertTrue(registry.remove("nope").isEmpty());

        registry.setInstance(new RecordingPluginFactory("a", callLog), null, named("a"));
        assertTrue(registry.remove("a").isPresent());
        assertFalse(registry.has("a"));
    }
}
