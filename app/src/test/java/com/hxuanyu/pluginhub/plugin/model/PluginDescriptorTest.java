package com.hxuanyu.pluginhub.plugin.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PluginDescriptorTest {

    private static InputStream yaml(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("解析描述符字段，数字版本号转为字符串")
    void parsesFields() {
        PluginDescriptor descriptor = PluginDescriptor.load(yaml(
                "name: foo\nversion: 1.0\ndisplayName: Foo\nauthor: someone\ntags: [a, b]\n"));

        assertEquals("foo", descriptor.getName());
        assertEquals("1.0", descriptor.getVersion());
        assertEquals("Foo", descriptor.getDisplayName());
        assertEquals("someone", descriptor.getAuthor());
        assertEquals(List.of("a", "b"), descriptor.getTags());
    }

    @Test
    @DisplayName("标签支持逗号分隔的字符串")
    void parsesCsvTags() {
        PluginDescriptor descriptor = PluginDescriptor.load(yaml("name: foo\ntags: 'x, y, x'\n"));
        assertEquals(List.of("x", "y"), descriptor.getTags());
    }

    @Test
    @DisplayName("缺少名称或内容不是映射时失败")
    void rejectsInvalidDescriptors() {
        assertThrows(PackageResolutionException.class, () -> PluginDescriptor.load(yaml("version: 1.0.0\n")));
        assertThrows(PackageResolutionException.class, () -> PluginDescriptor.load(yaml("- a\n- b\n")));
    }
}
