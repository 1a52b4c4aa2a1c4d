package com.hxuanyu.pluginhub.plugin.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * 插件记录
 * 每个应用实例中的一个插件对应一行，(name, appName) 唯一。
 * 布尔字段使用包装类型，便于作为按例查询的条件对象（null 表示不限制）。
 */
@Entity
@Table(name = "application_plugins",
        uniqueConstraints = @UniqueConstraint(name = "uk_application_plugins_name_app", columnNames = {"name", "app_name"}))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PluginRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String name;

    @Column(name = "app_name", nullable = false)
    private String appName;

    private String version;

    /** npm 仓库地址，通过 zip 或本地路径添加的插件为空 */
    private String registry;

    @Column(name = "zip_url", length = 1024)
    private String zipUrl;

    @Column(name = "client_url", length = 1024)
    private String clientUrl;

    private Boolean enabled;

    private Boolean installed;

    @Column(name = "built_in")
    private Boolean builtIn;

    @Column(name = "is_official")
    private Boolean isOfficial;

    @Convert(converter = PluginOptionsConverter.class)
    @Column(length = 4096)
    @Builder.Default
    private Map<String, Object> options = new HashMap<>();

    @Column(name = "created_at")
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) createdAt = Instant.now();
        updatedAt = Instant.now();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }
}
