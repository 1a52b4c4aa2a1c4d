package com.hxuanyu.pluginhub.plugin.repository;

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;

/**
 * 插件记录表结构管理
 * 表结构由 db/application_plugins.sql 维护，脚本可重复执行
 */
@Component
@Slf4j
public class PluginSchemaManager {

    public static final String TABLE_NAME = "application_plugins";
    private static final String SCHEMA_SCRIPT = "db/application_plugins.sql";

    private final DataSource dataSource;

    public PluginSchemaManager(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    /**
     * 同步插件记录表结构
     */
    public void sync() {
        ResourceDatabasePopulator populator = new ResourceDatabasePopulator(new ClassPathResource(SCHEMA_SCRIPT));
        populator.setSqlScriptEncoding("UTF-8");
        populator.execute(dataSource);
        log.info("Synchronized schema of table {}", TABLE_NAME);
    }

    /**
     * 插件记录表是否已存在于数据库中
     */
    public boolean tableExists() {
        try (Connection connection = dataSource.getConnection()) {
            DatabaseMetaData metaData = connection.getMetaData();
            // 不同数据库对未加引号的标识符大小写处理不同，逐个尝试
            for (String candidate : new String[]{TABLE_NAME, TABLE_NAME.toUpperCase(), TABLE_NAME.toLowerCase()}) {
                try (ResultSet rs = metaData.getTables(connection.getCatalog(), null, candidate, new String[]{"TABLE"})) {
                    if (rs.next()) {
                        return true;
                    }
                }
            }
            return false;
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to inspect table " + TABLE_NAME, e);
        }
    }
}
