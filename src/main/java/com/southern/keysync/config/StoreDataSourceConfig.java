package com.southern.keysync.config;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * 状态库数据源：SQLite 文件 + Hikari
 * 连接池默认大小 1，所有写操作串行；WAL 模式下读不阻塞
 */
@Slf4j
@Configuration
public class StoreDataSourceConfig {

    @Bean(destroyMethod = "close")
    public DataSource dataSource(KeySyncProperties properties) {
        KeySyncProperties.Database database = properties.getDatabase();
        Path dbPath = Paths.get(database.getPath()).toAbsolutePath();
        try {
            if (dbPath.getParent() != null) {
                Files.createDirectories(dbPath.getParent());
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create database directory for " + dbPath, e);
        }

        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setDriverClassName("org.sqlite.JDBC");
        hikariConfig.setJdbcUrl("jdbc:sqlite:" + dbPath);
        hikariConfig.addDataSourceProperty("journal_mode", "WAL");
        hikariConfig.addDataSourceProperty("foreign_keys", "true");
        hikariConfig.addDataSourceProperty("busy_timeout", "5000");
        hikariConfig.setMaximumPoolSize(database.getPoolSize());
        hikariConfig.setPoolName("KeySyncStorePool");
        log.info("Using state store at {}", dbPath);
        return new HikariDataSource(hikariConfig);
    }
}
