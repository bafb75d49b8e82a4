package com.ytnd.downloader.service;

import com.ytnd.downloader.config.DownloaderConfig;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;

import javax.sql.DataSource;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.Connection;
import java.sql.SQLException;

/**
 * Shared JDBC connection pool.
 * SQLite file by default, MySQL when {@code db.type=mysql}.
 */
@Slf4j
public class DatabaseService {

    private final HikariDataSource dataSource;
    private final DownloaderConfig config;

    public DatabaseService(DownloaderConfig config) {
        this.config = config;
        this.dataSource = initDataSource();
        log.info("Database service initialized ({})", config.getDbType());
    }

    private HikariDataSource initDataSource() {
        HikariConfig hikariConfig = new HikariConfig();

        if ("mysql".equalsIgnoreCase(config.getDbType())) {
            String jdbcUrl = String.format(
                "jdbc:mysql://%s:%s/%s?useUnicode=true&characterEncoding=UTF-8&useSSL=false&allowPublicKeyRetrieval=true",
                config.getDbHost(),
                config.getDbPort(),
                config.getDbDatabase()
            );
            hikariConfig.setJdbcUrl(jdbcUrl);
            hikariConfig.setUsername(config.getDbUsername());
            hikariConfig.setPassword(config.getDbPassword());
            hikariConfig.setMaximumPoolSize(config.getDbMaxPoolSize());
            hikariConfig.setConnectionTestQuery("SELECT 1");
            log.info("Database: {} (user {})", jdbcUrl, config.getDbUsername());
        } else {
            Path dbFile = Paths.get(config.getDbSqlitePath()).toAbsolutePath();
            try {
                if (dbFile.getParent() != null) {
                    Files.createDirectories(dbFile.getParent());
                }
            } catch (IOException e) {
                throw new IllegalStateException("Cannot create database directory for " + dbFile, e);
            }
            hikariConfig.setJdbcUrl("jdbc:sqlite:" + dbFile);
            // SQLite serializes writers anyway
            hikariConfig.setMaximumPoolSize(Math.min(config.getDbMaxPoolSize(), 4));
            log.info("Database: SQLite file {}", dbFile);
        }

        hikariConfig.setMinimumIdle(config.getDbMinIdle());
        hikariConfig.setConnectionTimeout(config.getDbConnectionTimeout());
        hikariConfig.setPoolName("ytnd-db");

        HikariDataSource ds = new HikariDataSource(hikariConfig);
        try (Connection conn = ds.getConnection()) {
            log.info("Database connection test succeeded");
            return ds;
        } catch (SQLException e) {
            log.error("Database connection test failed", e);
            ds.close();
            throw new IllegalStateException("Database connection failed", e);
        }
    }

    public Connection getConnection() throws SQLException {
        return dataSource.getConnection();
    }

    public DataSource getDataSource() {
        return dataSource;
    }

    public boolean isAvailable() {
        try (Connection conn = getConnection()) {
            return conn.isValid(5);
        } catch (SQLException e) {
            log.error("Database unavailable", e);
            return false;
        }
    }

    public void close() {
        if (dataSource != null && !dataSource.isClosed()) {
            dataSource.close();
            log.info("Database pool closed");
        }
    }
}
