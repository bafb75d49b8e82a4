package com.ytnd.downloader.store;

import com.ytnd.downloader.model.QueueItem;
import com.ytnd.downloader.service.DatabaseService;
import lombok.extern.slf4j.Slf4j;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

/**
 * Download queue stored through the shared connection pool.
 * Rows are {@code (uid, url, position)} with {@code (uid, position)} as the primary key.
 */
@Slf4j
public class JdbcQueueStore implements QueueStore {

    private static final String CREATE_TABLE_SQL =
        "CREATE TABLE IF NOT EXISTS queue (" +
        "uid VARCHAR(64) NOT NULL, " +
        "url VARCHAR(2000) NOT NULL, " +
        "position INTEGER NOT NULL, " +
        "PRIMARY KEY (uid, position))";

    private final DatabaseService databaseService;

    public JdbcQueueStore(DatabaseService databaseService) {
        this.databaseService = databaseService;
        initSchema();
    }

    private void initSchema() {
        try (Connection conn = databaseService.getConnection();
             Statement stmt = conn.createStatement()) {
            stmt.execute(CREATE_TABLE_SQL);
        } catch (SQLException e) {
            throw new QueueStoreException("Cannot initialize queue table", e);
        }
    }

    @Override
    public List<String> load(String userId) {
        List<String> urls = new ArrayList<>();
        for (QueueItem item : loadItems(userId)) {
            urls.add(item.getUrl());
        }
        return urls;
    }

    public List<QueueItem> loadItems(String userId) {
        String sql = "SELECT url, position FROM queue WHERE uid = ? ORDER BY position";
        try (Connection conn = databaseService.getConnection();
             PreparedStatement pstmt = conn.prepareStatement(sql)) {
            pstmt.setString(1, userId);
            List<QueueItem> items = new ArrayList<>();
            try (ResultSet rs = pstmt.executeQuery()) {
                while (rs.next()) {
                    items.add(new QueueItem(rs.getString("url"), rs.getInt("position")));
                }
            }
            return items;
        } catch (SQLException e) {
            log.error("Failed to load queue from database: {}", e.getMessage());
            throw new QueueStoreException("Cannot load queue for user " + userId, e);
        }
    }

    @Override
    public void replace(String userId, List<String> urls) {
        try (Connection conn = databaseService.getConnection()) {
            boolean autoCommit = conn.getAutoCommit();
            conn.setAutoCommit(false);
            try {
                try (PreparedStatement delete = conn.prepareStatement("DELETE FROM queue WHERE uid = ?")) {
                    delete.setString(1, userId);
                    delete.executeUpdate();
                }
                insertFrom(conn, userId, urls, 0);
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setAutoCommit(autoCommit);
            }
        } catch (SQLException e) {
            log.error("Failed to save queue to database: {}", e.getMessage());
            throw new QueueStoreException("Cannot save queue for user " + userId, e);
        }
    }

    @Override
    public void append(String userId, List<String> urls) {
        if (urls.isEmpty()) {
            return;
        }
        try (Connection conn = databaseService.getConnection()) {
            boolean autoCommit = conn.getAutoCommit();
            conn.setAutoCommit(false);
            try {
                int nextPosition = 0;
                try (PreparedStatement max = conn.prepareStatement(
                    "SELECT MAX(position) AS max_pos FROM queue WHERE uid = ?")) {
                    max.setString(1, userId);
                    try (ResultSet rs = max.executeQuery()) {
                        if (rs.next()) {
                            int maxPos = rs.getInt("max_pos");
                            nextPosition = rs.wasNull() ? 0 : maxPos + 1;
                        }
                    }
                }
                insertFrom(conn, userId, urls, nextPosition);
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setAutoCommit(autoCommit);
            }
        } catch (SQLException e) {
            log.error("Failed to add URLs to queue: {}", e.getMessage());
            throw new QueueStoreException("Cannot add URLs to queue for user " + userId, e);
        }
    }

    private void insertFrom(Connection conn, String userId, List<String> urls, int firstPosition) throws SQLException {
        if (urls.isEmpty()) {
            return;
        }
        try (PreparedStatement insert = conn.prepareStatement(
            "INSERT INTO queue (uid, url, position) VALUES (?, ?, ?)")) {
            int position = firstPosition;
            for (String url : urls) {
                insert.setString(1, userId);
                insert.setString(2, url);
                insert.setInt(3, position++);
                insert.addBatch();
            }
            insert.executeBatch();
        }
    }
}
