package com.weather.datalogger.storage;

import com.weather.datalogger.core.ConnectionFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * SQLite 连接工厂。
 *
 * 每条连接启用 WAL 模式与忙等待超时，多条连接并发读写同一个库文件时
 * 由 SQLite 自身的锁协调，不会立即报 SQLITE_BUSY。
 */
public class SQLiteConnectionFactory implements ConnectionFactory {

    private static final Logger log = LoggerFactory.getLogger(SQLiteConnectionFactory.class);

    private final String databasePath;
    private final long busyTimeoutMs;

    public SQLiteConnectionFactory(String databasePath, long busyTimeoutMs) {
        this.databasePath = databasePath;
        this.busyTimeoutMs = busyTimeoutMs;

        // 确保库文件所在目录存在
        File parent = new File(databasePath).getAbsoluteFile().getParentFile();
        if (parent != null && !parent.exists() && !parent.mkdirs()) {
            throw new IllegalStateException("Failed to create storage directory: " + parent);
        }
        log.info("SQLiteConnectionFactory targeting {} (busy timeout {}ms)", databasePath, busyTimeoutMs);
    }

    @Override
    public Connection create() throws SQLException {
        Connection conn = DriverManager.getConnection("jdbc:sqlite:" + databasePath);
        try {
            conn.setAutoCommit(true);
            try (Statement stmt = conn.createStatement()) {
                stmt.execute("PRAGMA busy_timeout=" + busyTimeoutMs);
                stmt.execute("PRAGMA journal_mode=WAL");
                stmt.execute("PRAGMA synchronous=NORMAL");
            }
            return conn;
        } catch (SQLException e) {
            conn.close();
            throw e;
        }
    }

    public String getDatabasePath() {
        return databasePath;
    }
}
