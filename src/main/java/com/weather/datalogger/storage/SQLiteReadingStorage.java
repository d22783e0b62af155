package com.weather.datalogger.storage;

import com.weather.datalogger.core.ReadingStorage;
import com.weather.datalogger.model.Reading;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * 基于 SQLite 的读数存储实现。
 *
 * 核心设计：
 * - 单表追加写入，时间戳以 epoch 毫秒存为 INTEGER
 * - 时间戳 B-tree 索引支撑范围查询，传感器 + 时间戳联合索引支撑按传感器检索
 * - 无状态：不持有连接，所有操作在调用方借出的连接上完成
 */
public class SQLiteReadingStorage implements ReadingStorage {

    private static final Logger log = LoggerFactory.getLogger(SQLiteReadingStorage.class);

    static final String TABLE = "temperature_readings";

    private static final String CREATE_TABLE_SQL = "CREATE TABLE IF NOT EXISTS " + TABLE + " ("
            + "id INTEGER PRIMARY KEY AUTOINCREMENT, "
            + "timestamp INTEGER NOT NULL, "
            + "temperature REAL NOT NULL, "
            + "sensor_id TEXT NOT NULL, "
            + "created_at INTEGER NOT NULL)";

    private static final String INSERT_SQL = "INSERT INTO " + TABLE
            + " (timestamp, temperature, sensor_id, created_at) VALUES (?, ?, ?, ?)";

    private static final String SELECT_BETWEEN_SQL = "SELECT timestamp, temperature, sensor_id FROM " + TABLE
            + " WHERE timestamp >= ? AND timestamp <= ? ORDER BY timestamp ASC, id ASC";

    private static final String SELECT_LATEST_SQL = "SELECT timestamp, temperature, sensor_id FROM " + TABLE
            + " ORDER BY timestamp DESC, id DESC LIMIT ?";

    @Override
    public void initializeSchema(Connection connection) throws SQLException {
        try (Statement stmt = connection.createStatement()) {
            stmt.execute(CREATE_TABLE_SQL);
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_timestamp ON " + TABLE + " (timestamp)");
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_sensor_timestamp ON " + TABLE + " (sensor_id, timestamp)");
        }
        log.info("Reading storage schema initialized.");
    }

    @Override
    public long append(Connection connection, Reading reading) throws SQLException {
        try (PreparedStatement stmt = connection.prepareStatement(INSERT_SQL, Statement.RETURN_GENERATED_KEYS)) {
            stmt.setLong(1, reading.getTimestamp().toEpochMilli());
            stmt.setDouble(2, reading.getTemperature());
            stmt.setString(3, reading.getSensorId());
            stmt.setLong(4, System.currentTimeMillis());
            stmt.executeUpdate();

            try (ResultSet keys = stmt.getGeneratedKeys()) {
                return keys.next() ? keys.getLong(1) : -1L;
            }
        }
    }

    @Override
    public List<Reading> findBetween(Connection connection, Instant start, Instant end) throws SQLException {
        try (PreparedStatement stmt = connection.prepareStatement(SELECT_BETWEEN_SQL)) {
            stmt.setLong(1, start.toEpochMilli());
            stmt.setLong(2, end.toEpochMilli());
            return readAll(stmt);
        }
    }

    @Override
    public List<Reading> findLatest(Connection connection, int limit) throws SQLException {
        try (PreparedStatement stmt = connection.prepareStatement(SELECT_LATEST_SQL)) {
            stmt.setInt(1, limit);
            return readAll(stmt);
        }
    }

    @Override
    public long countAll(Connection connection) throws SQLException {
        try (Statement stmt = connection.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT COUNT(*) FROM " + TABLE)) {
            return rs.next() ? rs.getLong(1) : 0L;
        }
    }

    @Override
    public long countSince(Connection connection, Instant since) throws SQLException {
        try (PreparedStatement stmt = connection.prepareStatement(
                "SELECT COUNT(*) FROM " + TABLE + " WHERE timestamp >= ?")) {
            stmt.setLong(1, since.toEpochMilli());
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? rs.getLong(1) : 0L;
            }
        }
    }

    private List<Reading> readAll(PreparedStatement stmt) throws SQLException {
        List<Reading> readings = new ArrayList<>();
        try (ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                readings.add(mapRow(rs));
            }
        }
        return readings;
    }

    private Reading mapRow(ResultSet rs) throws SQLException {
        return new Reading(
                Instant.ofEpochMilli(rs.getLong("timestamp")),
                rs.getDouble("temperature"),
                rs.getString("sensor_id")
        );
    }
}
