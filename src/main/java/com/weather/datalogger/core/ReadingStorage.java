package com.weather.datalogger.core;

import com.weather.datalogger.model.Reading;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;

/**
 * 读数存储接口：仅追加的有序读数集合。
 *
 * 所有操作都在调用方提供的连接上执行，不自行管理连接，
 * 连接的借用与归还由 {@link ConnectionPool} 负责。
 *
 * 底层实现要点：
 * - 行结构 (timestamp, temperature, sensor_id)
 * - 时间戳 B-tree 索引，保证范围查询效率
 * - 传感器 + 时间戳联合索引
 */
public interface ReadingStorage {

    /**
     * 创建表结构和索引，已存在时不做任何事
     */
    void initializeSchema(Connection connection) throws SQLException;

    /**
     * 追加一条读数
     *
     * @return 存储生成的行标识
     */
    long append(Connection connection, Reading reading) throws SQLException;

    /**
     * 查询时间范围内的读数，两端均包含
     *
     * @return 读数序列，按时间戳升序排列
     */
    List<Reading> findBetween(Connection connection, Instant start, Instant end) throws SQLException;

    /**
     * 查询最新的若干条读数
     *
     * @return 读数序列，按时间戳降序排列
     */
    List<Reading> findLatest(Connection connection, int limit) throws SQLException;

    /** 累计读数条数 */
    long countAll(Connection connection) throws SQLException;

    /** 时间戳不早于 since 的读数条数 */
    long countSince(Connection connection, Instant since) throws SQLException;
}
