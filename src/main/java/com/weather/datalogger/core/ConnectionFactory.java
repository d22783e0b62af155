package com.weather.datalogger.core;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * 物理连接工厂。连接池通过它创建新连接，是池内唯一的连接来源。
 */
@FunctionalInterface
public interface ConnectionFactory {

    /**
     * 创建一条新的物理连接
     *
     * @return 已就绪的 JDBC 连接
     * @throws SQLException 连接建立失败
     */
    Connection create() throws SQLException;
}
