package com.weather.datalogger.core;

import java.sql.Connection;

/**
 * 连接句柄：一条物理连接在池中的身份。
 *
 * 在借出与归还之间由唯一调用方持有。close() 等价于归还，
 * 因此可以直接用于 try-with-resources；重复归还会被连接池判定为违约。
 */
public final class PooledConnection implements AutoCloseable {

    private final int id;
    private final Connection connection;
    private final ConnectionPool owner;
    private final long createdAtMs;

    private volatile boolean broken;

    public PooledConnection(int id, Connection connection, ConnectionPool owner) {
        this.id = id;
        this.connection = connection;
        this.owner = owner;
        this.createdAtMs = System.currentTimeMillis();
    }

    public int getId() { return id; }
    public Connection getConnection() { return connection; }
    public long getCreatedAtMs() { return createdAtMs; }

    /**
     * 标记底层连接已损坏，归还时由连接池丢弃
     */
    public void markBroken() {
        this.broken = true;
    }

    public boolean isBroken() {
        return broken;
    }

    /**
     * 归还到所属连接池
     */
    @Override
    public void close() {
        owner.release(this);
    }

    @Override
    public String toString() {
        return "PooledConnection#" + id + (broken ? "(broken)" : "");
    }
}
