package com.weather.datalogger.exception;

/**
 * 连接池已关闭后仍尝试获取连接
 */
public class PoolClosedException extends ConnectionPoolException {

    public PoolClosedException() {
        super("Connection pool has been shut down");
    }
}
