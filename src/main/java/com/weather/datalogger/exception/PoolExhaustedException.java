package com.weather.datalogger.exception;

import java.time.Duration;

/**
 * 超时时间内没有可用连接，且连接总数已达上限。
 * 由调用方决定是否退避重试，连接池内部不会重试。
 */
public class PoolExhaustedException extends ConnectionPoolException {

    private final Duration timeout;

    public PoolExhaustedException(Duration timeout, int maxConnections) {
        super("No connection available within " + timeout.toMillis()
                + "ms, all " + maxConnections + " connections are in use");
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
