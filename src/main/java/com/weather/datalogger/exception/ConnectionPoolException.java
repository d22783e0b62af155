package com.weather.datalogger.exception;

/**
 * 连接池相关异常的基类。
 * 直接抛出时表示等待连接期间线程被中断。
 */
public class ConnectionPoolException extends DataLoggerException {

    public ConnectionPoolException(String message) {
        super(message);
    }

    public ConnectionPoolException(String message, Throwable cause) {
        super(message, cause);
    }
}
