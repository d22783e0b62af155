package com.weather.datalogger.exception;

/**
 * 数据记录器所有运行时异常的基类
 */
public class DataLoggerException extends RuntimeException {

    public DataLoggerException(String message) {
        super(message);
    }

    public DataLoggerException(String message, Throwable cause) {
        super(message, cause);
    }
}
