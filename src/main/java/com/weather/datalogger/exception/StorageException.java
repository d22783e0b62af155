package com.weather.datalogger.exception;

/**
 * 底层存储读写失败
 */
public class StorageException extends DataLoggerException {

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
