package com.weather.datalogger.exception;

/**
 * 连接句柄使用违约：重复归还、归还未借出的句柄或归还其他池的句柄
 */
public class HandleMisuseException extends ConnectionPoolException {

    public HandleMisuseException(String message) {
        super(message);
    }
}
