package com.weather.datalogger.exception;

import com.weather.datalogger.model.ValidationResult;

/**
 * 读数或查询参数不合规。在触达缓存和连接池之前抛出。
 */
public class ValidationException extends DataLoggerException {

    private final ValidationResult result;

    public ValidationException(ValidationResult result) {
        super("Validation failed: " + result);
        this.result = result;
    }

    public ValidationException(String error) {
        this(ValidationResult.failure(error));
    }

    public ValidationResult getResult() {
        return result;
    }
}
