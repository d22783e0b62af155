package com.weather.datalogger.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 读数校验结果
 */
public class ValidationResult implements Serializable {
    private boolean valid;
    private final List<String> errors;

    public ValidationResult() {
        this.valid = true;
        this.errors = new ArrayList<>();
    }

    public static ValidationResult success() {
        return new ValidationResult();
    }

    public static ValidationResult failure(String error) {
        ValidationResult result = new ValidationResult();
        result.addError(error);
        return result;
    }

    public void addError(String error) {
        this.errors.add(error);
        this.valid = false;
    }

    public boolean isValid() { return valid; }
    public List<String> getErrors() { return Collections.unmodifiableList(errors); }

    @Override
    public String toString() {
        return valid ? "valid" : String.join("; ", errors);
    }
}
