package com.dataops.costanomaly.exception;

/**
 * Request parameters rejected before any series is fetched.
 */
public class ValidationException extends IllegalArgumentException {

    private final String field;

    public ValidationException(String message, String field) {
        super(message);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
