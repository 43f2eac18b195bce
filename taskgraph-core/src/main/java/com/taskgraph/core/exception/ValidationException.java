package com.taskgraph.core.exception;

/**
 * Thrown when input fails validation.
 */
public class ValidationException extends TaskGraphException {

    public static final String ERROR_CODE = "VALIDATION_FAILED";

    private final String field;

    public ValidationException(String field, String reason) {
        super(ERROR_CODE, String.format("Invalid %s: %s", field, reason));
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
