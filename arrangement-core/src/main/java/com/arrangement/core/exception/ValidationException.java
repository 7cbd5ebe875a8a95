package com.arrangement.core.exception;

import java.util.List;

/**
 * Thrown when command input is malformed. Checked before any store access.
 */
public class ValidationException extends ArrangementException {

    public static final String ERROR_CODE = "VALIDATION_ERROR";

    private final List<String> errors;

    public ValidationException(String message) {
        this(List.of(message));
    }

    public ValidationException(List<String> errors) {
        super(ERROR_CODE, String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}
