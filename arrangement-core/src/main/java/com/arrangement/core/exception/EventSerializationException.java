package com.arrangement.core.exception;

/**
 * Thrown when an event or snapshot cannot be written to or read from its stored form.
 */
public class EventSerializationException extends ArrangementException {

    public static final String ERROR_CODE = "SERIALIZATION_FAILED";

    public EventSerializationException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }
}
