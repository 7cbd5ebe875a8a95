package com.arrangement.core.exception;

/**
 * Thrown when a requested entity does not exist.
 */
public class NotFoundException extends ArrangementException {

    public static final String ERROR_CODE = "NOT_FOUND";

    public NotFoundException(String entityType, String entityId) {
        super(ERROR_CODE, String.format("%s not found: %s", entityType, entityId));
    }
}
