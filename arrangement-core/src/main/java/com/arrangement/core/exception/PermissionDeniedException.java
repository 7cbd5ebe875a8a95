package com.arrangement.core.exception;

/**
 * Thrown when a user attempts to undo or redo an operation they did not originate.
 */
public class PermissionDeniedException extends ArrangementException {

    public static final String ERROR_CODE = "PERMISSION_DENIED";

    public PermissionDeniedException(String message) {
        super(ERROR_CODE, message);
    }
}
