package com.arrangement.core.exception;

/**
 * Thrown when a registered handler factory fails to produce an instance.
 * Terminal for the command being dispatched only.
 */
public class HandlerInstantiationException extends ArrangementException {

    public static final String ERROR_CODE = "HANDLER_INSTANTIATION_FAILED";

    public HandlerInstantiationException(String handlerName, Throwable cause) {
        super(ERROR_CODE, "Failed to create instance: " + describe(cause), cause);
    }

    public HandlerInstantiationException(String handlerName) {
        super(ERROR_CODE, "Failed to create instance: factory for " + handlerName + " returned null");
    }

    private static String describe(Throwable cause) {
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
