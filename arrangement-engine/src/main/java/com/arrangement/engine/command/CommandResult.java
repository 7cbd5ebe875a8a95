package com.arrangement.engine.command;

import com.arrangement.core.exception.ArrangementException;

/**
 * Envelope returned for every dispatched command. Failures always report zero events.
 *
 * @param retryable true only when the failure was a concurrency conflict
 */
public record CommandResult<R>(
    boolean success,
    R result,
    String error,
    String errorCode,
    boolean retryable,
    int eventsGenerated,
    int undoableEventsRecorded
) {
    public static final String NO_HANDLER = "NO_HANDLER";
    public static final String UNEXPECTED_ERROR = "UNEXPECTED_ERROR";

    public static <R> CommandResult<R> success(R result, int eventsGenerated, int undoableEventsRecorded) {
        return new CommandResult<>(true, result, null, null, false, eventsGenerated, undoableEventsRecorded);
    }

    public static <R> CommandResult<R> failure(String errorCode, String error, boolean retryable) {
        return new CommandResult<>(false, null, error, errorCode, retryable, 0, 0);
    }

    public static <R> CommandResult<R> failure(ArrangementException e) {
        return failure(e.getErrorCode(), e.getMessage(), e.isRetryable());
    }
}
