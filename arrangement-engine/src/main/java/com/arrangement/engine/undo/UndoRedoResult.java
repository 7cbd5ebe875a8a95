package com.arrangement.engine.undo;

import com.arrangement.core.event.DomainEvent;
import com.arrangement.core.exception.ArrangementException;

import java.util.List;

/**
 * Outcome of an undo or redo. Failures carry an error code instead of throwing so that
 * batches can stop at the first failed step.
 */
public record UndoRedoResult<E extends DomainEvent>(
    boolean success,
    List<E> eventsApplied,
    long newVersion,
    String error,
    String errorCode
) {
    public static final String NOTHING_TO_UNDO = "NOTHING_TO_UNDO";
    public static final String NOTHING_TO_REDO = "NOTHING_TO_REDO";

    public UndoRedoResult {
        eventsApplied = List.copyOf(eventsApplied);
    }

    public static <E extends DomainEvent> UndoRedoResult<E> success(List<E> eventsApplied, long newVersion) {
        return new UndoRedoResult<>(true, eventsApplied, newVersion, null, null);
    }

    public static <E extends DomainEvent> UndoRedoResult<E> failure(String errorCode, String error, long currentVersion) {
        return new UndoRedoResult<>(false, List.of(), currentVersion, error, errorCode);
    }

    public static <E extends DomainEvent> UndoRedoResult<E> failure(ArrangementException e, long currentVersion) {
        return failure(e.getErrorCode(), e.getMessage(), currentVersion);
    }
}
