package com.arrangement.engine.undo;

import com.arrangement.core.event.DomainEvent;

import java.util.List;

/**
 * Read-only copy of both stacks for one aggregate, most recent entry first.
 */
public record UndoRedoHistory<E extends DomainEvent>(
    String aggregateId,
    List<UndoRedoEntry<E>> undoEntries,
    List<UndoRedoEntry<E>> redoEntries
) {
    public UndoRedoHistory {
        undoEntries = List.copyOf(undoEntries);
        redoEntries = List.copyOf(redoEntries);
    }
}
