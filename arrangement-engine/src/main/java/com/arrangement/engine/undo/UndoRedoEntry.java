package com.arrangement.engine.undo;

import com.arrangement.core.event.DomainEvent;

import java.time.Instant;

/**
 * One undoable step: the original event and who performed it. The inverse is built when the
 * step is undone.
 *
 * @param versionAtCapture store version the original event was persisted at
 */
public record UndoRedoEntry<E extends DomainEvent>(
    E originalEvent,
    String aggregateId,
    long versionAtCapture,
    Instant timestamp,
    String userId
) {}
