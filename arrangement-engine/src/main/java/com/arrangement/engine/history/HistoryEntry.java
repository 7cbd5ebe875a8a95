package com.arrangement.engine.history;

import java.time.Instant;

/**
 * One stored event on a track's timeline.
 */
public record HistoryEntry(long version, String eventKind, Instant timestamp, boolean undoable) {
}
