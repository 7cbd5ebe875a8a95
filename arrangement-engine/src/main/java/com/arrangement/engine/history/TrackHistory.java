package com.arrangement.engine.history;

import java.time.Instant;
import java.util.List;

/**
 * Timeline of a track's stored events, oldest first.
 */
public record TrackHistory(
    String trackId,
    long currentVersion,
    Instant createdAt,
    Instant lastModifiedAt,
    List<HistoryEntry> entries
) {
    public TrackHistory {
        entries = List.copyOf(entries);
    }

    public long undoableCount() {
        return entries.stream().filter(HistoryEntry::undoable).count();
    }
}
