package com.arrangement.engine.history;

import com.arrangement.core.model.TrackState;

import java.time.Instant;

/**
 * Track state reconstructed from a prefix of its event log.
 *
 * @param version       version of the last event replayed
 * @param lastEventTime store timestamp of that event
 */
public record ReplayResult(
    String trackId,
    long version,
    Instant lastEventTime,
    TrackState state,
    int eventCount
) {
}
