package com.arrangement.core.model;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Immutable view of a track's reconstructed state. Two replays of the same log produce equal states.
 */
public record TrackState(
    String trackId,
    String ownerId,
    TrackType trackType,
    TrackMetadata metadata,
    Map<String, Clip> clips
) {
    public TrackState {
        clips = clips == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(clips));
    }
}
