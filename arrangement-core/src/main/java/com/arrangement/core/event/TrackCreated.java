package com.arrangement.core.event;

import com.arrangement.core.model.Clip;
import com.arrangement.core.model.TrackMetadata;
import com.arrangement.core.model.TrackType;

import java.time.Instant;
import java.util.List;

/**
 * Factory event of a track. Not undoable.
 */
public record TrackCreated(
    String aggregateId,
    Instant occurredAt,
    String ownerId,
    TrackType trackType,
    TrackMetadata metadata,
    List<Clip> initialClips
) implements TrackEvent {

    public TrackCreated {
        initialClips = initialClips == null ? List.of() : List.copyOf(initialClips);
    }

    @Override
    public TrackEventKind kind() {
        return TrackEventKind.TRACK_CREATED;
    }

    @Override
    public TrackCreated withOccurredAt(Instant at) {
        return new TrackCreated(aggregateId, at, ownerId, trackType, metadata, initialClips);
    }
}
