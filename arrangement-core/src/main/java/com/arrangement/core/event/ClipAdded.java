package com.arrangement.core.event;

import com.arrangement.core.model.Clip;

import java.time.Instant;

public record ClipAdded(String aggregateId, Instant occurredAt, Clip clip)
    implements TrackEvent, Invertible<TrackEvent> {

    @Override
    public TrackEventKind kind() {
        return TrackEventKind.CLIP_ADDED;
    }

    @Override
    public TrackEvent invert(Instant invertedAt) {
        return new ClipRemoved(aggregateId, invertedAt, clip.clipId(), clip);
    }

    @Override
    public ClipAdded withOccurredAt(Instant at) {
        return new ClipAdded(aggregateId, at, clip);
    }
}
