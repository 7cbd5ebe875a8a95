package com.arrangement.core.event;

import com.arrangement.core.model.Clip;

import java.time.Instant;

/**
 * Carries the full removed clip so the removal can be undone.
 */
public record ClipRemoved(String aggregateId, Instant occurredAt, String clipId, Clip removedClip)
    implements TrackEvent, Invertible<TrackEvent> {

    @Override
    public TrackEventKind kind() {
        return TrackEventKind.CLIP_REMOVED;
    }

    @Override
    public TrackEvent invert(Instant invertedAt) {
        return new ClipAdded(aggregateId, invertedAt, removedClip);
    }

    @Override
    public ClipRemoved withOccurredAt(Instant at) {
        return new ClipRemoved(aggregateId, at, clipId, removedClip);
    }
}
