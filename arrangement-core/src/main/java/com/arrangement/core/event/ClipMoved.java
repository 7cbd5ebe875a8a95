package com.arrangement.core.event;

import com.arrangement.core.model.TimeRange;

import java.time.Instant;

public record ClipMoved(
    String aggregateId,
    Instant occurredAt,
    String clipId,
    TimeRange previousRange,
    TimeRange range
) implements TrackEvent, Invertible<TrackEvent> {

    @Override
    public TrackEventKind kind() {
        return TrackEventKind.CLIP_MOVED;
    }

    @Override
    public TrackEvent invert(Instant invertedAt) {
        return new ClipMoved(aggregateId, invertedAt, clipId, range, previousRange);
    }

    @Override
    public ClipMoved withOccurredAt(Instant at) {
        return new ClipMoved(aggregateId, at, clipId, previousRange, range);
    }
}
