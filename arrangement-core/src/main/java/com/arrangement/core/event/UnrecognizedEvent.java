package com.arrangement.core.event;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * A stored event whose kind this build does not know, e.g. written by a newer version.
 * Carried through untouched and ignored by the aggregate.
 */
public record UnrecognizedEvent(String aggregateId, Instant occurredAt, String eventKind, JsonNode payload)
    implements TrackEvent {

    @Override
    public TrackEventKind kind() {
        return TrackEventKind.UNRECOGNIZED;
    }

    @Override
    public UnrecognizedEvent withOccurredAt(Instant at) {
        return new UnrecognizedEvent(aggregateId, at, eventKind, payload);
    }
}
