package com.arrangement.core.event;

import com.arrangement.core.model.TrackMetadata;

import java.time.Instant;

public record TrackMetadataUpdated(
    String aggregateId,
    Instant occurredAt,
    TrackMetadata previousMetadata,
    TrackMetadata metadata
) implements TrackEvent, Invertible<TrackEvent> {

    @Override
    public TrackEventKind kind() {
        return TrackEventKind.TRACK_METADATA_UPDATED;
    }

    @Override
    public TrackEvent invert(Instant invertedAt) {
        return new TrackMetadataUpdated(aggregateId, invertedAt, metadata, previousMetadata);
    }

    @Override
    public TrackMetadataUpdated withOccurredAt(Instant at) {
        return new TrackMetadataUpdated(aggregateId, at, previousMetadata, metadata);
    }
}
