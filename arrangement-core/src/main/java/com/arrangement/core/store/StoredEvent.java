package com.arrangement.core.store;

import java.time.Instant;
import java.util.Map;

/**
 * Persisted wrapper around a serialized event.
 *
 * Invariants:
 * - version is 1-based and contiguous per aggregate id
 * - the payload is never rewritten after the append that produced it
 */
public record StoredEvent(
    String id,
    String aggregateId,
    String eventKind,
    String payload,
    long version,
    Instant timestamp,
    Map<String, String> metadata
) {
    public static final String META_EVENT_KIND = "eventKind";
    public static final String META_OCCURRED_AT = "occurredAt";

    public StoredEvent {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }
}
