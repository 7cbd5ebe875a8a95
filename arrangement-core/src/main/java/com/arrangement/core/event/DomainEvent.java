package com.arrangement.core.event;

import java.time.Instant;

/**
 * An immutable description of a state change on one aggregate.
 * Events are never mutated after creation.
 */
public interface DomainEvent {

    /**
     * Stable string tag identifying the event variant in the store.
     */
    String eventKind();

    String aggregateId();

    Instant occurredAt();
}
