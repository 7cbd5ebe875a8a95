package com.arrangement.core.event;

import java.time.Instant;

/**
 * An event that can synthesize its own logical inverse.
 * Applying an event and then its inverse returns the aggregate to an equivalent state.
 *
 * @param <E> the event family the inverse belongs to
 */
public interface Invertible<E extends DomainEvent> {

    /**
     * @param invertedAt time the inverse is applied, used as its {@code occurredAt}
     */
    E invert(Instant invertedAt);
}
