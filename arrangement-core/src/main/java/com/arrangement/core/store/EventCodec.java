package com.arrangement.core.store;

import com.arrangement.core.event.DomainEvent;

/**
 * Converts one event family to and from its stored payload.
 */
public interface EventCodec<E extends DomainEvent> {

    String encode(E event);

    /**
     * Decode a stored event. Unknown kinds must decode to a tolerated placeholder rather than fail.
     */
    E decode(StoredEvent storedEvent);
}
