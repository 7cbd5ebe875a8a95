package com.arrangement.core.event;

import java.time.Instant;
import java.util.Optional;

/**
 * An event family that undo and redo can work with without knowing its variants.
 *
 * @param <E> the family itself
 */
public interface ReversibleEvent<E extends ReversibleEvent<E>> extends DomainEvent {

    boolean undoable();

    /**
     * The inverse of this event stamped at {@code invertedAt}, or empty if it cannot be undone.
     */
    Optional<E> inverseAt(Instant invertedAt);

    /**
     * A copy of this event re-stamped for appending again, e.g. on redo.
     */
    E withOccurredAt(Instant at);
}
