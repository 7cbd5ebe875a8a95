package com.arrangement.core.store;

import com.arrangement.core.event.DomainEvent;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Append-only, per-aggregate event log with optimistic concurrency.
 * Knows nothing about aggregate semantics.
 */
public interface EventStore<E extends DomainEvent> {

    /**
     * Append events atomically, assigning versions expectedVersion+1 .. expectedVersion+n.
     *
     * @return the stored records, in list order
     * @throws com.arrangement.core.exception.ConcurrencyConflictException
     *         if expectedVersion is not the current version; nothing is written in that case
     */
    List<StoredEvent> append(String aggregateId, List<E> events, long expectedVersion);

    /**
     * All events for an aggregate in ascending version order.
     */
    List<E> load(String aggregateId);

    /**
     * Events with a version strictly greater than fromVersion.
     */
    List<E> load(String aggregateId, long fromVersion);

    /**
     * Events with a version up to and including toVersion.
     */
    List<E> loadToVersion(String aggregateId, long toVersion);

    List<StoredEvent> storedEvents(String aggregateId);

    long currentVersion(String aggregateId);

    boolean exists(String aggregateId);

    void saveSnapshot(AggregateSnapshot snapshot);

    Optional<AggregateSnapshot> loadSnapshot(String aggregateId);

    /**
     * Events across all aggregates stored at or after the timestamp, oldest first.
     * Linear scan.
     */
    List<E> eventsSince(Instant timestamp);

    /**
     * Events of one kind across all aggregates. Linear scan.
     */
    List<E> eventsByKind(String eventKind);

    List<StoredEvent> allEvents();

    long eventCount();

    void clear();
}
