package com.arrangement.engine.persistence;

import com.arrangement.core.event.DomainEvent;
import com.arrangement.core.exception.ConcurrencyConflictException;
import com.arrangement.core.store.AggregateSnapshot;
import com.arrangement.core.store.EventCodec;
import com.arrangement.core.store.EventStore;
import com.arrangement.core.store.StoredEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * In-memory implementation of EventStore.
 *
 * <p>Each aggregate's stream is an immutable list replaced on every append, so readers never
 * observe a partially written batch. The version check and the replacement happen inside one
 * {@link ConcurrentHashMap#compute} call, which makes compare-and-append atomic per aggregate.</p>
 *
 * <p>Cross-aggregate queries are linear scans over every stream.</p>
 */
@Repository
public class InMemoryEventStore<E extends DomainEvent> implements EventStore<E> {

    private static final Logger log = LoggerFactory.getLogger(InMemoryEventStore.class);

    private static final Comparator<StoredEvent> BY_TIME = Comparator
        .comparing(StoredEvent::timestamp)
        .thenComparing(StoredEvent::aggregateId)
        .thenComparingLong(StoredEvent::version);

    private final Map<String, List<StoredEvent>> streams = new ConcurrentHashMap<>();
    private final Map<String, AggregateSnapshot> snapshots = new ConcurrentHashMap<>();
    private final AtomicLong eventIdSequence = new AtomicLong();

    private final EventCodec<E> codec;
    private final Clock clock;

    public InMemoryEventStore(EventCodec<E> codec, Clock clock) {
        this.codec = codec;
        this.clock = clock;
    }

    @Override
    public List<StoredEvent> append(String aggregateId, List<E> events, long expectedVersion) {
        if (events.isEmpty()) {
            long current = currentVersion(aggregateId);
            if (current != expectedVersion) {
                throw new ConcurrencyConflictException(aggregateId, expectedVersion, current);
            }
            return List.of();
        }

        // Encode up front so a serialization failure cannot leave a partial batch behind.
        List<String> payloads = events.stream().map(codec::encode).collect(Collectors.toList());
        List<StoredEvent> appended = new ArrayList<>(events.size());

        streams.compute(aggregateId, (id, existing) -> {
            List<StoredEvent> current = existing == null ? List.of() : existing;
            if (current.size() != expectedVersion) {
                throw new ConcurrencyConflictException(id, expectedVersion, current.size());
            }
            Instant now = clock.instant();
            List<StoredEvent> next = new ArrayList<>(current);
            for (int i = 0; i < events.size(); i++) {
                E event = events.get(i);
                StoredEvent stored = new StoredEvent(
                    "evt-" + eventIdSequence.incrementAndGet(),
                    id,
                    event.eventKind(),
                    payloads.get(i),
                    expectedVersion + i + 1,
                    now,
                    Map.of(
                        StoredEvent.META_EVENT_KIND, event.eventKind(),
                        StoredEvent.META_OCCURRED_AT, String.valueOf(event.occurredAt())
                    )
                );
                next.add(stored);
                appended.add(stored);
            }
            return List.copyOf(next);
        });

        log.debug("Appended {} event(s) to {} at versions {}..{}",
            appended.size(), aggregateId, expectedVersion + 1, expectedVersion + appended.size());
        return List.copyOf(appended);
    }

    @Override
    public List<E> load(String aggregateId) {
        return decode(storedEvents(aggregateId));
    }

    @Override
    public List<E> load(String aggregateId, long fromVersion) {
        return decode(storedEvents(aggregateId).stream()
            .filter(e -> e.version() > fromVersion)
            .collect(Collectors.toList()));
    }

    @Override
    public List<E> loadToVersion(String aggregateId, long toVersion) {
        return decode(storedEvents(aggregateId).stream()
            .filter(e -> e.version() <= toVersion)
            .collect(Collectors.toList()));
    }

    @Override
    public List<StoredEvent> storedEvents(String aggregateId) {
        return streams.getOrDefault(aggregateId, List.of());
    }

    @Override
    public long currentVersion(String aggregateId) {
        return storedEvents(aggregateId).size();
    }

    @Override
    public boolean exists(String aggregateId) {
        return !storedEvents(aggregateId).isEmpty();
    }

    @Override
    public void saveSnapshot(AggregateSnapshot snapshot) {
        long current = currentVersion(snapshot.aggregateId());
        if (snapshot.version() > current) {
            throw new IllegalArgumentException(String.format(
                "Snapshot of %s at version %d is ahead of the stored version %d",
                snapshot.aggregateId(), snapshot.version(), current));
        }
        snapshots.merge(snapshot.aggregateId(), snapshot,
            (existing, candidate) -> candidate.version() >= existing.version() ? candidate : existing);
        log.info("Saved snapshot of {} {} at version {}", snapshot.aggregateKind(), snapshot.aggregateId(), snapshot.version());
    }

    @Override
    public Optional<AggregateSnapshot> loadSnapshot(String aggregateId) {
        return Optional.ofNullable(snapshots.get(aggregateId));
    }

    @Override
    public List<E> eventsSince(Instant timestamp) {
        return decode(allEvents().stream()
            .filter(e -> !e.timestamp().isBefore(timestamp))
            .collect(Collectors.toList()));
    }

    @Override
    public List<E> eventsByKind(String eventKind) {
        return decode(allEvents().stream()
            .filter(e -> e.eventKind().equals(eventKind))
            .collect(Collectors.toList()));
    }

    @Override
    public List<StoredEvent> allEvents() {
        return streams.values().stream()
            .flatMap(List::stream)
            .sorted(BY_TIME)
            .collect(Collectors.toList());
    }

    @Override
    public long eventCount() {
        return streams.values().stream().mapToLong(List::size).sum();
    }

    @Override
    public void clear() {
        streams.clear();
        snapshots.clear();
        log.info("Event store cleared");
    }

    private List<E> decode(List<StoredEvent> stored) {
        return stored.stream().map(codec::decode).collect(Collectors.toList());
    }
}
