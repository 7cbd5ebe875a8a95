package com.arrangement.engine.persistence;

import com.arrangement.core.aggregate.Track;
import com.arrangement.core.event.TrackCreated;
import com.arrangement.core.event.TrackEvent;
import com.arrangement.core.event.TrackEventKind;
import com.arrangement.core.exception.NotFoundException;
import com.arrangement.core.exception.ValidationException;
import com.arrangement.core.model.TrackState;
import com.arrangement.core.model.TrackType;
import com.arrangement.core.store.AggregateSnapshot;
import com.arrangement.core.store.EventStore;
import com.arrangement.core.store.StoredEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Loads tracks by replaying their events and saves them by appending what they raised.
 * There is no cached aggregate: every load returns a fresh instance.
 */
@Repository
public class EventSourcedTrackRepository {

    private static final Logger log = LoggerFactory.getLogger(EventSourcedTrackRepository.class);

    public static final String AGGREGATE_KIND = "Track";

    private final EventStore<TrackEvent> eventStore;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final int snapshotInterval;

    public EventSourcedTrackRepository(EventStore<TrackEvent> eventStore, ObjectMapper objectMapper,
                                       Clock clock, int snapshotInterval) {
        this.eventStore = eventStore;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.snapshotInterval = snapshotInterval;
    }

    public Optional<Track> find(String trackId) {
        Optional<AggregateSnapshot> snapshot = eventStore.loadSnapshot(trackId);
        if (snapshot.isPresent()) {
            Optional<TrackState> state = readSnapshot(snapshot.get());
            if (state.isPresent()) {
                List<TrackEvent> tail = eventStore.load(trackId, snapshot.get().version());
                log.debug("Loading track {} from snapshot at version {} plus {} event(s)",
                    trackId, snapshot.get().version(), tail.size());
                return Optional.of(Track.fromSnapshot(state.get(), snapshot.get().version(), tail, clock));
            }
        }

        List<TrackEvent> events = eventStore.load(trackId);
        if (events.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(Track.fromHistory(trackId, events, clock));
    }

    public Track load(String trackId) {
        return find(trackId).orElseThrow(() -> new NotFoundException(AGGREGATE_KIND, trackId));
    }

    public boolean exists(String trackId) {
        return eventStore.exists(trackId);
    }

    /**
     * Reconstruct the track as it was right after the given version was stored.
     */
    public Track loadAtVersion(String trackId, long version) {
        if (version < 1) {
            throw new ValidationException("Version must be at least 1, got " + version);
        }
        List<TrackEvent> events = eventStore.loadToVersion(trackId, version);
        if (events.isEmpty()) {
            throw new NotFoundException(AGGREGATE_KIND, trackId);
        }
        return Track.fromHistory(trackId, events, clock);
    }

    /**
     * Append the track's uncommitted events using its pre-operation version as the expected version.
     *
     * @return the stored records, one per raised event and in the same order
     * @throws com.arrangement.core.exception.ConcurrencyConflictException if the log moved on since load
     */
    public List<StoredEvent> save(Track track) {
        if (!track.hasUncommittedEvents()) {
            return List.of();
        }
        long expectedVersion = track.getCommittedVersion();
        List<StoredEvent> stored = eventStore.append(track.getId(), track.getUncommittedEvents(), expectedVersion);
        track.markEventsAsCommitted();

        if (crossesSnapshotBoundary(expectedVersion, track.getVersion())) {
            saveSnapshot(track);
        }
        return stored;
    }

    public AggregateSnapshot saveSnapshot(Track track) {
        if (track.hasUncommittedEvents()) {
            throw new IllegalStateException("Cannot snapshot track " + track.getId() + " with unsaved events");
        }
        AggregateSnapshot snapshot = new AggregateSnapshot(
            track.getId(),
            AGGREGATE_KIND,
            track.getVersion(),
            objectMapper.valueToTree(track.state()),
            clock.instant()
        );
        eventStore.saveSnapshot(snapshot);
        return snapshot;
    }

    /**
     * Tracks are never deleted: their event logs are append-only.
     */
    public void delete(String trackId) {
        throw new UnsupportedOperationException(
            "Track " + trackId + " cannot be deleted: event logs are append-only");
    }

    // ========== Scan queries ==========

    public List<Track> findByOwner(String ownerId) {
        return findCreated(created -> created.ownerId().equals(ownerId));
    }

    public List<Track> findByType(TrackType trackType) {
        return findCreated(created -> created.trackType() == trackType);
    }

    public List<Track> findWithClips() {
        return findCreated(created -> true).stream()
            .filter(Track::hasClips)
            .collect(Collectors.toList());
    }

    public List<Track> findEmpty() {
        return findCreated(created -> true).stream()
            .filter(Track::isEmpty)
            .collect(Collectors.toList());
    }

    // TODO: maintain an owner/type index on append once the store has more than a handful of tracks
    private List<Track> findCreated(Predicate<TrackCreated> filter) {
        return eventStore.eventsByKind(TrackEventKind.TRACK_CREATED.eventName()).stream()
            .map(TrackCreated.class::cast)
            .filter(filter)
            .map(TrackCreated::aggregateId)
            .distinct()
            .map(this::find)
            .flatMap(Optional::stream)
            .collect(Collectors.toList());
    }

    private boolean crossesSnapshotBoundary(long fromVersion, long toVersion) {
        return snapshotInterval > 0 && toVersion / snapshotInterval > fromVersion / snapshotInterval;
    }

    private Optional<TrackState> readSnapshot(AggregateSnapshot snapshot) {
        try {
            return Optional.of(objectMapper.treeToValue(snapshot.data(), TrackState.class));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            // Snapshots are advisory; a full replay gives the same state.
            log.warn("Ignoring unreadable snapshot of track {} at version {}: {}",
                snapshot.aggregateId(), snapshot.version(), e.getMessage());
            return Optional.empty();
        }
    }
}
