package com.arrangement.engine.history;

import com.arrangement.core.aggregate.Track;
import com.arrangement.core.event.TrackEvent;
import com.arrangement.core.exception.NotFoundException;
import com.arrangement.core.exception.ValidationException;
import com.arrangement.core.store.EventStore;
import com.arrangement.core.store.StoredEvent;
import com.arrangement.engine.persistence.EventSourcedTrackRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Service for track history and point-in-time replay.
 *
 * Provides:
 * - Timeline of every stored event with its version and store timestamp
 * - State reconstruction at a version
 * - State reconstruction at a moment in time
 */
@Service
public class TrackHistoryService {

    private static final Logger log = LoggerFactory.getLogger(TrackHistoryService.class);

    private final EventStore<TrackEvent> eventStore;
    private final Clock clock;

    public TrackHistoryService(EventStore<TrackEvent> eventStore, Clock clock) {
        this.eventStore = eventStore;
        this.clock = clock;
    }

    /**
     * Get the full timeline of a track.
     */
    public TrackHistory getHistory(String trackId) {
        List<StoredEvent> stored = eventStore.storedEvents(trackId);
        if (stored.isEmpty()) {
            throw new NotFoundException(EventSourcedTrackRepository.AGGREGATE_KIND, trackId);
        }
        List<TrackEvent> events = eventStore.load(trackId);

        List<HistoryEntry> entries = new ArrayList<>(stored.size());
        for (int i = 0; i < stored.size(); i++) {
            StoredEvent record = stored.get(i);
            entries.add(new HistoryEntry(record.version(), record.eventKind(), record.timestamp(),
                events.get(i).undoable()));
        }

        StoredEvent first = stored.get(0);
        StoredEvent last = stored.get(stored.size() - 1);
        return new TrackHistory(trackId, last.version(), first.timestamp(), last.timestamp(), entries);
    }

    /**
     * Replay a track up to and including the given version.
     */
    public ReplayResult replayToVersion(String trackId, long targetVersion) {
        if (targetVersion < 1) {
            throw new ValidationException("Version must be at least 1, got " + targetVersion);
        }
        log.info("Replaying track {} to version {}", trackId, targetVersion);

        List<StoredEvent> stored = eventStore.storedEvents(trackId);
        if (stored.isEmpty()) {
            throw new NotFoundException(EventSourcedTrackRepository.AGGREGATE_KIND, trackId);
        }
        long version = Math.min(targetVersion, stored.get(stored.size() - 1).version());
        return reconstruct(trackId, stored.get((int) version - 1));
    }

    /**
     * Replay a track with every event stored at or before the given time.
     *
     * @throws NotFoundException if the track had no events yet at that time
     */
    public ReplayResult replayToTimestamp(String trackId, Instant targetTime) {
        log.info("Replaying track {} to timestamp {}", trackId, targetTime);

        StoredEvent lastBefore = null;
        for (StoredEvent record : eventStore.storedEvents(trackId)) {
            if (record.timestamp().isAfter(targetTime)) {
                break;
            }
            lastBefore = record;
        }
        if (lastBefore == null) {
            throw new NotFoundException(EventSourcedTrackRepository.AGGREGATE_KIND, trackId);
        }
        return reconstruct(trackId, lastBefore);
    }

    private ReplayResult reconstruct(String trackId, StoredEvent upTo) {
        List<TrackEvent> events = eventStore.loadToVersion(trackId, upTo.version());
        Track track = Track.fromHistory(trackId, events, clock);
        log.debug("Reconstructed track {} from {} event(s)", trackId, events.size());
        return new ReplayResult(trackId, upTo.version(), upTo.timestamp(), track.state(), events.size());
    }
}
