package com.arrangement.engine.persistence;

import com.arrangement.core.event.ClipAdded;
import com.arrangement.core.event.TrackCreated;
import com.arrangement.core.event.TrackEvent;
import com.arrangement.core.event.TrackEventKind;
import com.arrangement.core.event.TrackMetadataUpdated;
import com.arrangement.core.exception.ConcurrencyConflictException;
import com.arrangement.core.model.TrackType;
import com.arrangement.core.store.AggregateSnapshot;
import com.arrangement.core.store.StoredEvent;
import com.arrangement.engine.test.TimeController;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

import static com.arrangement.engine.test.EngineFixtures.OWNER;
import static com.arrangement.engine.test.EngineFixtures.midiClip;
import static com.arrangement.engine.test.EngineFixtures.named;
import static com.arrangement.engine.test.EngineFixtures.newStore;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

@DisplayName("In-memory event store")
class InMemoryEventStoreTest {

    private TimeController time;
    private InMemoryEventStore<TrackEvent> store;

    @BeforeEach
    void setUp() {
        time = new TimeController();
        store = newStore(time);
    }

    // ========== Versioning ==========

    @Test
    @DisplayName("Appends assign contiguous versions starting at 1")
    void testMonotonicVersioning() {
        store.append("t1", List.of(created("t1")), 0);
        store.append("t1", List.of(rename("t1", "A"), rename("t1", "B")), 1);
        store.append("t1", List.of(rename("t1", "C")), 3);

        List<StoredEvent> stored = store.storedEvents("t1");

        assertThat(stored).extracting(StoredEvent::version).containsExactly(1L, 2L, 3L, 4L);
        assertThat(store.load("t1")).hasSize(4);
        assertEquals(4, store.currentVersion("t1"));
    }

    @Test
    @DisplayName("Append returns the stored records in list order")
    void testAppendReturnsStoredRecords() {
        store.append("t1", List.of(created("t1")), 0);

        List<StoredEvent> appended = store.append("t1", List.of(rename("t1", "A"), rename("t1", "B")), 1);

        assertThat(appended).extracting(StoredEvent::version).containsExactly(2L, 3L);
        assertThat(appended).allSatisfy(e -> {
            assertThat(e.eventKind()).isEqualTo(TrackEventKind.TRACK_METADATA_UPDATED.eventName());
            assertThat(e.metadata()).containsKey(StoredEvent.META_OCCURRED_AT);
        });
    }

    @Test
    @DisplayName("Stale expected version is rejected without changing the stream")
    void testConcurrencyGuard() {
        store.append("t1", List.of(created("t1")), 0);
        store.append("t1", List.of(rename("t1", "A")), 1);

        assertThatThrownBy(() -> store.append("t1", List.of(rename("t1", "B"), rename("t1", "C")), 1))
            .isInstanceOf(ConcurrencyConflictException.class)
            .satisfies(e -> {
                ConcurrencyConflictException conflict = (ConcurrencyConflictException) e;
                assertThat(conflict.getExpectedVersion()).isEqualTo(1);
                assertThat(conflict.getActualVersion()).isEqualTo(2);
                assertThat(conflict.isRetryable()).isTrue();
            });

        assertEquals(2, store.currentVersion("t1"));
        assertThat(store.load("t1")).hasSize(2);
    }

    @Test
    @DisplayName("Expected version ahead of the stream is also a conflict")
    void testExpectedVersionAhead() {
        assertThatThrownBy(() -> store.append("t1", List.of(created("t1")), 3))
            .isInstanceOf(ConcurrencyConflictException.class);

        assertThat(store.exists("t1")).isFalse();
    }

    @Test
    @DisplayName("Appending nothing still checks the expected version")
    void testEmptyAppend() {
        store.append("t1", List.of(created("t1")), 0);

        assertThat(store.append("t1", List.of(), 1)).isEmpty();
        assertThatThrownBy(() -> store.append("t1", List.of(), 0))
            .isInstanceOf(ConcurrencyConflictException.class);
    }

    // ========== Loading ==========

    @Test
    @DisplayName("Load from a version excludes it; load to a version includes it")
    void testVersionBounds() {
        store.append("t1", List.of(created("t1"), rename("t1", "A"), rename("t1", "B"), rename("t1", "C")), 0);

        List<TrackEvent> after2 = store.load("t1", 2);
        List<TrackEvent> upTo2 = store.loadToVersion("t1", 2);

        assertThat(after2).extracting(e -> ((TrackMetadataUpdated) e).metadata().name()).containsExactly("B", "C");
        assertThat(upTo2).hasSize(2);
        assertThat(upTo2.get(0)).isInstanceOf(TrackCreated.class);
    }

    @Test
    @DisplayName("Unknown aggregate loads as empty at version 0")
    void testUnknownAggregate() {
        assertThat(store.load("missing")).isEmpty();
        assertThat(store.exists("missing")).isFalse();
        assertEquals(0, store.currentVersion("missing"));
    }

    @Test
    @DisplayName("Decoded events equal the appended ones")
    void testPayloadRoundTrip() {
        TrackEvent added = new ClipAdded("t1", time.instant(), midiClip("c1", 0, 4000));
        store.append("t1", List.of(created("t1"), added), 0);

        assertThat(store.load("t1").get(1)).isEqualTo(added);
    }

    // ========== Snapshots ==========

    @Test
    @DisplayName("Latest snapshot wins and an older one does not replace it")
    void testSnapshotKeepsHighestVersion() {
        store.append("t1", List.of(created("t1"), rename("t1", "A"), rename("t1", "B")), 0);

        store.saveSnapshot(snapshot("t1", 3));
        store.saveSnapshot(snapshot("t1", 1));

        assertThat(store.loadSnapshot("t1")).get().extracting(AggregateSnapshot::version).isEqualTo(3L);
    }

    @Test
    @DisplayName("Snapshot ahead of the stream is rejected")
    void testSnapshotAheadRejected() {
        store.append("t1", List.of(created("t1")), 0);

        assertThatThrownBy(() -> store.saveSnapshot(snapshot("t1", 2)))
            .isInstanceOf(IllegalArgumentException.class);
        assertThat(store.loadSnapshot("t1")).isEmpty();
    }

    // ========== Scans ==========

    @Test
    @DisplayName("Events since a timestamp span aggregates in time order")
    void testEventsSince() {
        store.append("t1", List.of(created("t1")), 0);
        time.advanceSeconds(10);
        Instant cutoff = time.instant();
        store.append("t2", List.of(created("t2")), 0);
        time.advanceSeconds(10);
        store.append("t1", List.of(rename("t1", "A")), 1);

        List<TrackEvent> since = store.eventsSince(cutoff);

        assertThat(since).extracting(TrackEvent::aggregateId).containsExactly("t2", "t1");
        assertThat(since.get(1)).isInstanceOf(TrackMetadataUpdated.class);
    }

    @Test
    @DisplayName("Events by kind filter across aggregates")
    void testEventsByKind() {
        store.append("t1", List.of(created("t1"), rename("t1", "A")), 0);
        store.append("t2", List.of(created("t2")), 0);

        List<TrackEvent> created = store.eventsByKind(TrackEventKind.TRACK_CREATED.eventName());

        assertThat(created.stream().map(TrackEvent::aggregateId).collect(Collectors.toSet()))
            .containsExactlyInAnyOrder("t1", "t2");
        assertEquals(3, store.eventCount());
    }

    @Test
    @DisplayName("Clear drops streams and snapshots")
    void testClear() {
        store.append("t1", List.of(created("t1")), 0);
        store.saveSnapshot(snapshot("t1", 1));

        store.clear();

        assertEquals(0, store.eventCount());
        assertThat(store.allEvents()).isEmpty();
        assertThat(store.loadSnapshot("t1")).isEmpty();
    }

    // ========== Helpers ==========

    private TrackEvent created(String trackId) {
        return new TrackCreated(trackId, time.instant(), OWNER, TrackType.INSTRUMENT, named("Keys"), List.of());
    }

    private TrackEvent rename(String trackId, String name) {
        return new TrackMetadataUpdated(trackId, time.instant(), named("Keys"), named(name));
    }

    private AggregateSnapshot snapshot(String trackId, long version) {
        return new AggregateSnapshot(trackId, "Track", version, JsonNodeFactory.instance.objectNode(), time.instant());
    }
}
