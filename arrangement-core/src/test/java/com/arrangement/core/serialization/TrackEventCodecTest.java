package com.arrangement.core.serialization;

import com.arrangement.core.aggregate.Track;
import com.arrangement.core.event.TrackEvent;
import com.arrangement.core.event.UnrecognizedEvent;
import com.arrangement.core.exception.EventSerializationException;
import com.arrangement.core.model.QuantizeValue;
import com.arrangement.core.store.StoredEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.arrangement.core.test.TrackFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TrackEventCodecTest {

    private TrackEventCodec codec;

    @BeforeEach
    void setUp() {
        codec = new TrackEventCodec(JsonSupport.newObjectMapper());
    }

    @Test
    void decode_shouldRebuildEqualEventsForEveryKindATrackRaises() {
        Track track = instrumentTrack("t1", midiClip("c1", 0, 4000));
        track.addMidiNote("c1", note("n1", 60, 130, 500));
        track.updateMidiNote("c1", note("n1", 62, 130, 500));
        track.quantizeMidiClip("c1", QuantizeValue.EIGHTH, 120);
        track.transposeMidiClip("c1", -3);
        track.addClip(midiClip("c2", 5000, 1000));
        track.moveClip("c2", com.arrangement.core.model.TimeRange.of(6000, 1000));
        track.removeClip("c2");
        track.updateMetadata(track.getMetadata().withVolume(0.5));
        track.removeMidiNote("c1", "n1");

        List<TrackEvent> decoded = new ArrayList<>();
        long version = 1;
        for (TrackEvent event : track.getUncommittedEvents()) {
            decoded.add(codec.decode(stored(event.eventKind(), codec.encode(event), version++)));
        }

        assertThat(decoded).isEqualTo(track.getUncommittedEvents());
        assertThat(Track.fromHistory("t1", decoded).state()).isEqualTo(track.state());
    }

    @Test
    void decode_shouldKeepUnknownKindsAsUnrecognizedEvents() {
        TrackEvent decoded = codec.decode(stored("TrackArchived", "{\"reason\":\"cleanup\"}", 3));

        assertThat(decoded).isInstanceOfSatisfying(UnrecognizedEvent.class, e -> {
            assertThat(e.eventKind()).isEqualTo("TrackArchived");
            assertThat(e.payload().get("reason").asText()).isEqualTo("cleanup");
        });
        assertThat(codec.encode(decoded)).isEqualTo("{\"reason\":\"cleanup\"}");
    }

    @Test
    void decode_shouldReportCorruptPayloads() {
        assertThatThrownBy(() -> codec.decode(stored("MidiNoteAdded", "{not json", 2)))
            .isInstanceOf(EventSerializationException.class)
            .hasMessageContaining("version 2 of t1");
    }

    private static StoredEvent stored(String kind, String payload, long version) {
        return new StoredEvent("e" + version, "t1", kind, payload, version, Instant.now(), Map.of());
    }
}
