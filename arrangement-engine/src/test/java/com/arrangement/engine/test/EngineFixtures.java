package com.arrangement.engine.test;

import com.arrangement.core.event.TrackEvent;
import com.arrangement.core.model.AudioClip;
import com.arrangement.core.model.AudioSourceRef;
import com.arrangement.core.model.InstrumentRef;
import com.arrangement.core.model.MidiClip;
import com.arrangement.core.model.MidiNote;
import com.arrangement.core.model.TimeRange;
import com.arrangement.core.model.TrackMetadata;
import com.arrangement.core.serialization.JsonSupport;
import com.arrangement.core.serialization.TrackEventCodec;
import com.arrangement.engine.persistence.InMemoryEventStore;

import java.time.Clock;

/**
 * Shared builders for engine tests.
 */
public final class EngineFixtures {

    public static final String OWNER = "user-a";
    public static final String OTHER_USER = "user-b";
    public static final InstrumentRef PIANO = new InstrumentRef("piano", "Grand Piano");

    private EngineFixtures() {
    }

    public static InMemoryEventStore<TrackEvent> newStore(Clock clock) {
        return new InMemoryEventStore<>(new TrackEventCodec(JsonSupport.newObjectMapper()), clock);
    }

    public static MidiClip midiClip(String clipId, double start, double length) {
        return MidiClip.empty(clipId, TimeRange.of(start, length), PIANO, clipId);
    }

    public static AudioClip audioClip(String clipId, double start, double length) {
        return AudioClip.of(clipId, TimeRange.of(start, length), new AudioSourceRef("src-" + clipId, null), clipId);
    }

    public static MidiNote note(String noteId, int pitch, double start, double length) {
        return MidiNote.of(noteId, pitch, 100, start, length);
    }

    public static TrackMetadata named(String name) {
        return TrackMetadata.named(name);
    }
}
