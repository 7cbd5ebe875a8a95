package com.arrangement.core.test;

import com.arrangement.core.aggregate.Track;
import com.arrangement.core.model.AudioClip;
import com.arrangement.core.model.AudioSourceRef;
import com.arrangement.core.model.Clip;
import com.arrangement.core.model.InstrumentRef;
import com.arrangement.core.model.MidiClip;
import com.arrangement.core.model.MidiNote;
import com.arrangement.core.model.TimeRange;
import com.arrangement.core.model.TrackMetadata;
import com.arrangement.core.model.TrackType;

import java.time.Clock;
import java.util.List;

/**
 * Builders for tracks, clips and notes used across test classes.
 */
public final class TrackFixtures {

    public static final String OWNER = "user-a";
    public static final String OTHER_USER = "user-b";
    public static final InstrumentRef PIANO = new InstrumentRef("piano", "Grand Piano");

    private TrackFixtures() {
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

    public static Track instrumentTrack(String trackId, Clip... clips) {
        return instrumentTrack(trackId, Clock.systemUTC(), clips);
    }

    public static Track instrumentTrack(String trackId, Clock clock, Clip... clips) {
        return Track.create(trackId, OWNER, TrackType.INSTRUMENT, TrackMetadata.named("Keys"), List.of(clips), clock);
    }

    public static Track audioTrack(String trackId, Clip... clips) {
        return Track.create(trackId, OWNER, TrackType.AUDIO, TrackMetadata.named("Vocals"), List.of(clips),
            Clock.systemUTC());
    }
}
