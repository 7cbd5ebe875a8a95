package com.arrangement.engine.command;

import com.arrangement.core.model.Clip;
import com.arrangement.core.model.MidiNote;
import com.arrangement.core.model.QuantizeValue;
import com.arrangement.core.model.TimeRange;
import com.arrangement.core.model.TrackMetadata;
import com.arrangement.core.model.TrackType;

import java.util.List;
import java.util.UUID;

/**
 * Commands that change a track. Every command except {@link CreateTrack} answers with the
 * track version after the change.
 */
public final class TrackCommands {

    private TrackCommands() {
    }

    public record CreateTrack(
        String trackId,
        String ownerId,
        TrackType trackType,
        TrackMetadata metadata,
        List<Clip> initialClips
    ) implements TrackCommand<String> {

        public CreateTrack {
            initialClips = initialClips == null ? List.of() : List.copyOf(initialClips);
        }

        public static CreateTrack of(String ownerId, TrackType trackType, String name) {
            return new CreateTrack(UUID.randomUUID().toString(), ownerId, trackType, TrackMetadata.named(name), List.of());
        }
    }

    public record AddClip(String trackId, Clip clip) implements TrackCommand<Long> {}

    public record RemoveClip(String trackId, String clipId) implements TrackCommand<Long> {}

    public record MoveClip(String trackId, String clipId, TimeRange newRange) implements TrackCommand<Long> {}

    public record UpdateTrackMetadata(String trackId, TrackMetadata metadata) implements TrackCommand<Long> {}

    public record AddMidiNote(String trackId, String clipId, MidiNote note) implements TrackCommand<Long> {}

    public record RemoveMidiNote(String trackId, String clipId, String noteId) implements TrackCommand<Long> {}

    public record UpdateMidiNote(String trackId, String clipId, MidiNote note) implements TrackCommand<Long> {}

    /**
     * @param bpm tempo for the grid, or null for the configured default
     */
    public record QuantizeMidiClip(String trackId, String clipId, QuantizeValue quantizeValue, Double bpm)
        implements TrackCommand<Long> {}

    public record TransposeMidiClip(String trackId, String clipId, int semitones) implements TrackCommand<Long> {}

    public record SetAudioClipGain(String trackId, String clipId, double gain) implements TrackCommand<Long> {}
}
