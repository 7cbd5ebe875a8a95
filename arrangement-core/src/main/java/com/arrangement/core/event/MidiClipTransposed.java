package com.arrangement.core.event;

import com.arrangement.core.model.MidiNote;

import java.time.Instant;
import java.util.List;

public record MidiClipTransposed(
    String aggregateId,
    Instant occurredAt,
    String clipId,
    int semitones,
    List<MidiNote> originalNotes,
    List<MidiNote> transposedNotes
) implements TrackEvent, Invertible<TrackEvent> {

    public MidiClipTransposed {
        originalNotes = List.copyOf(originalNotes);
        transposedNotes = List.copyOf(transposedNotes);
    }

    @Override
    public TrackEventKind kind() {
        return TrackEventKind.MIDI_CLIP_TRANSPOSED;
    }

    /**
     * Clamping at the MIDI limits makes transpose lossy, so the inverse restores the originals.
     */
    @Override
    public TrackEvent invert(Instant invertedAt) {
        return new MidiClipNotesReplaced(aggregateId, invertedAt, clipId, originalNotes);
    }

    @Override
    public MidiClipTransposed withOccurredAt(Instant at) {
        return new MidiClipTransposed(aggregateId, at, clipId, semitones, originalNotes, transposedNotes);
    }
}
