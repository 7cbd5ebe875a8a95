package com.arrangement.core.event;

import com.arrangement.core.model.MidiNote;

import java.time.Instant;

public record MidiNoteUpdated(
    String aggregateId,
    Instant occurredAt,
    String clipId,
    String noteId,
    MidiNote previousNote,
    MidiNote note
) implements TrackEvent, Invertible<TrackEvent> {

    @Override
    public TrackEventKind kind() {
        return TrackEventKind.MIDI_NOTE_UPDATED;
    }

    @Override
    public TrackEvent invert(Instant invertedAt) {
        return new MidiNoteUpdated(aggregateId, invertedAt, clipId, noteId, note, previousNote);
    }

    @Override
    public MidiNoteUpdated withOccurredAt(Instant at) {
        return new MidiNoteUpdated(aggregateId, at, clipId, noteId, previousNote, note);
    }
}
