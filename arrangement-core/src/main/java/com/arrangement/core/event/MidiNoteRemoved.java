package com.arrangement.core.event;

import com.arrangement.core.model.MidiNote;

import java.time.Instant;

public record MidiNoteRemoved(
    String aggregateId,
    Instant occurredAt,
    String clipId,
    String noteId,
    MidiNote removedNote
) implements TrackEvent, Invertible<TrackEvent> {

    @Override
    public TrackEventKind kind() {
        return TrackEventKind.MIDI_NOTE_REMOVED;
    }

    @Override
    public TrackEvent invert(Instant invertedAt) {
        return new MidiNoteAdded(aggregateId, invertedAt, clipId, removedNote);
    }

    @Override
    public MidiNoteRemoved withOccurredAt(Instant at) {
        return new MidiNoteRemoved(aggregateId, at, clipId, noteId, removedNote);
    }
}
