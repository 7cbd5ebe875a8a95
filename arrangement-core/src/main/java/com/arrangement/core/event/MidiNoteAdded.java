package com.arrangement.core.event;

import com.arrangement.core.model.MidiNote;

import java.time.Instant;

public record MidiNoteAdded(String aggregateId, Instant occurredAt, String clipId, MidiNote note)
    implements TrackEvent, Invertible<TrackEvent> {

    @Override
    public TrackEventKind kind() {
        return TrackEventKind.MIDI_NOTE_ADDED;
    }

    @Override
    public TrackEvent invert(Instant invertedAt) {
        return new MidiNoteRemoved(aggregateId, invertedAt, clipId, note.noteId(), note);
    }

    @Override
    public MidiNoteAdded withOccurredAt(Instant at) {
        return new MidiNoteAdded(aggregateId, at, clipId, note);
    }
}
