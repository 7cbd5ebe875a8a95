package com.arrangement.core.event;

import com.arrangement.core.model.MidiNote;

import java.time.Instant;
import java.util.List;

/**
 * Replaces the whole note collection of a clip. Only produced as the inverse of a
 * destructive operation, and not itself undoable.
 */
public record MidiClipNotesReplaced(String aggregateId, Instant occurredAt, String clipId, List<MidiNote> notes)
    implements TrackEvent {

    public MidiClipNotesReplaced {
        notes = List.copyOf(notes);
    }

    @Override
    public TrackEventKind kind() {
        return TrackEventKind.MIDI_CLIP_NOTES_REPLACED;
    }

    @Override
    public MidiClipNotesReplaced withOccurredAt(Instant at) {
        return new MidiClipNotesReplaced(aggregateId, at, clipId, notes);
    }
}
