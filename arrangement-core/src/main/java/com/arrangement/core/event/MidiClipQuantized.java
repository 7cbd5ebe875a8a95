package com.arrangement.core.event;

import com.arrangement.core.model.MidiNote;
import com.arrangement.core.model.QuantizeValue;

import java.time.Instant;
import java.util.List;

/**
 * Quantize applied to every note of a clip. The resulting notes are stored alongside the
 * originals so replay does not depend on the quantize math.
 */
public record MidiClipQuantized(
    String aggregateId,
    Instant occurredAt,
    String clipId,
    QuantizeValue quantizeValue,
    double bpm,
    List<MidiNote> originalNotes,
    List<MidiNote> quantizedNotes
) implements TrackEvent, Invertible<TrackEvent> {

    public MidiClipQuantized {
        originalNotes = List.copyOf(originalNotes);
        quantizedNotes = List.copyOf(quantizedNotes);
    }

    @Override
    public TrackEventKind kind() {
        return TrackEventKind.MIDI_CLIP_QUANTIZED;
    }

    @Override
    public TrackEvent invert(Instant invertedAt) {
        return new MidiClipNotesReplaced(aggregateId, invertedAt, clipId, originalNotes);
    }

    @Override
    public MidiClipQuantized withOccurredAt(Instant at) {
        return new MidiClipQuantized(aggregateId, at, clipId, quantizeValue, bpm, originalNotes, quantizedNotes);
    }
}
