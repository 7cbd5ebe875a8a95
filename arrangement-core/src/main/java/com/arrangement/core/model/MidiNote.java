package com.arrangement.core.model;

import com.arrangement.core.exception.InvariantViolationException;

import java.util.Objects;

/**
 * A MIDI note inside a clip. Pitch and velocity are 0..127.
 */
public record MidiNote(String noteId, int pitch, int velocity, TimeRange range) {

    public static final int MIN_VALUE = 0;
    public static final int MAX_VALUE = 127;

    private static final String[] NOTE_NAMES =
        {"C", "C#", "D", "D#", "E", "F", "F#", "G", "G#", "A", "A#", "B"};

    public MidiNote {
        Objects.requireNonNull(noteId, "noteId");
        Objects.requireNonNull(range, "range");
        if (pitch < MIN_VALUE || pitch > MAX_VALUE) {
            throw new InvariantViolationException(InvariantViolationException.INVALID_MIDI_PITCH,
                String.format("MIDI pitch must be between 0 and 127, got %d", pitch));
        }
        if (velocity < MIN_VALUE || velocity > MAX_VALUE) {
            throw new InvariantViolationException(InvariantViolationException.INVALID_MIDI_VELOCITY,
                String.format("MIDI velocity must be between 0 and 127, got %d", velocity));
        }
    }

    public static MidiNote of(String noteId, int pitch, int velocity, double start, double length) {
        return new MidiNote(noteId, pitch, velocity, TimeRange.of(start, length));
    }

    /**
     * Shift pitch, clamping at the MIDI limits. The note keeps its identity.
     */
    public MidiNote transpose(int semitones) {
        int newPitch = Math.max(MIN_VALUE, Math.min(MAX_VALUE, pitch + semitones));
        return new MidiNote(noteId, newPitch, velocity, range);
    }

    /**
     * Snap the start to the nearest grid point, keeping the length.
     */
    public MidiNote quantize(QuantizeValue grid, double bpm) {
        double step = grid.gridMillis(bpm);
        double snapped = Math.round(range.start() / step) * step;
        return new MidiNote(noteId, pitch, velocity, range.withStart(snapped));
    }

    public MidiNote withVelocity(int newVelocity) {
        return new MidiNote(noteId, pitch, newVelocity, range);
    }

    public boolean overlaps(MidiNote other) {
        return pitch == other.pitch && range.intersects(other.range);
    }

    /**
     * Scientific pitch name, e.g. 60 is C4.
     */
    public String noteName() {
        return NOTE_NAMES[pitch % 12] + (pitch / 12 - 1);
    }
}
