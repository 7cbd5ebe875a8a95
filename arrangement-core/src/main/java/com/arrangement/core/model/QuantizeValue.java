package com.arrangement.core.model;

import com.arrangement.core.exception.InvariantViolationException;

/**
 * Quantize grid expressed as a fraction of a whole note.
 */
public enum QuantizeValue {
    WHOLE("1/1", 1.0),
    HALF("1/2", 1.0 / 2),
    QUARTER("1/4", 1.0 / 4),
    EIGHTH("1/8", 1.0 / 8),
    SIXTEENTH("1/16", 1.0 / 16),
    THIRTY_SECOND("1/32", 1.0 / 32),
    QUARTER_TRIPLET("1/4T", 1.0 / 6),
    EIGHTH_TRIPLET("1/8T", 1.0 / 12),
    SIXTEENTH_TRIPLET("1/16T", 1.0 / 24);

    private final String label;
    private final double fractionOfWhole;

    QuantizeValue(String label, double fractionOfWhole) {
        this.label = label;
        this.fractionOfWhole = fractionOfWhole;
    }

    public String label() {
        return label;
    }

    /**
     * Grid spacing in milliseconds at the given tempo (quarter note = one beat).
     */
    public double gridMillis(double bpm) {
        if (!(bpm > 0)) {
            throw new InvariantViolationException(InvariantViolationException.INVALID_ARGUMENT,
                String.format("Tempo must be positive, got %s", bpm));
        }
        double wholeNoteMillis = 4 * 60_000.0 / bpm;
        return wholeNoteMillis * fractionOfWhole;
    }

    public static QuantizeValue fromLabel(String label) {
        for (QuantizeValue value : values()) {
            if (value.label.equals(label)) {
                return value;
            }
        }
        throw new InvariantViolationException(InvariantViolationException.INVALID_ARGUMENT,
            "Unknown quantize value: " + label);
    }
}
