package com.arrangement.core.exception;

/**
 * Thrown by a domain operation when the requested change would break an aggregate invariant.
 * Always raised before any event, so the aggregate is left untouched.
 */
public class InvariantViolationException extends ArrangementException {

    public static final String ERROR_CODE = "INVARIANT_VIOLATION";

    public static final String CLIP_OVERLAP = "CLIP_OVERLAP";
    public static final String CLIP_TYPE_MISMATCH = "CLIP_TYPE_MISMATCH";
    public static final String TRACK_TYPE_MISMATCH = "TRACK_TYPE_MISMATCH";
    public static final String DUPLICATE_CLIP = "DUPLICATE_CLIP";
    public static final String DUPLICATE_NOTE = "DUPLICATE_NOTE";
    public static final String NOTE_OVERLAP = "NOTE_OVERLAP";
    public static final String NOTE_OUTSIDE_CLIP = "NOTE_OUTSIDE_CLIP";
    public static final String INVALID_MIDI_PITCH = "INVALID_MIDI_PITCH";
    public static final String INVALID_MIDI_VELOCITY = "INVALID_MIDI_VELOCITY";
    public static final String INVALID_RANGE = "INVALID_RANGE";
    public static final String INVALID_GAIN = "INVALID_GAIN";
    public static final String INVALID_METADATA = "INVALID_METADATA";
    public static final String INVALID_ARGUMENT = "INVALID_ARGUMENT";

    private final String violation;

    public InvariantViolationException(String violation, String message) {
        super(ERROR_CODE, message);
        this.violation = violation;
    }

    public static InvariantViolationException clipOverlap(String clipId, String existingClipId) {
        return new InvariantViolationException(CLIP_OVERLAP, String.format(
            "Clip %s overlaps existing clip %s", clipId, existingClipId));
    }

    public static InvariantViolationException clipTypeMismatch(String trackType, String clipType) {
        return new InvariantViolationException(CLIP_TYPE_MISMATCH, String.format(
            "%s clips cannot be placed on %s tracks", clipType, trackType));
    }

    public static InvariantViolationException trackTypeMismatch(String operation, String trackType) {
        return new InvariantViolationException(TRACK_TYPE_MISMATCH, String.format(
            "Operation %s is not supported on %s tracks", operation, trackType));
    }

    /**
     * Reason code narrowing down which invariant was violated.
     */
    public String getViolation() {
        return violation;
    }
}
