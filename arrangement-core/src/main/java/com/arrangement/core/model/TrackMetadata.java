package com.arrangement.core.model;

import com.arrangement.core.exception.InvariantViolationException;

/**
 * Mixer-facing track settings. Volume is 0..2, pan is -1..1.
 */
public record TrackMetadata(String name, double volume, double pan, boolean muted, boolean solo) {

    public TrackMetadata {
        if (name == null || name.isBlank()) {
            throw new InvariantViolationException(InvariantViolationException.INVALID_METADATA,
                "Track name cannot be empty");
        }
        if (volume < 0 || volume > 2) {
            throw new InvariantViolationException(InvariantViolationException.INVALID_METADATA,
                String.format("Volume must be between 0 and 2, got %s", volume));
        }
        if (pan < -1 || pan > 1) {
            throw new InvariantViolationException(InvariantViolationException.INVALID_METADATA,
                String.format("Pan must be between -1 and 1, got %s", pan));
        }
    }

    public static TrackMetadata named(String name) {
        return new TrackMetadata(name, 1.0, 0.0, false, false);
    }

    public TrackMetadata withName(String newName) {
        return new TrackMetadata(newName, volume, pan, muted, solo);
    }

    public TrackMetadata withVolume(double newVolume) {
        return new TrackMetadata(name, newVolume, pan, muted, solo);
    }

    public TrackMetadata withMuted(boolean newMuted) {
        return new TrackMetadata(name, volume, pan, newMuted, solo);
    }
}
