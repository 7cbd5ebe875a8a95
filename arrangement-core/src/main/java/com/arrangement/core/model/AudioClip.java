package com.arrangement.core.model;

import com.arrangement.core.exception.InvariantViolationException;

import java.util.Objects;

/**
 * Clip playing a region of an audio source at a fixed gain.
 */
public record AudioClip(
    String clipId,
    TimeRange range,
    AudioSourceRef source,
    ClipMetadata metadata,
    double gain
) implements Clip {

    public static final double DEFAULT_GAIN = 1.0;

    public AudioClip {
        Objects.requireNonNull(clipId, "clipId");
        Objects.requireNonNull(range, "range");
        requireValidGain(gain);
    }

    public static AudioClip of(String clipId, TimeRange range, AudioSourceRef source, String name) {
        return new AudioClip(clipId, range, source, ClipMetadata.named(name), DEFAULT_GAIN);
    }

    public static void requireValidGain(double gain) {
        if (Double.isNaN(gain) || gain < 0) {
            throw new InvariantViolationException(InvariantViolationException.INVALID_GAIN,
                String.format("Gain cannot be negative, got %s", gain));
        }
    }

    @Override
    public ClipType type() {
        return ClipType.AUDIO;
    }

    @Override
    public AudioClip withRange(TimeRange newRange) {
        return new AudioClip(clipId, newRange, source, metadata, gain);
    }

    public AudioClip withGain(double newGain) {
        return new AudioClip(clipId, range, source, metadata, newGain);
    }
}
