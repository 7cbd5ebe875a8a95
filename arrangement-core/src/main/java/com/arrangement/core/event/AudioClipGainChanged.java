package com.arrangement.core.event;

import java.time.Instant;

public record AudioClipGainChanged(
    String aggregateId,
    Instant occurredAt,
    String clipId,
    double previousGain,
    double gain
) implements TrackEvent, Invertible<TrackEvent> {

    @Override
    public TrackEventKind kind() {
        return TrackEventKind.AUDIO_CLIP_GAIN_CHANGED;
    }

    @Override
    public TrackEvent invert(Instant invertedAt) {
        return new AudioClipGainChanged(aggregateId, invertedAt, clipId, gain, previousGain);
    }

    @Override
    public AudioClipGainChanged withOccurredAt(Instant at) {
        return new AudioClipGainChanged(aggregateId, at, clipId, previousGain, gain);
    }
}
