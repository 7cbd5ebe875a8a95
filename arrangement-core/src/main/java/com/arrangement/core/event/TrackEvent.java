package com.arrangement.core.event;

import java.time.Instant;
import java.util.Optional;

/**
 * Events raised by the Track aggregate.
 */
public sealed interface TrackEvent extends ReversibleEvent<TrackEvent> permits
    TrackCreated,
    TrackMetadataUpdated,
    ClipAdded,
    ClipRemoved,
    ClipMoved,
    MidiNoteAdded,
    MidiNoteRemoved,
    MidiNoteUpdated,
    MidiClipQuantized,
    MidiClipTransposed,
    MidiClipNotesReplaced,
    AudioClipGainChanged,
    UnrecognizedEvent {

    TrackEventKind kind();

    @Override
    default String eventKind() {
        return kind().eventName();
    }

    @Override
    default boolean undoable() {
        return this instanceof Invertible<?>;
    }

    @Override
    default Optional<TrackEvent> inverseAt(Instant invertedAt) {
        if (this instanceof Invertible<?> invertible) {
            return Optional.of((TrackEvent) invertible.invert(invertedAt));
        }
        return Optional.empty();
    }

    @Override
    TrackEvent withOccurredAt(Instant at);
}
