package com.arrangement.core.event;

import java.util.Optional;

/**
 * Closed set of track event variants and the stable names they are stored under.
 */
public enum TrackEventKind {
    TRACK_CREATED("TrackCreated", TrackCreated.class),
    TRACK_METADATA_UPDATED("TrackMetadataUpdated", TrackMetadataUpdated.class),
    CLIP_ADDED("ClipAdded", ClipAdded.class),
    CLIP_REMOVED("ClipRemoved", ClipRemoved.class),
    CLIP_MOVED("ClipMoved", ClipMoved.class),
    MIDI_NOTE_ADDED("MidiNoteAdded", MidiNoteAdded.class),
    MIDI_NOTE_REMOVED("MidiNoteRemoved", MidiNoteRemoved.class),
    MIDI_NOTE_UPDATED("MidiNoteUpdated", MidiNoteUpdated.class),
    MIDI_CLIP_QUANTIZED("MidiClipQuantized", MidiClipQuantized.class),
    MIDI_CLIP_TRANSPOSED("MidiClipTransposed", MidiClipTransposed.class),
    MIDI_CLIP_NOTES_REPLACED("MidiClipNotesReplaced", MidiClipNotesReplaced.class),
    AUDIO_CLIP_GAIN_CHANGED("AudioClipGainChanged", AudioClipGainChanged.class),
    UNRECOGNIZED("Unrecognized", UnrecognizedEvent.class);

    private final String eventName;
    private final Class<? extends TrackEvent> eventClass;

    TrackEventKind(String eventName, Class<? extends TrackEvent> eventClass) {
        this.eventName = eventName;
        this.eventClass = eventClass;
    }

    public String eventName() {
        return eventName;
    }

    public Class<? extends TrackEvent> eventClass() {
        return eventClass;
    }

    /**
     * Resolve a stored name. {@link #UNRECOGNIZED} is never returned; it has no stored form of its own.
     */
    public static Optional<TrackEventKind> fromEventName(String eventName) {
        for (TrackEventKind kind : values()) {
            if (kind != UNRECOGNIZED && kind.eventName.equals(eventName)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
