package com.arrangement.core.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * A region on a track's timeline. Clips are immutable; changes produce new instances.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "clipType")
@JsonSubTypes({
    @JsonSubTypes.Type(value = MidiClip.class, name = "MIDI"),
    @JsonSubTypes.Type(value = AudioClip.class, name = "AUDIO")
})
public sealed interface Clip permits MidiClip, AudioClip {

    String clipId();

    TimeRange range();

    ClipMetadata metadata();

    ClipType type();

    Clip withRange(TimeRange newRange);
}
