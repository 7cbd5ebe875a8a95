package com.arrangement.core.model;

/**
 * Kind of track, deciding which clips it may hold.
 */
public enum TrackType {
    INSTRUMENT,
    AUDIO,
    BUS;

    public boolean accepts(ClipType clipType) {
        return switch (this) {
            case INSTRUMENT -> clipType == ClipType.MIDI;
            case AUDIO -> clipType == ClipType.AUDIO;
            case BUS -> false;
        };
    }
}
