package com.arrangement.core.model;

public enum ClipType {
    MIDI,
    AUDIO
}
