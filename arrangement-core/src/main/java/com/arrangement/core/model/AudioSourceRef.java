package com.arrangement.core.model;

import java.util.Objects;

/**
 * Reference to the audio material an audio clip plays.
 */
public record AudioSourceRef(String sourceId, String url) {

    public AudioSourceRef {
        Objects.requireNonNull(sourceId, "sourceId");
    }
}
