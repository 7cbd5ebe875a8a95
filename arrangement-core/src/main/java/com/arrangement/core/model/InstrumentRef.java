package com.arrangement.core.model;

import java.util.Objects;

/**
 * Reference to the instrument a MIDI clip plays through.
 */
public record InstrumentRef(String instrumentId, String name) {

    public InstrumentRef {
        Objects.requireNonNull(instrumentId, "instrumentId");
    }
}
