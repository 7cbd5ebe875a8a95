package com.arrangement.core.store;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * Cached projection of aggregate state at a given version.
 * Advisory only: replay from version 0 must always yield the same state.
 */
public record AggregateSnapshot(
    String aggregateId,
    String aggregateKind,
    long version,
    JsonNode data,
    Instant timestamp
) {}
