package com.arrangement.engine.config;

/**
 * Tunables read from {@code arrangement.properties}.
 *
 * @param snapshotInterval events between automatic snapshots; 0 disables them
 */
public record ArrangementProperties(
    int undoMaxDepth,
    int undoMaxBatch,
    int snapshotInterval,
    double defaultBpm
) {
    public static final int DEFAULT_UNDO_MAX_DEPTH = 50;
    public static final int DEFAULT_UNDO_MAX_BATCH = 50;
    public static final int DEFAULT_SNAPSHOT_INTERVAL = 100;
    public static final double DEFAULT_BPM = 120.0;

    public ArrangementProperties {
        if (undoMaxDepth < 1) {
            throw new IllegalArgumentException("arrangement.undo.max-depth must be positive: " + undoMaxDepth);
        }
        if (undoMaxBatch < 1) {
            throw new IllegalArgumentException("arrangement.undo.max-batch must be positive: " + undoMaxBatch);
        }
        if (snapshotInterval < 0) {
            throw new IllegalArgumentException("arrangement.snapshot.interval cannot be negative: " + snapshotInterval);
        }
        if (!(defaultBpm > 0)) {
            throw new IllegalArgumentException("arrangement.quantize.default-bpm must be positive: " + defaultBpm);
        }
    }

    public static ArrangementProperties defaults() {
        return new ArrangementProperties(DEFAULT_UNDO_MAX_DEPTH, DEFAULT_UNDO_MAX_BATCH,
            DEFAULT_SNAPSHOT_INTERVAL, DEFAULT_BPM);
    }
}
