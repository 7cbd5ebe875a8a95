package com.arrangement.engine.query;

import com.arrangement.core.model.TrackState;
import com.arrangement.core.model.TrackType;
import com.arrangement.engine.history.TrackHistory;
import com.arrangement.engine.undo.UndoRedoStatus;

import java.util.List;

/**
 * Read-only requests about tracks.
 */
public final class TrackQueries {

    private TrackQueries() {
    }

    public record GetTrack(String trackId) implements Query<TrackState> {}

    public record GetTrackAtVersion(String trackId, long version) implements Query<TrackState> {}

    public record GetTracksByOwner(String ownerId) implements Query<List<TrackState>> {}

    public record GetTracksByType(TrackType trackType) implements Query<List<TrackState>> {}

    public record GetUndoRedoStatus(String trackId) implements Query<UndoRedoStatus> {}

    public record GetTrackHistory(String trackId) implements Query<TrackHistory> {}
}
