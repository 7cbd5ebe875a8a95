package com.arrangement.engine.query.handler;

import com.arrangement.core.aggregate.Track;
import com.arrangement.core.event.TrackEvent;
import com.arrangement.core.exception.ValidationException;
import com.arrangement.core.model.TrackState;
import com.arrangement.engine.history.TrackHistory;
import com.arrangement.engine.history.TrackHistoryService;
import com.arrangement.engine.persistence.EventSourcedTrackRepository;
import com.arrangement.engine.query.QueryHandler;
import com.arrangement.engine.query.TrackQueries.GetTrack;
import com.arrangement.engine.query.TrackQueries.GetTrackAtVersion;
import com.arrangement.engine.query.TrackQueries.GetTrackHistory;
import com.arrangement.engine.query.TrackQueries.GetTracksByOwner;
import com.arrangement.engine.query.TrackQueries.GetTracksByType;
import com.arrangement.engine.query.TrackQueries.GetUndoRedoStatus;
import com.arrangement.engine.undo.UndoRedoService;
import com.arrangement.engine.undo.UndoRedoStatus;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Handlers for {@link com.arrangement.engine.query.TrackQueries}. Every answer is built from a
 * fresh replay; nothing here writes to the store.
 */
public final class TrackQueryHandlers {

    private TrackQueryHandlers() {
    }

    public static class GetTrackHandler implements QueryHandler<GetTrack, TrackState> {

        private final EventSourcedTrackRepository repository;

        public GetTrackHandler(EventSourcedTrackRepository repository) {
            this.repository = repository;
        }

        @Override
        public TrackState handle(GetTrack query) {
            requireId(query.trackId(), "Track ID is required");
            return repository.load(query.trackId()).state();
        }
    }

    public static class GetTrackAtVersionHandler implements QueryHandler<GetTrackAtVersion, TrackState> {

        private final EventSourcedTrackRepository repository;

        public GetTrackAtVersionHandler(EventSourcedTrackRepository repository) {
            this.repository = repository;
        }

        @Override
        public TrackState handle(GetTrackAtVersion query) {
            requireId(query.trackId(), "Track ID is required");
            return repository.loadAtVersion(query.trackId(), query.version()).state();
        }
    }

    public static class GetTracksByOwnerHandler implements QueryHandler<GetTracksByOwner, List<TrackState>> {

        private final EventSourcedTrackRepository repository;

        public GetTracksByOwnerHandler(EventSourcedTrackRepository repository) {
            this.repository = repository;
        }

        @Override
        public List<TrackState> handle(GetTracksByOwner query) {
            requireId(query.ownerId(), "Owner ID is required");
            return states(repository.findByOwner(query.ownerId()));
        }
    }

    public static class GetTracksByTypeHandler implements QueryHandler<GetTracksByType, List<TrackState>> {

        private final EventSourcedTrackRepository repository;

        public GetTracksByTypeHandler(EventSourcedTrackRepository repository) {
            this.repository = repository;
        }

        @Override
        public List<TrackState> handle(GetTracksByType query) {
            if (query.trackType() == null) {
                throw new ValidationException("Track type is required");
            }
            return states(repository.findByType(query.trackType()));
        }
    }

    public static class GetUndoRedoStatusHandler implements QueryHandler<GetUndoRedoStatus, UndoRedoStatus> {

        private final UndoRedoService<TrackEvent> undoRedoService;

        public GetUndoRedoStatusHandler(UndoRedoService<TrackEvent> undoRedoService) {
            this.undoRedoService = undoRedoService;
        }

        @Override
        public UndoRedoStatus handle(GetUndoRedoStatus query) {
            requireId(query.trackId(), "Track ID is required");
            return undoRedoService.status(query.trackId());
        }
    }

    public static class GetTrackHistoryHandler implements QueryHandler<GetTrackHistory, TrackHistory> {

        private final TrackHistoryService historyService;

        public GetTrackHistoryHandler(TrackHistoryService historyService) {
            this.historyService = historyService;
        }

        @Override
        public TrackHistory handle(GetTrackHistory query) {
            requireId(query.trackId(), "Track ID is required");
            return historyService.getHistory(query.trackId());
        }
    }

    private static void requireId(String value, String message) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(message);
        }
    }

    private static List<TrackState> states(List<Track> tracks) {
        return tracks.stream()
            .map(Track::state)
            .collect(Collectors.toList());
    }
}
