package com.arrangement.engine.dispatch;

import com.arrangement.core.event.TrackEvent;
import com.arrangement.engine.command.HistoryCommands;
import com.arrangement.engine.command.TrackCommands;
import com.arrangement.engine.command.handler.AddClipHandler;
import com.arrangement.engine.command.handler.AddMidiNoteHandler;
import com.arrangement.engine.command.handler.CreateTrackHandler;
import com.arrangement.engine.command.handler.MoveClipHandler;
import com.arrangement.engine.command.handler.QuantizeMidiClipHandler;
import com.arrangement.engine.command.handler.RemoveClipHandler;
import com.arrangement.engine.command.handler.RemoveMidiNoteHandler;
import com.arrangement.engine.command.handler.SetAudioClipGainHandler;
import com.arrangement.engine.command.handler.TransposeMidiClipHandler;
import com.arrangement.engine.command.handler.UndoRedoCommandHandler;
import com.arrangement.engine.command.handler.UpdateMidiNoteHandler;
import com.arrangement.engine.command.handler.UpdateTrackMetadataHandler;
import com.arrangement.engine.history.TrackHistoryService;
import com.arrangement.engine.persistence.EventSourcedTrackRepository;
import com.arrangement.engine.query.TrackQueries;
import com.arrangement.engine.query.handler.TrackQueryHandlers;
import com.arrangement.engine.undo.UndoRedoService;

import java.time.Clock;

/**
 * Registers every track command and query handler with a mediator.
 */
public final class HandlerRegistrations {

    private HandlerRegistrations() {
    }

    public static void registerAll(ArrangementMediator mediator,
                                   EventSourcedTrackRepository repository,
                                   UndoRedoService<TrackEvent> undoRedoService,
                                   TrackHistoryService historyService,
                                   Clock clock,
                                   double defaultBpm) {
        registerTrackCommands(mediator, repository, undoRedoService, clock, defaultBpm);
        registerHistoryCommands(mediator, undoRedoService);
        registerQueries(mediator, repository, undoRedoService, historyService);
    }

    private static void registerTrackCommands(ArrangementMediator mediator,
                                              EventSourcedTrackRepository repository,
                                              UndoRedoService<TrackEvent> undo,
                                              Clock clock,
                                              double defaultBpm) {
        mediator.registerCommand(TrackCommands.CreateTrack.class, () -> new CreateTrackHandler(repository, undo, clock));
        mediator.registerCommand(TrackCommands.AddClip.class, () -> new AddClipHandler(repository, undo));
        mediator.registerCommand(TrackCommands.RemoveClip.class, () -> new RemoveClipHandler(repository, undo));
        mediator.registerCommand(TrackCommands.MoveClip.class, () -> new MoveClipHandler(repository, undo));
        mediator.registerCommand(TrackCommands.UpdateTrackMetadata.class,
            () -> new UpdateTrackMetadataHandler(repository, undo));
        mediator.registerCommand(TrackCommands.AddMidiNote.class, () -> new AddMidiNoteHandler(repository, undo));
        mediator.registerCommand(TrackCommands.RemoveMidiNote.class, () -> new RemoveMidiNoteHandler(repository, undo));
        mediator.registerCommand(TrackCommands.UpdateMidiNote.class, () -> new UpdateMidiNoteHandler(repository, undo));
        mediator.registerCommand(TrackCommands.QuantizeMidiClip.class,
            () -> new QuantizeMidiClipHandler(repository, undo, defaultBpm));
        mediator.registerCommand(TrackCommands.TransposeMidiClip.class,
            () -> new TransposeMidiClipHandler(repository, undo));
        mediator.registerCommand(TrackCommands.SetAudioClipGain.class,
            () -> new SetAudioClipGainHandler(repository, undo));
    }

    private static void registerHistoryCommands(ArrangementMediator mediator, UndoRedoService<TrackEvent> undo) {
        mediator.registerCommand(HistoryCommands.Undo.class, () -> new UndoRedoCommandHandler.UndoHandler(undo));
        mediator.registerCommand(HistoryCommands.Redo.class, () -> new UndoRedoCommandHandler.RedoHandler(undo));
        mediator.registerCommand(HistoryCommands.BatchUndo.class,
            () -> new UndoRedoCommandHandler.BatchUndoHandler(undo));
        mediator.registerCommand(HistoryCommands.BatchRedo.class,
            () -> new UndoRedoCommandHandler.BatchRedoHandler(undo));
        mediator.registerCommand(HistoryCommands.ClearHistory.class,
            () -> new UndoRedoCommandHandler.ClearHistoryHandler(undo));
    }

    private static void registerQueries(ArrangementMediator mediator,
                                        EventSourcedTrackRepository repository,
                                        UndoRedoService<TrackEvent> undo,
                                        TrackHistoryService historyService) {
        mediator.registerQuery(TrackQueries.GetTrack.class,
            () -> new TrackQueryHandlers.GetTrackHandler(repository));
        mediator.registerQuery(TrackQueries.GetTrackAtVersion.class,
            () -> new TrackQueryHandlers.GetTrackAtVersionHandler(repository));
        mediator.registerQuery(TrackQueries.GetTracksByOwner.class,
            () -> new TrackQueryHandlers.GetTracksByOwnerHandler(repository));
        mediator.registerQuery(TrackQueries.GetTracksByType.class,
            () -> new TrackQueryHandlers.GetTracksByTypeHandler(repository));
        mediator.registerQuery(TrackQueries.GetUndoRedoStatus.class,
            () -> new TrackQueryHandlers.GetUndoRedoStatusHandler(undo));
        mediator.registerQuery(TrackQueries.GetTrackHistory.class,
            () -> new TrackQueryHandlers.GetTrackHistoryHandler(historyService));
    }
}
