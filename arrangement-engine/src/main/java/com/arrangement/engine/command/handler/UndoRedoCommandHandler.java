package com.arrangement.engine.command.handler;

import com.arrangement.core.event.TrackEvent;
import com.arrangement.core.exception.ConcurrencyConflictException;
import com.arrangement.core.exception.ValidationException;
import com.arrangement.engine.command.CommandContext;
import com.arrangement.engine.command.CommandHandler;
import com.arrangement.engine.command.CommandResult;
import com.arrangement.engine.command.HistoryCommands.BatchRedo;
import com.arrangement.engine.command.HistoryCommands.BatchUndo;
import com.arrangement.engine.command.HistoryCommands.ClearHistory;
import com.arrangement.engine.command.HistoryCommands.Redo;
import com.arrangement.engine.command.HistoryCommands.Undo;
import com.arrangement.engine.command.TrackCommand;
import com.arrangement.engine.undo.UndoRedoResult;
import com.arrangement.engine.undo.UndoRedoService;

import java.util.ArrayList;
import java.util.List;

/**
 * Handlers for the undo/redo commands. They go straight to the {@link UndoRedoService}, which
 * appends inverse or original events itself, so no aggregate is loaded here.
 */
public final class UndoRedoCommandHandler {

    private UndoRedoCommandHandler() {
    }

    public static class UndoHandler implements CommandHandler<Undo, Long> {

        private final UndoRedoService<TrackEvent> undoRedoService;

        public UndoHandler(UndoRedoService<TrackEvent> undoRedoService) {
            this.undoRedoService = undoRedoService;
        }

        @Override
        public CommandResult<Long> handle(Undo command, CommandContext context) {
            validate(command, context, null);
            return toCommandResult(undoRedoService.undo(command.trackId(), context.userId()), 0);
        }
    }

    public static class RedoHandler implements CommandHandler<Redo, Long> {

        private final UndoRedoService<TrackEvent> undoRedoService;

        public RedoHandler(UndoRedoService<TrackEvent> undoRedoService) {
            this.undoRedoService = undoRedoService;
        }

        @Override
        public CommandResult<Long> handle(Redo command, CommandContext context) {
            validate(command, context, null);
            UndoRedoResult<TrackEvent> result = undoRedoService.redo(command.trackId(), context.userId());
            return toCommandResult(result, result.eventsApplied().size());
        }
    }

    public static class BatchUndoHandler implements CommandHandler<BatchUndo, Long> {

        private final UndoRedoService<TrackEvent> undoRedoService;

        public BatchUndoHandler(UndoRedoService<TrackEvent> undoRedoService) {
            this.undoRedoService = undoRedoService;
        }

        @Override
        public CommandResult<Long> handle(BatchUndo command, CommandContext context) {
            validate(command, context, command.count());
            UndoRedoResult<TrackEvent> result =
                undoRedoService.batchUndo(command.trackId(), command.count(), context.userId());
            return toCommandResult(result, 0);
        }
    }

    public static class BatchRedoHandler implements CommandHandler<BatchRedo, Long> {

        private final UndoRedoService<TrackEvent> undoRedoService;

        public BatchRedoHandler(UndoRedoService<TrackEvent> undoRedoService) {
            this.undoRedoService = undoRedoService;
        }

        @Override
        public CommandResult<Long> handle(BatchRedo command, CommandContext context) {
            validate(command, context, command.count());
            UndoRedoResult<TrackEvent> result =
                undoRedoService.batchRedo(command.trackId(), command.count(), context.userId());
            return toCommandResult(result, result.eventsApplied().size());
        }
    }

    public static class ClearHistoryHandler implements CommandHandler<ClearHistory, Void> {

        private final UndoRedoService<TrackEvent> undoRedoService;

        public ClearHistoryHandler(UndoRedoService<TrackEvent> undoRedoService) {
            this.undoRedoService = undoRedoService;
        }

        @Override
        public CommandResult<Void> handle(ClearHistory command, CommandContext context) {
            validate(command, context, null);
            undoRedoService.clearHistory(command.trackId());
            return CommandResult.success(null, 0, 0);
        }
    }

    private static void validate(TrackCommand<?> command, CommandContext context, Integer count) {
        List<String> errors = new ArrayList<>();
        if (command.trackId() == null || command.trackId().isBlank()) {
            errors.add("Track ID is required");
        }
        if (context == null || context.userId() == null || context.userId().isBlank()) {
            errors.add("User ID is required");
        }
        if (count != null && count < 1) {
            errors.add("Count must be positive");
        }
        if (!errors.isEmpty()) {
            throw new ValidationException(errors);
        }
    }

    /**
     * Redo moves entries back onto the undo stack, which is reported as undoable events recorded.
     */
    private static CommandResult<Long> toCommandResult(UndoRedoResult<TrackEvent> result, int returnedToUndoStack) {
        if (!result.success()) {
            boolean retryable = ConcurrencyConflictException.ERROR_CODE.equals(result.errorCode());
            return CommandResult.failure(result.errorCode(), result.error(), retryable);
        }
        return CommandResult.success(result.newVersion(), result.eventsApplied().size(), returnedToUndoStack);
    }
}
