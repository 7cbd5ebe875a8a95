package com.arrangement.engine.command;

/**
 * Undo/redo commands. The acting user comes from the {@link CommandContext}.
 */
public final class HistoryCommands {

    private HistoryCommands() {
    }

    public record Undo(String trackId) implements TrackCommand<Long> {}

    public record Redo(String trackId) implements TrackCommand<Long> {}

    public record BatchUndo(String trackId, int count) implements TrackCommand<Long> {}

    public record BatchRedo(String trackId, int count) implements TrackCommand<Long> {}

    public record ClearHistory(String trackId) implements TrackCommand<Void> {}
}
