package com.arrangement.engine.undo;

public record UndoRedoStatus(boolean canUndo, boolean canRedo, int undoDepth, int redoDepth) {

    public static final UndoRedoStatus EMPTY = new UndoRedoStatus(false, false, 0, 0);
}
