package com.arrangement.engine.command;

import java.time.Instant;

/**
 * Who issues a command, and whether its undoable events should be recorded.
 */
public record CommandContext(String userId, Instant timestamp, boolean undoTracking) {

    public static CommandContext forUser(String userId) {
        return new CommandContext(userId, Instant.now(), true);
    }

    public static CommandContext untracked(String userId) {
        return new CommandContext(userId, Instant.now(), false);
    }
}
