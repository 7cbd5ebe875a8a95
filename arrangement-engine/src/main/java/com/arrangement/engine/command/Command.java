package com.arrangement.engine.command;

/**
 * A request to change one aggregate.
 *
 * @param <R> type of the result payload on success
 */
public interface Command<R> {

    /**
     * Registry key of the handler. Defaults to the simple class name.
     */
    default String commandName() {
        return getClass().getSimpleName();
    }

    /**
     * Aggregate the command targets; dispatch serializes commands per aggregate id.
     */
    String aggregateId();
}
