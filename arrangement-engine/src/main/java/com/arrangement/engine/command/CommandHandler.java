package com.arrangement.engine.command;

/**
 * Executes one command type. Domain, validation and concurrency errors may be thrown as
 * {@link com.arrangement.core.exception.ArrangementException}; the dispatcher turns them into results.
 */
public interface CommandHandler<C, R> {

    CommandResult<R> handle(C command, CommandContext context);
}
