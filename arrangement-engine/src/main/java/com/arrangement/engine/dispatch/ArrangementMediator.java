package com.arrangement.engine.dispatch;

import com.arrangement.core.exception.ArrangementException;
import com.arrangement.core.exception.ConcurrencyConflictException;
import com.arrangement.core.exception.HandlerInstantiationException;
import com.arrangement.core.exception.PermissionDeniedException;
import com.arrangement.engine.command.Command;
import com.arrangement.engine.command.CommandContext;
import com.arrangement.engine.command.CommandHandler;
import com.arrangement.engine.command.CommandResult;
import com.arrangement.engine.logging.LoggingContext;
import com.arrangement.engine.metrics.ArrangementMetrics;
import com.arrangement.engine.query.Query;
import com.arrangement.engine.query.QueryHandler;
import com.arrangement.engine.query.QueryResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Routes commands and queries to the single handler registered under their name.
 *
 * <p>Handlers are registered as factories and built on first use. Commands on the same track are
 * serialized with a per-track lock held across load, operate, persist and record; commands on
 * different tracks run in parallel. Every outcome, including unexpected failures, comes back as
 * a result envelope.</p>
 */
@Component
public class ArrangementMediator {

    private static final Logger log = LoggerFactory.getLogger(ArrangementMediator.class);

    private final Map<String, Registration<?>> commandHandlers = new ConcurrentHashMap<>();
    private final Map<String, Registration<?>> queryHandlers = new ConcurrentHashMap<>();
    private final Map<String, ReentrantLock> trackLocks = new ConcurrentHashMap<>();

    private final ArrangementMetrics metrics;

    public ArrangementMediator(ArrangementMetrics metrics) {
        this.metrics = metrics;
    }

    // ========== Registration ==========

    /**
     * @throws IllegalStateException if a handler is already registered for the command
     */
    public <C extends Command<R>, R> void registerCommand(Class<C> commandType,
                                                          Supplier<? extends CommandHandler<C, R>> factory) {
        register(commandHandlers, "command", commandType.getSimpleName(), factory);
    }

    public <Q extends Query<R>, R> void registerQuery(Class<Q> queryType,
                                                      Supplier<? extends QueryHandler<Q, R>> factory) {
        register(queryHandlers, "query", queryType.getSimpleName(), factory);
    }

    public Set<String> registeredCommands() {
        return Set.copyOf(commandHandlers.keySet());
    }

    public Set<String> registeredQueries() {
        return Set.copyOf(queryHandlers.keySet());
    }

    private static void register(Map<String, Registration<?>> registry, String kind, String name, Supplier<?> factory) {
        if (registry.putIfAbsent(name, new Registration<>(name, factory)) != null) {
            throw new IllegalStateException("A handler is already registered for " + kind + ": " + name);
        }
        log.debug("Registered {} handler for {}", kind, name);
    }

    // ========== Commands ==========

    public <R> CommandResult<R> send(Command<R> command, CommandContext context) {
        String name = command.commandName();
        Registration<?> registration = commandHandlers.get(name);
        if (registration == null) {
            log.warn("No handler registered for command: {}", name);
            return CommandResult.failure(CommandResult.NO_HANDLER, "No handler registered for command: " + name, false);
        }

        String trackId = command.aggregateId();
        String userId = context != null ? context.userId() : null;
        long start = System.nanoTime();

        CommandResult<R> result;
        try (LoggingContext ignored = LoggingContext.forCommand(trackId, userId, name)) {
            result = dispatchLocked(trackId, () -> invoke(registration, command, context));
        }

        String outcome = result.success() ? ArrangementMetrics.OUTCOME_SUCCESS : result.errorCode();
        metrics.commandCompleted(name, outcome, result.eventsGenerated(), Duration.ofNanos(System.nanoTime() - start));
        if (ConcurrencyConflictException.ERROR_CODE.equals(result.errorCode())) {
            metrics.concurrencyConflict(name);
        }
        return result;
    }

    private <R> CommandResult<R> dispatchLocked(String trackId, Supplier<CommandResult<R>> work) {
        if (trackId == null || trackId.isBlank()) {
            // Nothing to serialize on; the handler rejects the command during validation.
            return work.get();
        }
        ReentrantLock lock = trackLocks.computeIfAbsent(trackId, id -> new ReentrantLock());
        lock.lock();
        try {
            return work.get();
        } finally {
            lock.unlock();
        }
    }

    @SuppressWarnings("unchecked")
    private <R> CommandResult<R> invoke(Registration<?> registration, Command<R> command, CommandContext context) {
        String name = registration.name;
        try {
            CommandHandler<Command<R>, R> handler = (CommandHandler<Command<R>, R>) registration.instance();
            return handler.handle(command, context);
        } catch (ConcurrencyConflictException | PermissionDeniedException e) {
            log.warn("{} rejected: {}", name, e.getMessage());
            return CommandResult.failure(e);
        } catch (ArrangementException e) {
            log.info("{} failed with {}: {}", name, e.getErrorCode(), e.getMessage());
            return CommandResult.failure(e);
        } catch (RuntimeException e) {
            log.error("Unexpected failure handling {}", name, e);
            return CommandResult.failure(CommandResult.UNEXPECTED_ERROR, "Unexpected error: " + e.getMessage(), false);
        }
    }

    // ========== Queries ==========

    @SuppressWarnings("unchecked")
    public <R> QueryResult<R> query(Query<R> query) {
        String name = query.queryName();
        Registration<?> registration = queryHandlers.get(name);
        if (registration == null) {
            log.warn("No handler registered for query: {}", name);
            metrics.queryCompleted(name, CommandResult.NO_HANDLER);
            return QueryResult.failure(CommandResult.NO_HANDLER, "No handler registered for query: " + name);
        }

        QueryResult<R> result;
        try (LoggingContext ignored = LoggingContext.forQuery(name)) {
            QueryHandler<Query<R>, R> handler = (QueryHandler<Query<R>, R>) registration.instance();
            result = QueryResult.success(handler.handle(query));
        } catch (ArrangementException e) {
            log.info("{} failed with {}: {}", name, e.getErrorCode(), e.getMessage());
            result = QueryResult.failure(e);
        } catch (RuntimeException e) {
            log.error("Unexpected failure answering {}", name, e);
            result = QueryResult.failure(CommandResult.UNEXPECTED_ERROR, "Unexpected error: " + e.getMessage());
        }

        metrics.queryCompleted(name, result.success() ? ArrangementMetrics.OUTCOME_SUCCESS : result.errorCode());
        return result;
    }

    /**
     * Lazily built, memoized handler. A failed construction is not cached, so the next
     * dispatch tries again.
     */
    private static final class Registration<H> {

        private final String name;
        private final Supplier<? extends H> factory;
        private volatile H instance;

        private Registration(String name, Supplier<? extends H> factory) {
            this.name = name;
            this.factory = factory;
        }

        H instance() {
            H current = instance;
            if (current != null) {
                return current;
            }
            synchronized (this) {
                if (instance == null) {
                    H created;
                    try {
                        created = factory.get();
                    } catch (RuntimeException e) {
                        throw new HandlerInstantiationException(name, e);
                    }
                    if (created == null) {
                        throw new HandlerInstantiationException(name);
                    }
                    instance = created;
                    log.debug("Created handler for {}", name);
                }
                return instance;
            }
        }
    }
}
