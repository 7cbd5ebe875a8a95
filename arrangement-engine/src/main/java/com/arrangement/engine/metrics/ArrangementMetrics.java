package com.arrangement.engine.metrics;

import com.arrangement.engine.undo.UndoRedoService;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Set;

/**
 * Micrometer metrics for command dispatch and undo/redo.
 *
 * Metrics exposed:
 * - commands dispatched by name and outcome, with duration
 * - events appended
 * - concurrency conflicts by command
 * - undo and redo operations by outcome
 * - aggregates holding undo history
 *
 * Recording before {@link #bindTo(MeterRegistry)} is a no-op.
 */
@Component
public class ArrangementMetrics implements MeterBinder {

    public static final String COMMANDS = "arrangement.commands";
    public static final String COMMAND_DURATION = "arrangement.command.duration";
    public static final String EVENTS_APPENDED = "arrangement.events.appended";
    public static final String CONCURRENCY_CONFLICTS = "arrangement.concurrency.conflicts";
    public static final String QUERIES = "arrangement.queries";
    public static final String UNDO_HISTORIES = "arrangement.undo.histories";
    public static final String UNDO_REDO_OPERATIONS = "arrangement.undo.operations";

    public static final String OUTCOME_SUCCESS = "success";

    private static final Set<String> UNDO_REDO_COMMANDS = Set.of("Undo", "Redo", "BatchUndo", "BatchRedo");

    private final UndoRedoService<?> undoRedoService;
    private MeterRegistry registry;

    public ArrangementMetrics(UndoRedoService<?> undoRedoService) {
        this.undoRedoService = undoRedoService;
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        this.registry = registry;

        Gauge.builder(UNDO_HISTORIES, undoRedoService, UndoRedoService::trackedAggregateCount)
            .description("Aggregates with undo or redo history")
            .register(registry);
    }

    // ========== Command Metrics ==========

    /**
     * @param outcome {@link #OUTCOME_SUCCESS} or the failure's error code
     */
    public void commandCompleted(String command, String outcome, int eventsAppended, Duration duration) {
        if (registry == null) {
            return;
        }
        Counter.builder(COMMANDS)
            .tag("command", command)
            .tag("outcome", outcome)
            .description("Commands dispatched")
            .register(registry)
            .increment();

        Timer.builder(COMMAND_DURATION)
            .tag("command", command)
            .description("Command handling duration")
            .register(registry)
            .record(duration);

        if (UNDO_REDO_COMMANDS.contains(command)) {
            Counter.builder(UNDO_REDO_OPERATIONS)
                .tag("operation", command)
                .tag("outcome", outcome)
                .description("Undo and redo operations")
                .register(registry)
                .increment();
        }

        if (eventsAppended > 0) {
            Counter.builder(EVENTS_APPENDED)
                .description("Events appended by commands")
                .register(registry)
                .increment(eventsAppended);
        }
    }

    public void concurrencyConflict(String command) {
        if (registry == null) {
            return;
        }
        Counter.builder(CONCURRENCY_CONFLICTS)
            .tag("command", command)
            .description("Appends rejected because the expected version was stale")
            .register(registry)
            .increment();
    }

    // ========== Query Metrics ==========

    public void queryCompleted(String query, String outcome) {
        if (registry == null) {
            return;
        }
        Counter.builder(QUERIES)
            .tag("query", query)
            .tag("outcome", outcome)
            .description("Queries answered")
            .register(registry)
            .increment();
    }
}
