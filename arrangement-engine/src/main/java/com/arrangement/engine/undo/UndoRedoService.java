package com.arrangement.engine.undo;

import com.arrangement.core.event.ReversibleEvent;
import com.arrangement.core.exception.ConcurrencyConflictException;
import com.arrangement.core.exception.PermissionDeniedException;
import com.arrangement.core.exception.ValidationException;
import com.arrangement.core.store.EventStore;
import com.arrangement.core.store.StoredEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Per-aggregate undo and redo stacks built on event inversion.
 *
 * <p>Undo persists the inverse of the recorded event at the aggregate's current store version;
 * redo persists the original event again. Both are stamped with the clock when they run.
 * Neither rewrites history: both append.</p>
 *
 * Invariants:
 * - both stacks hold at most {@code maxDepth} entries, evicting the oldest first
 * - recording a new entry clears the redo stack of that aggregate
 * - only the user who performed an operation may undo or redo it
 */
@Service
public class UndoRedoService<E extends ReversibleEvent<E>> {

    private static final Logger log = LoggerFactory.getLogger(UndoRedoService.class);

    private final EventStore<E> eventStore;
    private final Clock clock;
    private final int maxDepth;
    private final int maxBatchSize;

    private final Map<String, History<E>> histories = new ConcurrentHashMap<>();

    public UndoRedoService(EventStore<E> eventStore, Clock clock, int maxDepth, int maxBatchSize) {
        if (maxDepth < 1 || maxBatchSize < 1) {
            throw new IllegalArgumentException("Stack depth and batch size must be positive");
        }
        this.eventStore = eventStore;
        this.clock = clock;
        this.maxDepth = maxDepth;
        this.maxBatchSize = maxBatchSize;
    }

    /**
     * Record an event the given user just persisted at {@code version}.
     *
     * @return false if the event kind is not undoable and nothing was recorded
     */
    public boolean record(E event, String aggregateId, long version, String userId) {
        if (!event.undoable()) {
            log.debug("Event {} on {} is not undoable, not recorded", event.eventKind(), aggregateId);
            return false;
        }
        UndoRedoEntry<E> entry = new UndoRedoEntry<>(event, aggregateId, version, clock.instant(), userId);

        History<E> history = histories.computeIfAbsent(aggregateId, id -> new History<>());
        synchronized (history) {
            push(history.undo, entry);
            history.redo.clear();
        }
        log.debug("Recorded {} at version {} on {} for {}", event.eventKind(), version, aggregateId, userId);
        return true;
    }

    public UndoRedoResult<E> undo(String aggregateId, String userId) {
        History<E> history = histories.get(aggregateId);
        if (history == null) {
            return nothingTo(UndoRedoResult.NOTHING_TO_UNDO, "Nothing to undo", aggregateId);
        }
        synchronized (history) {
            UndoRedoEntry<E> entry = history.undo.peekFirst();
            if (entry == null) {
                return nothingTo(UndoRedoResult.NOTHING_TO_UNDO, "Nothing to undo", aggregateId);
            }
            if (!entry.userId().equals(userId)) {
                log.warn("User {} attempted to undo an operation by {} on {}", userId, entry.userId(), aggregateId);
                return UndoRedoResult.failure(
                    new PermissionDeniedException("User can only undo their own operations"),
                    eventStore.currentVersion(aggregateId));
            }
            E inverse = entry.originalEvent().inverseAt(clock.instant())
                .orElseThrow(() -> new IllegalStateException("Recorded event has no inverse: " + entry.originalEvent().eventKind()));
            UndoRedoResult<E> result = persist(aggregateId, inverse);
            if (result.success()) {
                history.undo.removeFirst();
                push(history.redo, entry);
                log.info("Undid {} on {}, now at version {}", entry.originalEvent().eventKind(), aggregateId, result.newVersion());
            }
            return result;
        }
    }

    public UndoRedoResult<E> redo(String aggregateId, String userId) {
        History<E> history = histories.get(aggregateId);
        if (history == null) {
            return nothingTo(UndoRedoResult.NOTHING_TO_REDO, "Nothing to redo", aggregateId);
        }
        synchronized (history) {
            UndoRedoEntry<E> entry = history.redo.peekFirst();
            if (entry == null) {
                return nothingTo(UndoRedoResult.NOTHING_TO_REDO, "Nothing to redo", aggregateId);
            }
            if (!entry.userId().equals(userId)) {
                log.warn("User {} attempted to redo an operation by {} on {}", userId, entry.userId(), aggregateId);
                return UndoRedoResult.failure(
                    new PermissionDeniedException("User can only redo their own operations"),
                    eventStore.currentVersion(aggregateId));
            }
            UndoRedoResult<E> result = persist(aggregateId, entry.originalEvent().withOccurredAt(clock.instant()));
            if (result.success()) {
                history.redo.removeFirst();
                push(history.undo, entry);
                log.info("Redid {} on {}, now at version {}", entry.originalEvent().eventKind(), aggregateId, result.newVersion());
            }
            return result;
        }
    }

    /**
     * Undo up to {@code count} entries, stopping at the first step that fails.
     * Steps already applied stay applied.
     *
     * @throws ValidationException if count is outside 1..maxBatchSize
     */
    public UndoRedoResult<E> batchUndo(String aggregateId, int count, String userId) {
        requireValidCount(count);
        return repeat(count, () -> undo(aggregateId, userId));
    }

    public UndoRedoResult<E> batchRedo(String aggregateId, int count, String userId) {
        requireValidCount(count);
        return repeat(count, () -> redo(aggregateId, userId));
    }

    public boolean canUndo(String aggregateId) {
        return status(aggregateId).canUndo();
    }

    public boolean canRedo(String aggregateId) {
        return status(aggregateId).canRedo();
    }

    public UndoRedoStatus status(String aggregateId) {
        History<E> history = histories.get(aggregateId);
        if (history == null) {
            return UndoRedoStatus.EMPTY;
        }
        synchronized (history) {
            return new UndoRedoStatus(!history.undo.isEmpty(), !history.redo.isEmpty(),
                history.undo.size(), history.redo.size());
        }
    }

    public UndoRedoHistory<E> history(String aggregateId) {
        History<E> history = histories.get(aggregateId);
        if (history == null) {
            return new UndoRedoHistory<>(aggregateId, List.of(), List.of());
        }
        synchronized (history) {
            return new UndoRedoHistory<>(aggregateId, new ArrayList<>(history.undo), new ArrayList<>(history.redo));
        }
    }

    /**
     * Drop both stacks of one aggregate. Other aggregates are untouched.
     */
    public void clearHistory(String aggregateId) {
        if (histories.remove(aggregateId) != null) {
            log.info("Cleared undo/redo history of {}", aggregateId);
        }
    }

    public int trackedAggregateCount() {
        return histories.size();
    }

    public int maxBatchSize() {
        return maxBatchSize;
    }

    // ========== Internals ==========

    private UndoRedoResult<E> persist(String aggregateId, E event) {
        long current = eventStore.currentVersion(aggregateId);
        try {
            List<StoredEvent> stored = eventStore.append(aggregateId, List.of(event), current);
            return UndoRedoResult.success(List.of(event), stored.get(stored.size() - 1).version());
        } catch (ConcurrencyConflictException e) {
            log.warn("Undo/redo on {} lost a version race: {}", aggregateId, e.getMessage());
            return UndoRedoResult.failure(e, eventStore.currentVersion(aggregateId));
        }
    }

    private UndoRedoResult<E> repeat(int count, Supplier<UndoRedoResult<E>> step) {
        List<E> applied = new ArrayList<>();
        UndoRedoResult<E> last = null;
        for (int i = 0; i < count; i++) {
            UndoRedoResult<E> result = step.get();
            if (!result.success()) {
                if (applied.isEmpty()) {
                    return result;
                }
                log.debug("Batch stopped after {} of {} step(s): {}", applied.size(), count, result.error());
                break;
            }
            applied.addAll(result.eventsApplied());
            last = result;
        }
        return UndoRedoResult.success(applied, last.newVersion());
    }

    private void requireValidCount(int count) {
        if (count < 1) {
            throw new ValidationException("Count must be positive");
        }
        if (count > maxBatchSize) {
            throw new ValidationException("Count cannot exceed " + maxBatchSize);
        }
    }

    private UndoRedoResult<E> nothingTo(String errorCode, String message, String aggregateId) {
        return UndoRedoResult.failure(errorCode, message, eventStore.currentVersion(aggregateId));
    }

    private void push(Deque<UndoRedoEntry<E>> stack, UndoRedoEntry<E> entry) {
        stack.addFirst(entry);
        while (stack.size() > maxDepth) {
            UndoRedoEntry<E> evicted = stack.removeLast();
            log.debug("Evicted oldest entry {} of {}", evicted.originalEvent().eventKind(), evicted.aggregateId());
        }
    }

    private static final class History<E extends ReversibleEvent<E>> {
        private final Deque<UndoRedoEntry<E>> undo = new ArrayDeque<>();
        private final Deque<UndoRedoEntry<E>> redo = new ArrayDeque<>();
    }
}
