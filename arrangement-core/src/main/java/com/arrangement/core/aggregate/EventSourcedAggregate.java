package com.arrangement.core.aggregate;

import com.arrangement.core.event.DomainEvent;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Base class for aggregates whose state is a projection of their events.
 *
 * <p>Domain operations validate invariants against current state and then call
 * {@link #raise(DomainEvent)}; they never assign fields directly. {@link #apply(DomainEvent)}
 * is the only place state changes and must accept every event it is handed.</p>
 *
 * <p>Instances are not thread-safe. Each load yields a fresh instance owned by one caller.</p>
 */
public abstract class EventSourcedAggregate<E extends DomainEvent> {

    private final String id;
    private long version;
    private final List<E> uncommittedEvents = new ArrayList<>();

    protected EventSourcedAggregate(String id) {
        this.id = Objects.requireNonNull(id, "id");
    }

    public String getId() {
        return id;
    }

    /**
     * Number of events applied, committed or not.
     */
    public long getVersion() {
        return version;
    }

    /**
     * Version the store holds for this aggregate, i.e. the expected version for the next append.
     */
    public long getCommittedVersion() {
        return version - uncommittedEvents.size();
    }

    public List<E> getUncommittedEvents() {
        return Collections.unmodifiableList(new ArrayList<>(uncommittedEvents));
    }

    public boolean hasUncommittedEvents() {
        return !uncommittedEvents.isEmpty();
    }

    /**
     * Drain the uncommitted buffer after a successful append.
     */
    public void markEventsAsCommitted() {
        uncommittedEvents.clear();
    }

    /**
     * Replay persisted events. The uncommitted buffer is left untouched.
     */
    public void loadFromHistory(List<? extends E> events) {
        for (E event : events) {
            apply(event);
            version++;
        }
    }

    protected void raise(E event) {
        apply(event);
        version++;
        uncommittedEvents.add(event);
    }

    /**
     * Resume from a snapshot taken at the given version.
     */
    protected void restoreVersion(long snapshotVersion) {
        if (version != 0 || !uncommittedEvents.isEmpty()) {
            throw new IllegalStateException("Snapshot can only be restored into a fresh aggregate");
        }
        this.version = snapshotVersion;
    }

    protected abstract void apply(E event);
}
