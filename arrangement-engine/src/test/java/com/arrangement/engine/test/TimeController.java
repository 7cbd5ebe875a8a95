package com.arrangement.engine.test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Controllable clock for tests. Hand it to the store or the aggregate wherever a {@link Clock}
 * is expected, then move time explicitly.
 *
 * <pre>{@code
 * TimeController time = new TimeController(Instant.parse("2024-01-01T00:00:00Z"));
 * store = new InMemoryEventStore<>(codec, time);
 * time.advanceSeconds(5);
 * }</pre>
 */
public class TimeController extends Clock {

    private final AtomicReference<Instant> currentTime;

    public TimeController() {
        this(Instant.parse("2024-01-01T00:00:00Z"));
    }

    public TimeController(Instant startTime) {
        this.currentTime = new AtomicReference<>(startTime);
    }

    @Override
    public Instant instant() {
        return currentTime.get();
    }

    @Override
    public ZoneId getZone() {
        return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        return this;
    }

    public Instant now() {
        return currentTime.get();
    }

    public void advance(Duration duration) {
        currentTime.updateAndGet(t -> t.plus(duration));
    }

    public void advanceMillis(long millis) {
        advance(Duration.ofMillis(millis));
    }

    public void advanceSeconds(long seconds) {
        advance(Duration.ofSeconds(seconds));
    }

    public void setTime(Instant newTime) {
        currentTime.set(newTime);
    }
}
