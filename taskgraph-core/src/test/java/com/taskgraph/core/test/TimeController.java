package com.taskgraph.core.test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Controllable clock for testing time-dependent behavior.
 * Pass it wherever the engine takes a {@link Clock}; time only moves when a test moves it.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * TimeController time = TimeController.frozenAt(Instant.parse("2025-01-06T09:00:00Z"));
 * engine = new WorkflowCoordinator(..., time);
 *
 * time.advance(Duration.ofMinutes(5));
 * }</pre>
 */
public class TimeController extends Clock {

    private final AtomicReference<Instant> currentTime;
    private final ZoneId zone;

    public TimeController(Instant startTime) {
        this(new AtomicReference<>(startTime), ZoneOffset.UTC);
    }

    private TimeController(AtomicReference<Instant> currentTime, ZoneId zone) {
        this.currentTime = currentTime;
        this.zone = zone;
    }

    @Override
    public ZoneId getZone() {
        return zone;
    }

    /**
     * Same underlying time, different zone. Advancing either clock moves both.
     */
    @Override
    public Clock withZone(ZoneId newZone) {
        return new TimeController(currentTime, newZone);
    }

    @Override
    public Instant instant() {
        return currentTime.get();
    }

    /**
     * Advance time by a duration.
     */
    public void advance(Duration duration) {
        currentTime.updateAndGet(t -> t.plus(duration));
    }

    public void advanceMinutes(long minutes) {
        advance(Duration.ofMinutes(minutes));
    }

    public void advanceDays(long days) {
        advance(Duration.ofDays(days));
    }

    /**
     * Set time to a specific instant.
     */
    public void setTime(Instant newTime) {
        currentTime.set(newTime);
    }

    /**
     * Get the duration since an instant.
     */
    public Duration durationSince(Instant since) {
        return Duration.between(since, instant());
    }

    /**
     * Create a frozen clock at a specific time.
     */
    public static TimeController frozenAt(Instant time) {
        return new TimeController(time);
    }

    /**
     * Create a frozen clock at an ISO-8601 instant, e.g. "2025-01-06T00:00:00Z".
     */
    public static TimeController frozenAt(String isoInstant) {
        return new TimeController(Instant.parse(isoInstant));
    }
}
