package com.taskgraph.scheduler;

import java.time.Duration;

/**
 * How often and how much the recurring-task materializer works per run.
 *
 * @param pollInterval Delay between scheduled runs
 * @param batchSize Maximum generators examined per run
 */
public record MaterializerSettings(
    Duration pollInterval,
    int batchSize
) {
    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMinutes(5);
    public static final int DEFAULT_BATCH_SIZE = 100;

    public MaterializerSettings {
        if (pollInterval == null || pollInterval.isNegative() || pollInterval.isZero()) {
            throw new IllegalArgumentException("pollInterval must be positive");
        }
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be at least 1");
        }
    }

    public static MaterializerSettings defaults() {
        return new MaterializerSettings(DEFAULT_POLL_INTERVAL, DEFAULT_BATCH_SIZE);
    }
}
