package com.taskgraph.core.model.recurrence;

/**
 * Base cadence of a recurrence pattern.
 * CUSTOM patterns have no calculable cadence and never produce occurrences on their own.
 */
public enum Frequency {
    DAILY,
    WEEKLY,
    MONTHLY,
    YEARLY,
    CUSTOM
}
