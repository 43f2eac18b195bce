package com.taskgraph.core.model.recurrence;

/**
 * How a monthly pattern picks its day.
 */
public enum MonthlyType {
    DATE,   // fixed day of month, e.g. the 15th
    DAY     // nth weekday, e.g. the second Tuesday
}
