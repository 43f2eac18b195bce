package com.taskgraph.core.model.recurrence;

public enum EndType {
    NEVER,
    DATE,
    COUNT
}
