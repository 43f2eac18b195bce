package com.taskgraph.core.model.automation;

/**
 * Lifecycle of one rule execution.
 * PENDING -> RUNNING -> SUCCESS | FAILED, or PENDING -> SKIPPED.
 */
public enum LogStatus {
    PENDING,
    RUNNING,
    SUCCESS,
    FAILED,
    SKIPPED;

    public boolean isTerminal() {
        return this == SUCCESS || this == FAILED || this == SKIPPED;
    }
}
