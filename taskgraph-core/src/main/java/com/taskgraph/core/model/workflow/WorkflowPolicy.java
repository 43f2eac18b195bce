package com.taskgraph.core.model.workflow;

import java.time.Duration;

/**
 * Tunables for workflow analytics.
 *
 * @param abandonAfter idle time after which an incomplete instance counts as abandoned
 */
public record WorkflowPolicy(Duration abandonAfter) {

    public WorkflowPolicy {
        if (abandonAfter == null || abandonAfter.isNegative() || abandonAfter.isZero()) {
            throw new IllegalArgumentException("abandonAfter must be positive");
        }
    }

    public static WorkflowPolicy defaults() {
        return new WorkflowPolicy(Duration.ofDays(30));
    }
}
