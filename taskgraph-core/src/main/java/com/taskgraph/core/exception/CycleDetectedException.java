package com.taskgraph.core.exception;

import java.util.List;

/**
 * Thrown when inserting a scheduling dependency would close a cycle.
 * The offending edge is never persisted.
 */
public class CycleDetectedException extends TaskGraphException {

    public static final String ERROR_CODE = "CYCLE_DETECTED";

    private final List<String> cycle;

    public CycleDetectedException(List<String> cycle) {
        super(ERROR_CODE, String.format(
            "Dependency would create a cycle: %s",
            String.join(" -> ", cycle)
        ));
        this.cycle = List.copyOf(cycle);
    }

    /**
     * Task ids of the cycle in edge order; the last task links back to the first.
     */
    public List<String> getCycle() {
        return cycle;
    }
}
