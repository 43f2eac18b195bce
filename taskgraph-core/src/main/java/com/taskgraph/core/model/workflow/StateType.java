package com.taskgraph.core.model.workflow;

/**
 * Role of a state inside a workflow definition.
 */
public enum StateType {
    /**
     * Entry state. Exactly one per definition.
     */
    INITIAL,

    /**
     * Ordinary working state.
     */
    NORMAL,

    /**
     * Leaving the state requires the configured number of approvals.
     */
    APPROVAL,

    /**
     * Entered alongside the states already active instead of replacing them.
     * Only meaningful when the definition allows parallel states.
     */
    PARALLEL,

    /**
     * Terminal. An instance entering it is completed and accepts no further transitions.
     */
    FINAL;

    public boolean isTerminal() {
        return this == FINAL;
    }
}
