package com.taskgraph.core.exception;

/**
 * Thrown when a workflow transition is rejected.
 * The reason distinguishes permission, condition, comment and lifecycle failures.
 */
public class InvalidTransitionException extends TaskGraphException {

    public static final String ERROR_CODE = "INVALID_TRANSITION";

    private final TransitionRejection reason;

    public InvalidTransitionException(String instanceId, String fromState, String toState,
                                      TransitionRejection reason) {
        super(ERROR_CODE, String.format(
            "Cannot transition instance %s from %s to %s: %s",
            instanceId, fromState, toState, reason.description()
        ));
        this.reason = reason;
    }

    public TransitionRejection getReason() {
        return reason;
    }
}
