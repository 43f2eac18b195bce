package com.taskgraph.core.exception;

/**
 * Why a workflow transition was refused.
 */
public enum TransitionRejection {
    NO_MATCHING_TRANSITION("no valid transition to the requested state"),
    NO_PERMISSION("actor is not allowed to perform this transition"),
    CONDITION_NOT_MET("transition conditions are not met"),
    COMMENT_REQUIRED("a comment is required for this transition"),
    APPROVALS_PENDING("required approvals have not been given"),
    NOT_AN_APPROVER("actor cannot approve this state"),
    WORKFLOW_COMPLETED("workflow instance is already completed");

    private final String description;

    TransitionRejection(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }
}
