package com.taskgraph.core.model.automation;

/**
 * Domain events an automation rule can react to.
 */
public enum TriggerType {
    TASK_CREATED,
    STATUS_CHANGED,
    FIELD_UPDATED,
    DUE_DATE_APPROACHING,
    COMMENT_ADDED,
    USER_ASSIGNED,
    USER_UNASSIGNED,
    TIME_LOGGED,
    SPRINT_STARTED,
    SPRINT_ENDED,
    DEPENDENCY_COMPLETED,
    SCHEDULE_BASED,
    MANUAL
}
