package com.taskgraph.core.model.automation;

/**
 * Effects an automation rule can perform.
 */
public enum ActionType {
    UPDATE_FIELD,
    CHANGE_STATUS,
    ASSIGN_USER,
    UNASSIGN_USER,
    CREATE_TASK,
    CREATE_SUBTASK,
    SEND_NOTIFICATION,
    ADD_COMMENT,
    START_TIMER,
    STOP_TIMER,
    UPDATE_DEPENDENCY,
    CALCULATE_FIELD,
    GENERATE_REPORT,
    SEND_EMAIL,
    WEBHOOK,
    RUN_AUTOMATION
}
