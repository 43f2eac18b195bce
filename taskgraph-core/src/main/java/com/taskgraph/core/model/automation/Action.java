package com.taskgraph.core.model.automation;

import com.taskgraph.core.condition.FieldValue;

import java.util.List;

/**
 * One step of a rule. Only the parameters relevant to the action type are set.
 */
public record Action(
    ActionType type,

    // Field and status changes
    String fieldName,
    FieldValue fieldValue,
    String newStatus,

    // Assignment
    String assigneeId,

    // Task creation
    String taskTitle,
    String taskDescription,

    // Notification
    String message,
    List<String> notifyUserIds,

    // Chaining
    String nextRuleId
) {
    public Action {
        if (type == null) {
            throw new IllegalArgumentException("action type must not be null");
        }
        fieldValue = fieldValue == null ? FieldValue.EMPTY : fieldValue;
        notifyUserIds = notifyUserIds == null ? List.of() : List.copyOf(notifyUserIds);
    }

    private static Action bare(ActionType type) {
        return new Action(type, null, null, null, null, null, null, null, null, null);
    }

    public static Action updateField(String fieldName, Object value) {
        return new Action(ActionType.UPDATE_FIELD, fieldName, FieldValue.of(value),
            null, null, null, null, null, null, null);
    }

    public static Action changeStatus(String newStatus) {
        return new Action(ActionType.CHANGE_STATUS, null, null, newStatus,
            null, null, null, null, null, null);
    }

    public static Action assignUser(String userId) {
        return new Action(ActionType.ASSIGN_USER, null, null, null,
            userId, null, null, null, null, null);
    }

    public static Action unassignUser() {
        return bare(ActionType.UNASSIGN_USER);
    }

    public static Action createTask(String title, String description) {
        return new Action(ActionType.CREATE_TASK, null, null, null,
            null, title, description, null, null, null);
    }

    public static Action createSubtask(String title, String description) {
        return new Action(ActionType.CREATE_SUBTASK, null, null, null,
            null, title, description, null, null, null);
    }

    public static Action sendNotification(String message, List<String> userIds) {
        return new Action(ActionType.SEND_NOTIFICATION, null, null, null,
            null, null, null, message, userIds, null);
    }

    public static Action runAutomation(String ruleId) {
        return new Action(ActionType.RUN_AUTOMATION, null, null, null,
            null, null, null, null, null, ruleId);
    }

    public static Action of(ActionType type) {
        return bare(type);
    }
}
