package com.taskgraph.core.model.task;

/**
 * Names of the standard task fields as seen by conditions, field updates and the task store.
 */
public final class TaskFields {

    public static final String ID = "id";
    public static final String PROJECT_ID = "projectId";
    public static final String BOARD_ID = "boardId";
    public static final String LIST_ID = "listId";
    public static final String PARENT_TASK_ID = "parentTaskId";
    public static final String STATUS = "status";
    public static final String TITLE = "title";
    public static final String DESCRIPTION = "description";
    public static final String ASSIGNEE_ID = "assigneeId";
    public static final String PRIORITY = "priority";
    public static final String TAGS = "tags";
    public static final String DUE_DATE = "dueDate";
    public static final String CREATED_AT = "createdAt";
    public static final String RECURRING_TASK_ID = "recurringTaskId";

    private TaskFields() {
    }
}
