package com.taskgraph.core.model.task;

import com.taskgraph.core.condition.Condition;
import com.taskgraph.core.condition.FieldValue;

import java.time.Instant;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read view of a task owned by the surrounding platform.
 * The engine never stores tasks; it reads them through the task store.
 */
public record TaskRecord(
    String id,
    String projectId,
    String boardId,
    String parentTaskId,
    String status,
    String title,
    String description,
    String assigneeId,
    String priority,
    List<String> tags,
    LocalDate dueDate,
    Instant createdAt,
    Map<String, FieldValue> customFields
) {
    public TaskRecord {
        tags = tags == null ? List.of() : List.copyOf(tags);
        customFields = customFields == null ? Map.of() : Map.copyOf(customFields);
    }

    public boolean isSubtask() {
        return parentTaskId != null;
    }

    /**
     * All fields as typed values, custom fields included.
     * Under its bare name a standard field wins over a custom field of the same name;
     * every custom field is also present under {@link Condition#CUSTOM_FIELD_PREFIX}.
     */
    public Map<String, FieldValue> fieldValues() {
        Map<String, FieldValue> values = new LinkedHashMap<>(customFields);
        values.put(TaskFields.ID, FieldValue.text(id));
        values.put(TaskFields.PROJECT_ID, FieldValue.text(projectId));
        values.put(TaskFields.BOARD_ID, FieldValue.text(boardId));
        values.put(TaskFields.PARENT_TASK_ID, FieldValue.text(parentTaskId));
        values.put(TaskFields.STATUS, FieldValue.symbol(status));
        values.put(TaskFields.TITLE, FieldValue.text(title));
        values.put(TaskFields.DESCRIPTION, FieldValue.text(description));
        values.put(TaskFields.ASSIGNEE_ID, FieldValue.text(assigneeId));
        values.put(TaskFields.PRIORITY, FieldValue.symbol(priority));
        values.put(TaskFields.TAGS, FieldValue.of(tags));
        values.put(TaskFields.DUE_DATE, FieldValue.date(dueDate));
        values.put(TaskFields.CREATED_AT, FieldValue.of(createdAt));
        customFields.forEach((name, value) -> values.put(Condition.CUSTOM_FIELD_PREFIX + name, value));
        return values;
    }

    public FieldValue fieldValue(String name) {
        return fieldValues().getOrDefault(name, FieldValue.EMPTY);
    }
}
