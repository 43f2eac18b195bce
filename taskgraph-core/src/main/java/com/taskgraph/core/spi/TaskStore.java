package com.taskgraph.core.spi;

import com.taskgraph.core.condition.FieldValue;
import com.taskgraph.core.model.task.TaskRecord;

import java.util.Map;
import java.util.Optional;

/**
 * Access to task records owned by the surrounding platform.
 * Field names follow {@link com.taskgraph.core.model.task.TaskFields}.
 */
public interface TaskStore {

    /**
     * Find a task by ID.
     *
     * @param taskId The task ID
     * @return The task if it exists
     */
    Optional<TaskRecord> get(String taskId);

    /**
     * Create a task.
     *
     * @param fields Initial field values
     * @return The new task's ID
     */
    String create(Map<String, FieldValue> fields);

    /**
     * Update fields of an existing task. Fields not named are left unchanged.
     *
     * @param taskId The task ID
     * @param fields Field values to write
     */
    void update(String taskId, Map<String, FieldValue> fields);
}
