package com.taskgraph.engine.entity;

import com.taskgraph.core.condition.FieldValue;
import com.taskgraph.core.model.task.TaskRecord;
import com.taskgraph.core.spi.TaskStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;

/**
 * Entity access backed by the task store. Only the "task" entity type is supported;
 * other types read as empty and their writes are skipped.
 */
public class TaskEntityAccessor implements EntityAccessor {

    private static final Logger log = LoggerFactory.getLogger(TaskEntityAccessor.class);

    public static final String TASK = "task";

    private final TaskStore taskStore;

    public TaskEntityAccessor(TaskStore taskStore) {
        this.taskStore = taskStore;
    }

    @Override
    public Map<String, FieldValue> fieldValues(String entityType, String entityId) {
        return task(entityType, entityId)
            .map(TaskRecord::fieldValues)
            .orElse(Map.of());
    }

    @Override
    public boolean update(String entityType, String entityId, Map<String, FieldValue> fields) {
        if (!isTask(entityType)) {
            log.warn("Skipping update of unsupported entity {}:{} fields={}", entityType, entityId, fields.keySet());
            return false;
        }
        if (fields.isEmpty()) {
            return true;
        }
        taskStore.update(entityId, fields);
        return true;
    }

    @Override
    public Optional<TaskRecord> task(String entityType, String entityId) {
        if (!isTask(entityType) || entityId == null) {
            return Optional.empty();
        }
        return taskStore.get(entityId);
    }

    private static boolean isTask(String entityType) {
        return TASK.equalsIgnoreCase(entityType);
    }
}
