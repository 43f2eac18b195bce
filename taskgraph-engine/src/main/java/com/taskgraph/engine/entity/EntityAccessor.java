package com.taskgraph.engine.entity;

import com.taskgraph.core.condition.FieldValue;
import com.taskgraph.core.model.task.TaskRecord;

import java.util.Map;
import java.util.Optional;

/**
 * Reads and writes the entities that workflows and automation rules act on.
 * Entities are addressed by (entityType, entityId).
 */
public interface EntityAccessor {

    /**
     * Current field values of an entity.
     *
     * @param entityType The entity type
     * @param entityId The entity ID
     * @return Field values, empty when the entity is unknown or its type unsupported
     */
    Map<String, FieldValue> fieldValues(String entityType, String entityId);

    /**
     * Write field values to an entity.
     *
     * @param entityType The entity type
     * @param entityId The entity ID
     * @param fields Fields to write
     * @return false when the entity type is not supported and nothing was written
     */
    boolean update(String entityType, String entityId, Map<String, FieldValue> fields);

    /**
     * The task behind an entity, when the entity is a task.
     *
     * @param entityType The entity type
     * @param entityId The entity ID
     * @return The task if the entity is a known task
     */
    Optional<TaskRecord> task(String entityType, String entityId);
}
