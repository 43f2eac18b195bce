package com.taskgraph.core.repository;

import com.taskgraph.core.model.workflow.WorkflowInstance;

import java.util.List;
import java.util.Optional;

/**
 * Repository for workflow instances.
 * At most one instance exists per (entityType, entityId).
 */
public interface WorkflowInstanceRepository {

    /**
     * Store a new instance.
     *
     * @param instance The instance to store
     */
    void save(WorkflowInstance instance);

    /**
     * Replace an instance with a newer copy.
     *
     * @param instance The updated instance
     */
    void update(WorkflowInstance instance);

    /**
     * Find an instance by ID.
     *
     * @param instanceId The instance ID
     * @return The instance if found
     */
    Optional<WorkflowInstance> findById(String instanceId);

    /**
     * Find the instance attached to an entity.
     *
     * @param entityType The entity type
     * @param entityId The entity ID
     * @return The instance if the entity has one
     */
    Optional<WorkflowInstance> findByEntity(String entityType, String entityId);

    /**
     * List instances of a workflow definition.
     *
     * @param workflowId The workflow ID
     * @return Instances of the workflow
     */
    List<WorkflowInstance> findByWorkflow(String workflowId);
}
