package com.taskgraph.core.repository;

import com.taskgraph.core.model.workflow.WorkflowDefinition;

import java.util.List;
import java.util.Optional;

/**
 * Repository for workflow definitions.
 */
public interface WorkflowDefinitionRepository {

    /**
     * Store a definition, replacing any with the same id.
     *
     * @param definition The workflow definition
     */
    void save(WorkflowDefinition definition);

    /**
     * Find a definition by ID.
     *
     * @param workflowId The workflow ID
     * @return The definition if found
     */
    Optional<WorkflowDefinition> findById(String workflowId);

    /**
     * List definitions for an entity type, or all definitions when entityType is null.
     *
     * @param entityType The entity type, may be null
     * @return Matching definitions
     */
    List<WorkflowDefinition> findByEntityType(String entityType);

    /**
     * Remove a definition.
     *
     * @param workflowId The workflow ID
     * @return true if a definition was removed
     */
    boolean delete(String workflowId);
}
