package com.taskgraph.engine.service;

import com.taskgraph.core.condition.FieldValue;
import com.taskgraph.core.model.workflow.TransitionDefinition;
import com.taskgraph.core.model.workflow.WorkflowAnalytics;
import com.taskgraph.core.model.workflow.WorkflowDefinition;
import com.taskgraph.core.model.workflow.WorkflowInstance;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Workflow state machine: definitions, instances and transitions.
 */
public interface WorkflowService {

    /**
     * Register a new workflow definition.
     *
     * @param definition The workflow definition
     * @return The registered definition with id and version 1 assigned
     */
    WorkflowDefinition createWorkflow(WorkflowDefinition definition);

    /**
     * Replace a workflow definition; the version is incremented.
     *
     * @param workflowId The workflow ID
     * @param definition The new definition
     * @return The stored definition
     */
    WorkflowDefinition updateWorkflow(String workflowId, WorkflowDefinition definition);

    void deleteWorkflow(String workflowId);

    WorkflowDefinition getWorkflow(String workflowId);

    /**
     * List definitions for an entity type, or all when entityType is null.
     */
    List<WorkflowDefinition> listWorkflows(String entityType);

    /**
     * Attach a workflow to an entity, placing it in the initial state.
     *
     * @param workflowId The workflow ID
     * @param entityType The entity type; must match the workflow's
     * @param entityId The entity ID
     * @param actorId The user applying the workflow
     * @return The new instance
     * @throws com.taskgraph.core.exception.DuplicateEntityException if the entity already has an instance
     */
    WorkflowInstance applyWorkflow(String workflowId, String entityType, String entityId, String actorId);

    /**
     * Move an instance to another state.
     *
     * @param request The transition request
     * @return The updated instance
     * @throws com.taskgraph.core.exception.InvalidTransitionException if the move is rejected
     */
    WorkflowInstance transition(TransitionRequest request);

    /**
     * Record an approval for the instance's pending approval state.
     *
     * @param instanceId The instance ID
     * @param actorId The approving user
     * @param comment Optional comment
     * @return The updated instance
     */
    WorkflowInstance approve(String instanceId, String actorId, String comment);

    /**
     * Transitions the actor could perform right now.
     */
    List<TransitionDefinition> availableTransitions(String instanceId, String actorId);

    WorkflowInstance getInstance(String instanceId);

    Optional<WorkflowInstance> findInstance(String entityType, String entityId);

    /**
     * Performance of a workflow's instances started within [from, to].
     */
    WorkflowAnalytics analytics(String workflowId, Instant from, Instant to);

    /**
     * Request to move an instance to a state.
     */
    record TransitionRequest(
        String instanceId,
        String toStateId,
        String actorId,
        String comment,
        Map<String, FieldValue> fieldUpdates
    ) {
        public TransitionRequest {
            fieldUpdates = fieldUpdates == null ? Map.of() : Map.copyOf(fieldUpdates);
        }

        public static TransitionRequest of(String instanceId, String toStateId, String actorId) {
            return new TransitionRequest(instanceId, toStateId, actorId, null, Map.of());
        }
    }
}
