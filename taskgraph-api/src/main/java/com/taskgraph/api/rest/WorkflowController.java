package com.taskgraph.api.rest;

import com.taskgraph.core.condition.FieldValue;
import com.taskgraph.core.exception.NotFoundException;
import com.taskgraph.core.model.workflow.TransitionDefinition;
import com.taskgraph.core.model.workflow.WorkflowAnalytics;
import com.taskgraph.core.model.workflow.WorkflowDefinition;
import com.taskgraph.core.model.workflow.WorkflowInstance;
import com.taskgraph.engine.service.WorkflowService;
import com.taskgraph.engine.service.WorkflowService.TransitionRequest;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * REST API for workflow definitions and instances.
 */
@RestController
@RequestMapping("/api/v1")
public class WorkflowController {

    private static final Duration DEFAULT_ANALYTICS_WINDOW = Duration.ofDays(30);

    private final WorkflowService workflowService;

    public WorkflowController(WorkflowService workflowService) {
        this.workflowService = workflowService;
    }

    // ========== Definitions ==========

    @PostMapping("/workflows")
    public ResponseEntity<WorkflowDefinition> createWorkflow(@RequestBody WorkflowDefinition definition) {
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(workflowService.createWorkflow(definition));
    }

    @PutMapping("/workflows/{workflowId}")
    public ResponseEntity<WorkflowDefinition> updateWorkflow(
            @PathVariable String workflowId,
            @RequestBody WorkflowDefinition definition) {
        return ResponseEntity.ok(workflowService.updateWorkflow(workflowId, definition));
    }

    @DeleteMapping("/workflows/{workflowId}")
    public ResponseEntity<Void> deleteWorkflow(@PathVariable String workflowId) {
        workflowService.deleteWorkflow(workflowId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/workflows/{workflowId}")
    public ResponseEntity<WorkflowDefinition> getWorkflow(@PathVariable String workflowId) {
        return ResponseEntity.ok(workflowService.getWorkflow(workflowId));
    }

    @GetMapping("/workflows")
    public ResponseEntity<List<WorkflowDefinition>> listWorkflows(
            @RequestParam(required = false) String entityType) {
        return ResponseEntity.ok(workflowService.listWorkflows(entityType));
    }

    /**
     * Performance of a workflow; defaults to the last 30 days.
     */
    @GetMapping("/workflows/{workflowId}/analytics")
    public ResponseEntity<WorkflowAnalytics> analytics(
            @PathVariable String workflowId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to) {

        Instant end = to != null ? to : Instant.now();
        Instant start = from != null ? from : end.minus(DEFAULT_ANALYTICS_WINDOW);
        return ResponseEntity.ok(workflowService.analytics(workflowId, start, end));
    }

    // ========== Instances ==========

    /**
     * Attach a workflow to an entity.
     */
    @PostMapping("/workflows/{workflowId}/apply")
    public ResponseEntity<WorkflowInstanceResponse> applyWorkflow(
            @PathVariable String workflowId,
            @RequestBody ApplyWorkflowRequest request) {

        WorkflowInstance instance = workflowService.applyWorkflow(
            workflowId, request.entityType(), request.entityId(), request.actorId());

        return ResponseEntity.status(HttpStatus.CREATED)
            .body(WorkflowInstanceResponse.from(instance));
    }

    @GetMapping("/workflow-instances/{instanceId}")
    public ResponseEntity<WorkflowInstance> getInstance(@PathVariable String instanceId) {
        return ResponseEntity.ok(workflowService.getInstance(instanceId));
    }

    @GetMapping("/entities/{entityType}/{entityId}/workflow")
    public ResponseEntity<WorkflowInstanceResponse> findInstance(
            @PathVariable String entityType,
            @PathVariable String entityId) {

        WorkflowInstance instance = workflowService.findInstance(entityType, entityId)
            .orElseThrow(() -> new NotFoundException("WorkflowInstance", entityType + "/" + entityId));
        return ResponseEntity.ok(WorkflowInstanceResponse.from(instance));
    }

    @PostMapping("/workflow-instances/{instanceId}/transitions")
    public ResponseEntity<WorkflowInstanceResponse> transition(
            @PathVariable String instanceId,
            @RequestBody TransitionRequestDto request) {

        WorkflowInstance instance = workflowService.transition(new TransitionRequest(
            instanceId,
            request.toStateId(),
            request.actorId(),
            request.comment(),
            request.fieldUpdates()
        ));
        return ResponseEntity.ok(WorkflowInstanceResponse.from(instance));
    }

    @PostMapping("/workflow-instances/{instanceId}/approvals")
    public ResponseEntity<WorkflowInstanceResponse> approve(
            @PathVariable String instanceId,
            @RequestBody ApprovalRequest request) {

        WorkflowInstance instance = workflowService.approve(instanceId, request.actorId(), request.comment());
        return ResponseEntity.ok(WorkflowInstanceResponse.from(instance));
    }

    @GetMapping("/workflow-instances/{instanceId}/transitions")
    public ResponseEntity<List<TransitionDefinition>> availableTransitions(
            @PathVariable String instanceId,
            @RequestParam String actorId) {
        return ResponseEntity.ok(workflowService.availableTransitions(instanceId, actorId));
    }

    // ========== DTOs ==========

    public record ApplyWorkflowRequest(
        String entityType,
        String entityId,
        String actorId
    ) {}

    public record TransitionRequestDto(
        String toStateId,
        String actorId,
        String comment,
        Map<String, FieldValue> fieldUpdates
    ) {}

    public record ApprovalRequest(
        String actorId,
        String comment
    ) {}

    public record WorkflowInstanceResponse(
        String id,
        String workflowId,
        int workflowVersion,
        String entityType,
        String entityId,
        String currentStateId,
        String previousStateId,
        Set<String> activeStates,
        int totalTransitions,
        boolean completed,
        Instant startedAt,
        Instant completedAt,
        Instant lastTransitionAt
    ) {
        public static WorkflowInstanceResponse from(WorkflowInstance instance) {
            return new WorkflowInstanceResponse(
                instance.id(),
                instance.workflowId(),
                instance.workflowVersion(),
                instance.entityType(),
                instance.entityId(),
                instance.currentStateId(),
                instance.previousStateId(),
                instance.activeStates(),
                instance.totalTransitions(),
                instance.completed(),
                instance.startedAt(),
                instance.completedAt(),
                instance.lastTransitionAt()
            );
        }
    }
}
