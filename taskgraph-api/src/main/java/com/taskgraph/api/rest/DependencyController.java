package com.taskgraph.api.rest;

import com.taskgraph.core.model.dependency.Bottleneck;
import com.taskgraph.core.model.dependency.CriticalPathAnalysis;
import com.taskgraph.core.model.dependency.Dependency;
import com.taskgraph.core.model.dependency.DependencyGraph;
import com.taskgraph.core.model.dependency.DependencyType;
import com.taskgraph.core.model.dependency.DependencyValidationResult;
import com.taskgraph.core.model.task.TaskRecord;
import com.taskgraph.engine.service.DependencyService;
import com.taskgraph.engine.service.DependencyService.AddDependencyRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * REST API for task dependencies and schedule analysis.
 */
@RestController
@RequestMapping("/api/v1")
public class DependencyController {

    private final DependencyService dependencyService;

    public DependencyController(DependencyService dependencyService) {
        this.dependencyService = dependencyService;
    }

    /**
     * Add a dependency between two tasks.
     */
    @PostMapping("/dependencies")
    public ResponseEntity<DependencyResponse> addDependency(@RequestBody AddDependencyRequestDto request) {
        Dependency dependency = dependencyService.addDependency(new AddDependencyRequest(
            request.sourceTaskId(),
            request.targetTaskId(),
            request.type(),
            request.lagDays() != null ? request.lagDays() : 0,
            request.notes(),
            request.actorId()
        ));

        return ResponseEntity.status(HttpStatus.CREATED)
            .body(DependencyResponse.from(dependency));
    }

    @GetMapping("/dependencies/{dependencyId}")
    public ResponseEntity<DependencyResponse> getDependency(@PathVariable String dependencyId) {
        return ResponseEntity.ok(DependencyResponse.from(dependencyService.getDependency(dependencyId)));
    }

    @DeleteMapping("/dependencies/{dependencyId}")
    public ResponseEntity<Void> removeDependency(@PathVariable String dependencyId) {
        dependencyService.removeDependency(dependencyId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/projects/{projectId}/dependencies")
    public ResponseEntity<List<DependencyResponse>> listDependencies(@PathVariable String projectId) {
        return ResponseEntity.ok(dependencyService.listDependencies(projectId).stream()
            .map(DependencyResponse::from)
            .toList());
    }

    @GetMapping("/tasks/{taskId}/dependencies")
    public ResponseEntity<List<DependencyResponse>> dependenciesOf(@PathVariable String taskId) {
        return ResponseEntity.ok(dependencyService.dependenciesOf(taskId).stream()
            .map(DependencyResponse::from)
            .toList());
    }

    /**
     * Tasks that must complete before the given task can start.
     */
    @GetMapping("/tasks/{taskId}/blocking")
    public ResponseEntity<BlockingResponse> blockingTasks(@PathVariable String taskId) {
        List<TaskRecord> blocking = dependencyService.blockingTasks(taskId);
        return ResponseEntity.ok(new BlockingResponse(
            taskId,
            blocking.isEmpty(),
            blocking.stream().map(BlockingTask::from).toList()
        ));
    }

    /**
     * Notify the successors of a completed task.
     */
    @PostMapping("/tasks/{taskId}/completed")
    public ResponseEntity<Map<String, Object>> taskCompleted(@PathVariable String taskId) {
        int notified = dependencyService.taskCompleted(taskId);
        return ResponseEntity.ok(Map.of(
            "taskId", taskId,
            "successorsNotified", notified
        ));
    }

    @GetMapping("/projects/{projectId}/cycles")
    public ResponseEntity<List<List<String>>> findCycles(@PathVariable String projectId) {
        return ResponseEntity.ok(dependencyService.findCycles(projectId));
    }

    /**
     * Critical path with durations estimated from task dates.
     */
    @GetMapping("/projects/{projectId}/critical-path")
    public ResponseEntity<CriticalPathAnalysis> criticalPath(@PathVariable String projectId) {
        return ResponseEntity.ok(dependencyService.criticalPath(projectId));
    }

    /**
     * Critical path with explicit durations and start date.
     */
    @PostMapping("/projects/{projectId}/critical-path")
    public ResponseEntity<CriticalPathAnalysis> criticalPathWithDurations(
            @PathVariable String projectId,
            @RequestBody CriticalPathRequest request) {

        Map<String, Integer> durations = request.durations() != null ? request.durations() : Map.of();
        LocalDate startDate = request.startDate() != null ? request.startDate() : LocalDate.now();
        return ResponseEntity.ok(dependencyService.criticalPath(projectId, durations, startDate));
    }

    @GetMapping("/projects/{projectId}/graph")
    public ResponseEntity<DependencyGraph> exportGraph(@PathVariable String projectId) {
        return ResponseEntity.ok(dependencyService.exportGraph(projectId));
    }

    @GetMapping("/projects/{projectId}/dependencies/validation")
    public ResponseEntity<DependencyValidationResult> validateDependencies(@PathVariable String projectId) {
        return ResponseEntity.ok(dependencyService.validateDependencies(projectId));
    }

    @GetMapping("/projects/{projectId}/bottlenecks")
    public ResponseEntity<List<Bottleneck>> bottlenecks(@PathVariable String projectId) {
        return ResponseEntity.ok(dependencyService.identifyBottlenecks(projectId));
    }

    // ========== DTOs ==========

    public record AddDependencyRequestDto(
        String sourceTaskId,
        String targetTaskId,
        DependencyType type,
        Integer lagDays,
        String notes,
        String actorId
    ) {}

    public record CriticalPathRequest(
        Map<String, Integer> durations,
        LocalDate startDate
    ) {}

    public record DependencyResponse(
        String id,
        String projectId,
        String sourceTaskId,
        String targetTaskId,
        DependencyType type,
        int lagDays,
        boolean scheduling,
        String notes,
        String createdBy,
        Instant createdAt
    ) {
        public static DependencyResponse from(Dependency dependency) {
            return new DependencyResponse(
                dependency.id(),
                dependency.projectId(),
                dependency.sourceTaskId(),
                dependency.targetTaskId(),
                dependency.type(),
                dependency.lagDays(),
                dependency.isScheduling(),
                dependency.notes(),
                dependency.createdBy(),
                dependency.createdAt()
            );
        }
    }

    public record BlockingResponse(
        String taskId,
        boolean canStart,
        List<BlockingTask> blockedBy
    ) {}

    public record BlockingTask(
        String taskId,
        String title,
        String status,
        LocalDate dueDate
    ) {
        public static BlockingTask from(TaskRecord task) {
            return new BlockingTask(task.id(), task.title(), task.status(), task.dueDate());
        }
    }
}
