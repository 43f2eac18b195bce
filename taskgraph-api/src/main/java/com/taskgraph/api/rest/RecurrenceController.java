package com.taskgraph.api.rest;

import com.taskgraph.core.exception.ValidationException;
import com.taskgraph.core.model.recurrence.RecurrencePattern;
import com.taskgraph.core.model.recurrence.RecurrencePreview;
import com.taskgraph.core.model.recurrence.RecurringTask;
import com.taskgraph.scheduler.MaterializationReport;
import com.taskgraph.scheduler.RecurringTaskService;
import com.taskgraph.scheduler.RecurringTaskService.CreateRecurringTaskRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * REST API for recurring tasks.
 */
@RestController
@RequestMapping("/api/v1/recurring-tasks")
public class RecurrenceController {

    private static final int DEFAULT_PREVIEW_COUNT = 10;

    private final RecurringTaskService recurringTaskService;

    public RecurrenceController(RecurringTaskService recurringTaskService) {
        this.recurringTaskService = recurringTaskService;
    }

    /**
     * Turn a template task into a recurring generator.
     */
    @PostMapping
    public ResponseEntity<RecurringTaskResponse> create(@RequestBody CreateRecurringTaskRequestDto request) {
        RecurringTask recurringTask = recurringTaskService.createRecurringTask(new CreateRecurringTaskRequest(
            request.templateTaskId(),
            request.pattern(),
            request.anchorDate(),
            request.titleTemplate(),
            request.descriptionTemplate(),
            request.boardId(),
            request.listId(),
            request.autoCreateDaysAhead(),
            Boolean.TRUE.equals(request.skipWeekends()),
            request.adjustDueDate(),
            request.assigneeId(),
            request.priority(),
            request.tags(),
            request.createdBy()
        ));

        return ResponseEntity.status(HttpStatus.CREATED)
            .body(RecurringTaskResponse.from(recurringTask));
    }

    @GetMapping("/{recurringTaskId}")
    public ResponseEntity<RecurringTaskResponse> get(@PathVariable String recurringTaskId) {
        return ResponseEntity.ok(RecurringTaskResponse.from(recurringTaskService.getRecurringTask(recurringTaskId)));
    }

    @GetMapping
    public ResponseEntity<List<RecurringTaskResponse>> list(@RequestParam String projectId) {
        return ResponseEntity.ok(recurringTaskService.listRecurringTasks(projectId).stream()
            .map(RecurringTaskResponse::from)
            .toList());
    }

    @PostMapping("/{recurringTaskId}/deactivate")
    public ResponseEntity<RecurringTaskResponse> deactivate(@PathVariable String recurringTaskId) {
        return ResponseEntity.ok(RecurringTaskResponse.from(recurringTaskService.deactivate(recurringTaskId)));
    }

    /**
     * Upcoming occurrences of a pattern, without storing anything.
     */
    @PostMapping("/preview")
    public ResponseEntity<RecurrencePreview> preview(@RequestBody PreviewRequest request) {
        if (request.pattern() == null) {
            throw new ValidationException("pattern", "is required");
        }
        LocalDate start = request.startDate() != null ? request.startDate() : LocalDate.now(request.pattern().zone());
        int count = request.count() != null ? request.count() : DEFAULT_PREVIEW_COUNT;
        return ResponseEntity.ok(recurringTaskService.preview(request.pattern(), start, count));
    }

    /**
     * Run the materializer immediately.
     */
    @PostMapping("/materialize")
    public ResponseEntity<MaterializationReport> materializeNow() {
        return ResponseEntity.ok(recurringTaskService.materializeNow());
    }

    // ========== DTOs ==========

    public record CreateRecurringTaskRequestDto(
        String templateTaskId,
        RecurrencePattern pattern,
        LocalDate anchorDate,
        String titleTemplate,
        String descriptionTemplate,
        String boardId,
        String listId,
        Integer autoCreateDaysAhead,
        Boolean skipWeekends,
        Boolean adjustDueDate,
        String assigneeId,
        String priority,
        List<String> tags,
        String createdBy
    ) {}

    public record PreviewRequest(
        RecurrencePattern pattern,
        LocalDate startDate,
        Integer count
    ) {}

    public record RecurringTaskResponse(
        String id,
        String templateTaskId,
        String projectId,
        RecurrencePattern pattern,
        LocalDate anchorDate,
        int autoCreateDaysAhead,
        boolean skipWeekends,
        boolean adjustDueDate,
        Instant nextOccurrence,
        Instant lastCreated,
        int occurrencesCreated,
        List<String> createdInstances,
        int failureCount,
        boolean active,
        Instant createdAt
    ) {
        public static RecurringTaskResponse from(RecurringTask recurringTask) {
            return new RecurringTaskResponse(
                recurringTask.id(),
                recurringTask.templateTaskId(),
                recurringTask.projectId(),
                recurringTask.pattern(),
                recurringTask.anchorDate(),
                recurringTask.autoCreateDaysAhead(),
                recurringTask.skipWeekends(),
                recurringTask.adjustDueDate(),
                recurringTask.nextOccurrence(),
                recurringTask.lastCreated(),
                recurringTask.occurrencesCreated(),
                recurringTask.createdInstances(),
                recurringTask.failures().size(),
                recurringTask.active(),
                recurringTask.createdAt()
            );
        }
    }
}
