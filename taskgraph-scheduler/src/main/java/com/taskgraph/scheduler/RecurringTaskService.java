package com.taskgraph.scheduler;

import com.taskgraph.core.model.recurrence.RecurrencePattern;
import com.taskgraph.core.model.recurrence.RecurrencePreview;
import com.taskgraph.core.model.recurrence.RecurringTask;

import java.time.LocalDate;
import java.util.List;

/**
 * Recurring tasks: generator management, previews and on-demand materialization.
 */
public interface RecurringTaskService {

    /**
     * Register a generator for a template task.
     *
     * @param request The generator definition
     * @return The stored generator with its first occurrence computed
     * @throws com.taskgraph.core.exception.NotFoundException if the template task does not exist
     * @throws com.taskgraph.core.exception.ValidationException if the pattern is malformed
     */
    RecurringTask createRecurringTask(CreateRecurringTaskRequest request);

    RecurringTask getRecurringTask(String recurringTaskId);

    /**
     * Generators of a project, oldest first.
     */
    List<RecurringTask> listRecurringTasks(String projectId);

    /**
     * Stop a generator. Tasks it already created are kept.
     */
    RecurringTask deactivate(String recurringTaskId);

    /**
     * Upcoming occurrences of a pattern without creating anything.
     *
     * @param pattern The pattern to preview
     * @param start First date that may hold an occurrence
     * @param count Number of dates to examine
     */
    RecurrencePreview preview(RecurrencePattern pattern, LocalDate start, int count);

    /**
     * Run the materializer once, now.
     */
    MaterializationReport materializeNow();

    /**
     * Request to create a recurring task.
     * Null placement and template fields fall back to the template task's own values.
     */
    record CreateRecurringTaskRequest(
        String templateTaskId,
        RecurrencePattern pattern,
        LocalDate anchorDate,
        String titleTemplate,
        String descriptionTemplate,
        String boardId,
        String listId,
        Integer autoCreateDaysAhead,
        boolean skipWeekends,
        Boolean adjustDueDate,
        String assigneeId,
        String priority,
        List<String> tags,
        String createdBy
    ) {
        public CreateRecurringTaskRequest {
            tags = tags == null ? List.of() : List.copyOf(tags);
        }

        public static CreateRecurringTaskRequest of(String templateTaskId, RecurrencePattern pattern,
                                                    String titleTemplate, String createdBy) {
            return new CreateRecurringTaskRequest(templateTaskId, pattern, null, titleTemplate, null,
                null, null, null, false, null, null, null, List.of(), createdBy);
        }
    }
}
