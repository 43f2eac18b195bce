package com.taskgraph.engine.persistence;

import com.taskgraph.core.condition.FieldValue;
import com.taskgraph.core.exception.NotFoundException;
import com.taskgraph.core.model.task.TaskFields;
import com.taskgraph.core.model.task.TaskRecord;
import com.taskgraph.core.spi.TaskStore;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory TaskStore for running the engine standalone and for tests.
 * Unknown field names are kept as custom fields.
 */
@Repository
public class InMemoryTaskStore implements TaskStore {

    private static final Set<String> STANDARD_FIELDS = Set.of(
        TaskFields.ID, TaskFields.PROJECT_ID, TaskFields.BOARD_ID, TaskFields.PARENT_TASK_ID,
        TaskFields.STATUS, TaskFields.TITLE, TaskFields.DESCRIPTION, TaskFields.ASSIGNEE_ID,
        TaskFields.PRIORITY, TaskFields.TAGS, TaskFields.DUE_DATE, TaskFields.CREATED_AT
    );

    private final Map<String, TaskRecord> tasks = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryTaskStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Optional<TaskRecord> get(String taskId) {
        return Optional.ofNullable(tasks.get(taskId));
    }

    @Override
    public String create(Map<String, FieldValue> fields) {
        String taskId = UUID.randomUUID().toString();
        TaskRecord blank = new TaskRecord(taskId, null, null, null, "todo", null, null, null,
            null, List.of(), null, clock.instant(), Map.of());
        tasks.put(taskId, merge(blank, fields));
        return taskId;
    }

    @Override
    public void update(String taskId, Map<String, FieldValue> fields) {
        tasks.compute(taskId, (id, existing) -> {
            if (existing == null) {
                throw new NotFoundException("Task", taskId);
            }
            return merge(existing, fields);
        });
    }

    /**
     * Insert or replace a task as-is.
     */
    public void put(TaskRecord task) {
        tasks.put(task.id(), task);
    }

    public List<TaskRecord> findByProject(String projectId) {
        return tasks.values().stream()
            .filter(t -> projectId.equals(t.projectId()))
            .collect(Collectors.toList());
    }

    public int size() {
        return tasks.size();
    }

    private static TaskRecord merge(TaskRecord base, Map<String, FieldValue> fields) {
        Map<String, FieldValue> custom = new HashMap<>(base.customFields());
        fields.forEach((name, value) -> {
            if (!STANDARD_FIELDS.contains(name)) {
                custom.put(name, value);
            }
        });
        return new TaskRecord(
            base.id(),
            text(fields, TaskFields.PROJECT_ID, base.projectId()),
            text(fields, TaskFields.BOARD_ID, base.boardId()),
            text(fields, TaskFields.PARENT_TASK_ID, base.parentTaskId()),
            text(fields, TaskFields.STATUS, base.status()),
            text(fields, TaskFields.TITLE, base.title()),
            text(fields, TaskFields.DESCRIPTION, base.description()),
            text(fields, TaskFields.ASSIGNEE_ID, base.assigneeId()),
            text(fields, TaskFields.PRIORITY, base.priority()),
            fields.containsKey(TaskFields.TAGS) ? tags(fields.get(TaskFields.TAGS)) : base.tags(),
            fields.containsKey(TaskFields.DUE_DATE)
                ? fields.get(TaskFields.DUE_DATE).asDate().orElse(null)
                : base.dueDate(),
            base.createdAt(),
            custom
        );
    }

    private static String text(Map<String, FieldValue> fields, String name, String current) {
        if (!fields.containsKey(name)) {
            return current;
        }
        FieldValue value = fields.get(name);
        return value.isEmpty() ? null : value.asText();
    }

    private static List<String> tags(FieldValue value) {
        if (value instanceof FieldValue.ListValue list) {
            return list.values().stream().map(FieldValue::asText).collect(Collectors.toList());
        }
        return value.isEmpty() ? List.of() : List.of(value.asText());
    }
}
