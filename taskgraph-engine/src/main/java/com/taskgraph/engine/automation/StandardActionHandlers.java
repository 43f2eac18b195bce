package com.taskgraph.engine.automation;

import com.taskgraph.core.condition.FieldValue;
import com.taskgraph.core.model.automation.Action;
import com.taskgraph.core.model.automation.ActionType;
import com.taskgraph.core.model.automation.AutomationLog;
import com.taskgraph.core.model.automation.ChangeRecord;
import com.taskgraph.core.model.automation.LogStatus;
import com.taskgraph.core.model.task.TaskFields;
import com.taskgraph.core.model.task.TaskRecord;
import com.taskgraph.core.spi.NotificationSink;
import com.taskgraph.core.spi.TaskStore;
import com.taskgraph.engine.entity.EntityAccessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The built-in action handlers: field and status updates, assignment, task creation,
 * notifications and rule chaining.
 */
public final class StandardActionHandlers {

    private static final Logger log = LoggerFactory.getLogger(StandardActionHandlers.class);

    private StandardActionHandlers() {
    }

    /**
     * Registry holding every standard handler.
     */
    public static ActionHandlerRegistry registry(EntityAccessor entities, TaskStore taskStore,
                                                 NotificationSink notifications) {
        return new ActionHandlerRegistry(all(entities, taskStore, notifications));
    }

    public static List<ActionHandler> all(EntityAccessor entities, TaskStore taskStore,
                                          NotificationSink notifications) {
        return List.of(
            new FieldUpdateHandler(ActionType.UPDATE_FIELD, entities),
            new FieldUpdateHandler(ActionType.CHANGE_STATUS, entities),
            new FieldUpdateHandler(ActionType.ASSIGN_USER, entities),
            new FieldUpdateHandler(ActionType.UNASSIGN_USER, entities),
            new CreateTaskHandler(ActionType.CREATE_TASK, entities, taskStore),
            new CreateTaskHandler(ActionType.CREATE_SUBTASK, entities, taskStore),
            new NotificationHandler(notifications),
            new RunAutomationHandler()
        );
    }

    // ========== Field updates ==========

    /**
     * update_field, change_status, assign_user and unassign_user all write one field.
     */
    static final class FieldUpdateHandler implements ActionHandler {

        private final ActionType type;
        private final EntityAccessor entities;

        FieldUpdateHandler(ActionType type, EntityAccessor entities) {
            this.type = type;
            this.entities = entities;
        }

        @Override
        public ActionType type() {
            return type;
        }

        @Override
        public ChangeRecord execute(Action action, ActionContext context) {
            Map.Entry<String, FieldValue> write = target(action);
            boolean written = entities.update(context.entityType(), context.entityId(),
                Map.of(write.getKey(), write.getValue()));
            if (!written) {
                return ChangeRecord.effect(type, context.entityType(), context.entityId(),
                    "skipped: entity type " + context.entityType() + " does not support updates", context.now());
            }
            return ChangeRecord.fieldChange(type, context.entityType(), context.entityId(),
                write.getKey(), context.field(write.getKey()), write.getValue(), context.now());
        }

        @Override
        public ChangeRecord preview(Action action, ActionContext context) {
            Map.Entry<String, FieldValue> write = target(action);
            return ChangeRecord.fieldChange(type, context.entityType(), context.entityId(),
                write.getKey(), context.field(write.getKey()), write.getValue(), context.now());
        }

        private Map.Entry<String, FieldValue> target(Action action) {
            switch (type) {
                case UPDATE_FIELD:
                    return Map.entry(require(type, action.fieldName(), "fieldName"), action.fieldValue());
                case CHANGE_STATUS:
                    return Map.entry(TaskFields.STATUS,
                        FieldValue.symbol(require(type, action.newStatus(), "newStatus")));
                case ASSIGN_USER:
                    return Map.entry(TaskFields.ASSIGNEE_ID,
                        FieldValue.text(require(type, action.assigneeId(), "assigneeId")));
                case UNASSIGN_USER:
                    return Map.entry(TaskFields.ASSIGNEE_ID, FieldValue.EMPTY);
                default:
                    throw new IllegalStateException("Not a field update: " + type);
            }
        }
    }

    // ========== Task creation ==========

    /**
     * create_task makes a sibling in the entity's project and board; create_subtask a child.
     */
    static final class CreateTaskHandler implements ActionHandler {

        private final ActionType type;
        private final EntityAccessor entities;
        private final TaskStore taskStore;

        CreateTaskHandler(ActionType type, EntityAccessor entities, TaskStore taskStore) {
            this.type = type;
            this.entities = entities;
            this.taskStore = taskStore;
        }

        @Override
        public ActionType type() {
            return type;
        }

        @Override
        public ChangeRecord execute(Action action, ActionContext context) {
            Map<String, FieldValue> fields = newTaskFields(action, context);
            String taskId = taskStore.create(fields);
            log.debug("Rule {} created task {} from {}:{}", context.rule().id(), taskId,
                context.entityType(), context.entityId());
            return new ChangeRecord(type, context.entityType(), context.entityId(), TaskFields.ID,
                FieldValue.EMPTY, FieldValue.text(taskId),
                "created task '" + action.taskTitle() + "'", null, context.now());
        }

        @Override
        public ChangeRecord preview(Action action, ActionContext context) {
            newTaskFields(action, context);
            return ChangeRecord.effect(type, context.entityType(), context.entityId(),
                "would create task '" + action.taskTitle() + "'", context.now());
        }

        private Map<String, FieldValue> newTaskFields(Action action, ActionContext context) {
            String title = require(type, action.taskTitle(), "taskTitle");
            Optional<TaskRecord> source = entities.task(context.entityType(), context.entityId());
            if (type == ActionType.CREATE_SUBTASK && source.isEmpty()) {
                throw new ActionExecutionException(type,
                    "Cannot create subtask: " + context.entityType() + " " + context.entityId() + " is not a known task");
            }

            Map<String, FieldValue> fields = new LinkedHashMap<>();
            fields.put(TaskFields.TITLE, FieldValue.text(title));
            fields.put(TaskFields.DESCRIPTION, FieldValue.text(action.taskDescription()));
            source.ifPresent(task -> {
                fields.put(TaskFields.PROJECT_ID, FieldValue.text(task.projectId()));
                fields.put(TaskFields.BOARD_ID, FieldValue.text(task.boardId()));
            });
            if (type == ActionType.CREATE_SUBTASK) {
                fields.put(TaskFields.PARENT_TASK_ID, FieldValue.text(context.entityId()));
            }
            return fields;
        }
    }

    // ========== Notifications ==========

    /**
     * Notifies the listed users, or the entity's assignee when none are listed.
     * Delivery failures are logged per recipient and do not fail the action.
     */
    static final class NotificationHandler implements ActionHandler {

        private final NotificationSink notifications;

        NotificationHandler(NotificationSink notifications) {
            this.notifications = notifications;
        }

        @Override
        public ActionType type() {
            return ActionType.SEND_NOTIFICATION;
        }

        @Override
        public ChangeRecord execute(Action action, ActionContext context) {
            String message = require(type(), action.message(), "message");
            List<String> recipients = recipients(action, context);

            int delivered = 0;
            for (String userId : recipients) {
                try {
                    notifications.notify(userId, message);
                    delivered++;
                } catch (RuntimeException e) {
                    log.warn("Notification to user {} from rule {} failed", userId, context.rule().id(), e);
                }
            }
            return ChangeRecord.effect(type(), context.entityType(), context.entityId(),
                String.format("notified %d of %d user(s)", delivered, recipients.size()), context.now());
        }

        @Override
        public ChangeRecord preview(Action action, ActionContext context) {
            require(type(), action.message(), "message");
            return ChangeRecord.effect(type(), context.entityType(), context.entityId(),
                "would notify " + recipients(action, context), context.now());
        }

        private static List<String> recipients(Action action, ActionContext context) {
            if (!action.notifyUserIds().isEmpty()) {
                return action.notifyUserIds();
            }
            FieldValue assignee = context.field(TaskFields.ASSIGNEE_ID);
            if (assignee.isEmpty()) {
                throw new ActionExecutionException(ActionType.SEND_NOTIFICATION,
                    "No recipients: notifyUserIds is empty and the entity has no assignee");
            }
            return List.of(assignee.asText());
        }
    }

    // ========== Chaining ==========

    /**
     * Runs another rule against the same entity, one level deeper.
     */
    static final class RunAutomationHandler implements ActionHandler {

        @Override
        public ActionType type() {
            return ActionType.RUN_AUTOMATION;
        }

        @Override
        public ChangeRecord execute(Action action, ActionContext context) {
            String ruleId = require(type(), action.nextRuleId(), "nextRuleId");
            Optional<AutomationLog> chained = context.chain().run(ruleId);
            if (chained.isPresent() && chained.get().status() == LogStatus.FAILED) {
                throw new ActionExecutionException(type(),
                    "Chained rule " + ruleId + " failed: " + chained.get().errorMessage());
            }
            String outcome = chained.map(l -> l.status().name().toLowerCase()).orElse("not run");
            return ChangeRecord.effect(type(), context.entityType(), context.entityId(),
                "ran rule " + ruleId + ": " + outcome, context.now());
        }

        @Override
        public ChangeRecord preview(Action action, ActionContext context) {
            String ruleId = require(type(), action.nextRuleId(), "nextRuleId");
            return ChangeRecord.effect(type(), context.entityType(), context.entityId(),
                "would run rule " + ruleId, context.now());
        }
    }

    private static String require(ActionType type, String value, String parameter) {
        if (value == null || value.isBlank()) {
            throw new ActionExecutionException(type, type.name().toLowerCase() + " requires " + parameter);
        }
        return value;
    }
}
