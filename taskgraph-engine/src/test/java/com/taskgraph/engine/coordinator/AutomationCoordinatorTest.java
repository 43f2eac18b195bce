package com.taskgraph.engine.coordinator;

import com.taskgraph.core.condition.Condition;
import com.taskgraph.core.condition.ConditionOperator;
import com.taskgraph.core.condition.FieldValue;
import com.taskgraph.core.exception.NotFoundException;
import com.taskgraph.core.exception.ValidationException;
import com.taskgraph.core.model.automation.Action;
import com.taskgraph.core.model.automation.ActionType;
import com.taskgraph.core.model.automation.AutomationAnalytics;
import com.taskgraph.core.model.automation.AutomationEvent;
import com.taskgraph.core.model.automation.AutomationLog;
import com.taskgraph.core.model.automation.AutomationPolicy;
import com.taskgraph.core.model.automation.AutomationRule;
import com.taskgraph.core.model.automation.ChangeRecord;
import com.taskgraph.core.model.automation.LogStatus;
import com.taskgraph.core.model.automation.RuleScope;
import com.taskgraph.core.model.automation.RuleTestResult;
import com.taskgraph.core.model.automation.Trigger;
import com.taskgraph.core.model.automation.TriggerType;
import com.taskgraph.core.model.task.TaskFields;
import com.taskgraph.core.model.task.TaskRecord;
import com.taskgraph.core.spi.NotificationSink;
import com.taskgraph.engine.automation.StandardActionHandlers;
import com.taskgraph.engine.metrics.EngineMetrics;
import com.taskgraph.engine.test.EngineFixture;
import com.taskgraph.engine.test.RecordingNotificationSink;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

class AutomationCoordinatorTest {

    private EngineFixture fixture;
    private AutomationCoordinator coordinator;

    @BeforeEach
    void setUp() {
        fixture = new EngineFixture();
        coordinator = fixture.automation;
        fixture.task("T1", "p1");
        fixture.task("T2", "p2");
    }

    private AutomationRule.Builder onDone(String id, Action... actions) {
        return AutomationRule.builder()
            .id(id)
            .name("Rule " + id)
            .triggers(List.of(Trigger.statusChanged("todo", "done")))
            .actions(List.of(actions))
            .createdBy("admin");
    }

    private void complete(String taskId) {
        fixture.events.publish(AutomationEvent.statusChanged("task", taskId, "todo", "done", fixture.clock.instant()));
    }

    private List<AutomationLog> statusChanged(String taskId, String from, String to) {
        return coordinator.executeRules(TriggerType.STATUS_CHANGED, "task", taskId, Map.of(
            AutomationEvent.FROM_STATUS, FieldValue.symbol(from),
            AutomationEvent.TO_STATUS, FieldValue.symbol(to)));
    }

    // ========== Rule Management ==========

    @Nested
    @DisplayName("Rule management")
    class ManagementTests {

        @Test
        @DisplayName("Should reject rules without triggers or actions")
        void testValidation() {
            assertThatThrownBy(() -> coordinator.createRule(onDone("r1").build()))
                .isInstanceOf(ValidationException.class)
                .extracting("field").isEqualTo("actions");
            assertThatThrownBy(() -> coordinator.createRule(
                onDone("r1", Action.changeStatus("done")).triggers(List.of()).build()))
                .isInstanceOf(ValidationException.class)
                .extracting("field").isEqualTo("triggers");
            assertThatThrownBy(() -> coordinator.createRule(
                onDone("r1", Action.changeStatus("done")).maxExecutionsPerDay(0).build()))
                .isInstanceOf(ValidationException.class);
        }

        @Test
        @DisplayName("Update keeps execution statistics")
        void testUpdateKeepsStatistics() {
            coordinator.createRule(onDone("r1", Action.updateField(TaskFields.PRIORITY, "low")).build());
            complete("T1");

            AutomationRule updated = coordinator.updateRule("r1",
                onDone("ignored", Action.updateField(TaskFields.PRIORITY, "high")).name("Renamed").build());

            assertThat(updated.id()).isEqualTo("r1");
            assertThat(updated.name()).isEqualTo("Renamed");
            assertThat(updated.executionCount()).isEqualTo(1);
            assertThat(updated.lastExecution()).isEqualTo(fixture.clock.instant());
        }

        @Test
        @DisplayName("Delete removes the rule")
        void testDelete() {
            coordinator.createRule(onDone("r1", Action.changeStatus("done")).build());

            coordinator.deleteRule("r1");

            assertThat(coordinator.listRules()).isEmpty();
            assertThatThrownBy(() -> coordinator.getRule("r1")).isInstanceOf(NotFoundException.class);
        }
    }

    // ========== Execution ==========

    @Nested
    @DisplayName("Execution")
    class ExecutionTests {

        @Test
        @DisplayName("Matching event runs the rule and records the change")
        void testSuccess() {
            coordinator.createRule(onDone("r1", Action.updateField(TaskFields.PRIORITY, "low")).build());

            complete("T1");

            List<AutomationLog> logs = coordinator.logs("r1");
            assertThat(logs).singleElement().satisfies(log -> {
                assertThat(log.status()).isEqualTo(LogStatus.SUCCESS);
                assertThat(log.triggerType()).isEqualTo(TriggerType.STATUS_CHANGED);
                assertThat(log.actionsExecuted()).containsExactly(ActionType.UPDATE_FIELD);
                assertThat(log.changes()).singleElement().satisfies(change -> {
                    assertThat(change.field()).isEqualTo(TaskFields.PRIORITY);
                    assertThat(change.previousValue().asText()).isEqualTo("medium");
                    assertThat(change.newValue().asText()).isEqualTo("low");
                    assertThat(change.failed()).isFalse();
                });
                assertThat(log.errorMessage()).isNull();
            });
            assertThat(fixture.reload("T1").priority()).isEqualTo("low");
            assertThat(coordinator.getRule("r1").executionCount()).isEqualTo(1);
            assertThat(fixture.meterRegistry.counter(EngineMetrics.RULE_EXECUTIONS, "outcome", "success").count())
                .isEqualTo(1.0);
        }

        @Test
        @DisplayName("Trigger filter mismatch is logged as skipped")
        void testTriggerMismatch() {
            coordinator.createRule(onDone("r1", Action.updateField(TaskFields.PRIORITY, "low")).build());

            List<AutomationLog> logs = statusChanged("T1", "doing", "done");

            assertThat(logs).singleElement().satisfies(log -> {
                assertThat(log.status()).isEqualTo(LogStatus.SKIPPED);
                assertThat(log.errorMessage()).isEqualTo("No trigger matched");
            });
            assertThat(fixture.reload("T1").priority()).isEqualTo("medium");
            assertThat(coordinator.getRule("r1").executionCount()).isZero();
        }

        @Test
        @DisplayName("Failing conditions are logged as skipped")
        void testConditionsNotMet() {
            coordinator.createRule(onDone("r1", Action.updateField(TaskFields.PRIORITY, "low"))
                .conditions(List.of(Condition.of(TaskFields.PRIORITY, ConditionOperator.EQUALS, FieldValue.symbol("high"))))
                .build());

            assertThat(statusChanged("T1", "todo", "done")).singleElement()
                .satisfies(log -> {
                    assertThat(log.status()).isEqualTo(LogStatus.SKIPPED);
                    assertThat(log.errorMessage()).isEqualTo("Conditions not met");
                });
        }

        @Test
        @DisplayName("stopOnError fails the rule at the first failing action")
        void testStopOnError() {
            coordinator.createRule(onDone("r1",
                Action.of(ActionType.WEBHOOK),
                Action.updateField(TaskFields.PRIORITY, "low")).build());

            AutomationLog log = statusChanged("T1", "todo", "done").get(0);

            assertThat(log.status()).isEqualTo(LogStatus.FAILED);
            assertThat(log.actionsExecuted()).containsExactly(ActionType.WEBHOOK);
            assertThat(log.errorMessage()).isEqualTo("webhook: No handler registered for action type webhook");
            assertThat(fixture.reload("T1").priority()).isEqualTo("medium");
            assertThat(coordinator.getRule("r1").executionCount()).isZero();
            assertThat(fixture.meterRegistry.counter(EngineMetrics.ACTION_FAILURES, "action", "webhook").count())
                .isEqualTo(1.0);
        }

        @Test
        @DisplayName("Without stopOnError the remaining actions still run")
        void testContinueOnError() {
            coordinator.createRule(onDone("r1",
                Action.of(ActionType.WEBHOOK),
                Action.updateField(TaskFields.PRIORITY, "low")).stopOnError(false).build());

            AutomationLog log = statusChanged("T1", "todo", "done").get(0);

            assertThat(log.status()).isEqualTo(LogStatus.SUCCESS);
            assertThat(log.actionsExecuted()).containsExactly(ActionType.WEBHOOK, ActionType.UPDATE_FIELD);
            assertThat(log.changes()).extracting(ChangeRecord::failed).containsExactly(true, false);
            assertThat(log.errorMessage()).contains("No handler registered");
            assertThat(fixture.reload("T1").priority()).isEqualTo("low");
        }

        @Test
        @DisplayName("Out-of-scope entities leave no log")
        void testScopeExclusion() {
            coordinator.createRule(onDone("r1", Action.updateField(TaskFields.PRIORITY, "low"))
                .scope(RuleScope.projects(Set.of("p2")))
                .build());

            assertThat(statusChanged("T1", "todo", "done")).isEmpty();
            assertThat(coordinator.logs("r1")).isEmpty();

            assertThat(statusChanged("T2", "todo", "done")).hasSize(1);
        }

        @Test
        @DisplayName("Subtasks are excluded when the scope says so")
        void testSubtaskScope() {
            fixture.taskStore.put(new TaskRecord("S1", "p1", "board-1", "T1", "todo", "Sub", null, null,
                "medium", List.of(), null, fixture.clock.instant(), Map.of()));
            coordinator.createRule(onDone("r1", Action.updateField(TaskFields.PRIORITY, "low"))
                .scope(new RuleScope(Set.of(), Set.of(), false))
                .build());

            assertThat(statusChanged("S1", "todo", "done")).isEmpty();
            assertThat(statusChanged("T1", "todo", "done")).hasSize(1);
        }

        @Test
        @DisplayName("Daily cap stops further runs until the next day")
        void testDailyCap() {
            coordinator.createRule(onDone("r1", Action.updateField(TaskFields.PRIORITY, "low"))
                .maxExecutionsPerDay(2)
                .build());

            complete("T1");
            complete("T1");
            complete("T1");
            assertThat(coordinator.logs("r1")).hasSize(2);

            fixture.clock.advanceDays(1);
            complete("T1");
            assertThat(coordinator.logs("r1")).hasSize(3);
        }

        @Test
        @DisplayName("Inactive rules do not run")
        void testInactive() {
            coordinator.createRule(onDone("r1", Action.updateField(TaskFields.PRIORITY, "low")).build());
            coordinator.setActive("r1", false);

            complete("T1");
            assertThat(coordinator.executeRule("r1", "task", "T1", Map.of())).isEmpty();

            assertThat(coordinator.logs("r1")).isEmpty();
        }

        @Test
        @DisplayName("Direct execution bypasses triggers")
        void testExecuteRule() {
            coordinator.createRule(onDone("r1", Action.assignUser("alice")).build());

            AutomationLog log = coordinator.executeRule("r1", "task", "T1", null).orElseThrow();

            assertThat(log.status()).isEqualTo(LogStatus.SUCCESS);
            assertThat(log.triggerType()).isEqualTo(TriggerType.MANUAL);
            assertThat(fixture.reload("T1").assigneeId()).isEqualTo("alice");
        }

        @Test
        @DisplayName("Unknown rule cannot be executed")
        void testExecuteUnknown() {
            assertThatThrownBy(() -> coordinator.executeRule("nope", "task", "T1", Map.of()))
                .isInstanceOf(NotFoundException.class);
        }
    }

    // ========== Actions ==========

    @Nested
    @DisplayName("Actions")
    class ActionTests {

        @Test
        @DisplayName("Status change and unassignment write the task")
        void testStatusAndUnassign() {
            fixture.taskStore.update("T1", Map.of(TaskFields.ASSIGNEE_ID, FieldValue.text("alice")));
            coordinator.createRule(onDone("r1", Action.changeStatus("archived"), Action.unassignUser()).build());

            coordinator.executeRule("r1", "task", "T1", Map.of());

            TaskRecord task = fixture.reload("T1");
            assertThat(task.status()).isEqualTo("archived");
            assertThat(task.assigneeId()).isNull();
        }

        @Test
        @DisplayName("Subtask is created under the entity in its project")
        void testCreateSubtask() {
            coordinator.createRule(onDone("r1", Action.createSubtask("Write release notes", "for the sprint")).build());

            AutomationLog log = coordinator.executeRule("r1", "task", "T1", Map.of()).orElseThrow();

            String subtaskId = log.changes().get(0).newValue().asText();
            TaskRecord subtask = fixture.reload(subtaskId);
            assertThat(subtask.parentTaskId()).isEqualTo("T1");
            assertThat(subtask.projectId()).isEqualTo("p1");
            assertThat(subtask.boardId()).isEqualTo("board-1");
            assertThat(subtask.title()).isEqualTo("Write release notes");
        }

        @Test
        @DisplayName("Subtask of an unknown entity fails the action")
        void testCreateSubtaskUnknown() {
            coordinator.createRule(onDone("r1", Action.createSubtask("Follow up", null)).build());

            AutomationLog log = coordinator.executeRule("r1", "project", "P9", Map.of()).orElseThrow();

            assertThat(log.status()).isEqualTo(LogStatus.FAILED);
            assertThat(log.errorMessage()).contains("not a known task");
        }

        @Test
        @DisplayName("A failing recipient does not fail the notification")
        void testNotificationFailureTolerated() {
            fixture.notifications.failFor("bob");
            coordinator.createRule(onDone("r1", Action.sendNotification("Task done", List.of("alice", "bob"))).build());

            AutomationLog log = coordinator.executeRule("r1", "task", "T1", Map.of()).orElseThrow();

            assertThat(log.status()).isEqualTo(LogStatus.SUCCESS);
            assertThat(log.changes().get(0).detail()).isEqualTo("notified 1 of 2 user(s)");
            assertThat(fixture.notifications.deliveries())
                .containsExactly(new RecordingNotificationSink.Delivery("alice", "Task done"));
        }

        @Test
        @DisplayName("Notification falls back to the assignee")
        void testNotificationToAssignee() {
            coordinator.createRule(onDone("r1", Action.sendNotification("Ping", List.of())).build());

            AutomationLog unassigned = coordinator.executeRule("r1", "task", "T1", Map.of()).orElseThrow();
            assertThat(unassigned.status()).isEqualTo(LogStatus.FAILED);

            fixture.taskStore.update("T1", Map.of(TaskFields.ASSIGNEE_ID, FieldValue.text("carol")));
            coordinator.executeRule("r1", "task", "T1", Map.of());
            assertThat(fixture.notifications.deliveries()).extracting(RecordingNotificationSink.Delivery::userId)
                .containsExactly("carol");
        }

        @Test
        @DisplayName("run_automation chains another rule")
        void testChaining() {
            coordinator.createRule(AutomationRule.builder()
                .id("second")
                .name("Second")
                .triggers(List.of(Trigger.of(TriggerType.MANUAL)))
                .actions(List.of(Action.updateField(TaskFields.PRIORITY, "urgent")))
                .build());
            coordinator.createRule(onDone("first", Action.runAutomation("second")).build());

            complete("T1");

            assertThat(coordinator.logs("first")).singleElement()
                .satisfies(log -> assertThat(log.status()).isEqualTo(LogStatus.SUCCESS));
            assertThat(coordinator.logs("second")).singleElement()
                .satisfies(log -> assertThat(log.triggerType()).isEqualTo(TriggerType.MANUAL));
            assertThat(fixture.reload("T1").priority()).isEqualTo("urgent");
        }

        @Test
        @DisplayName("Chains deeper than the limit fail")
        void testChainDepthLimit() {
            coordinator.createRule(onDone("loop", Action.runAutomation("loop")).build());

            AutomationLog top = coordinator.executeRule("loop", "task", "T1", Map.of()).orElseThrow();

            assertThat(top.status()).isEqualTo(LogStatus.FAILED);
            List<AutomationLog> logs = coordinator.logs("loop");
            assertThat(logs).hasSize(6);
            assertThat(logs).allMatch(log -> log.status() == LogStatus.FAILED);
            assertThat(logs).anyMatch(log -> log.errorMessage().contains("maximum depth 5"));
        }

        @Test
        @DisplayName("Chaining a missing rule fails the action")
        void testChainMissingRule() {
            coordinator.createRule(onDone("first", Action.runAutomation("ghost")).build());

            AutomationLog log = coordinator.executeRule("first", "task", "T1", Map.of()).orElseThrow();

            assertThat(log.status()).isEqualTo(LogStatus.FAILED);
            assertThat(log.errorMessage()).contains("Chained rule not found: ghost");
        }
    }

    // ========== Concurrent Chaining ==========

    @Test
    @DisplayName("Mutually chained rules fired together fail the chain instead of blocking")
    void testMutualChainOnTwoThreads() throws Exception {
        // Both rules notify first; the barrier holds each thread until both own their rule lock
        CyclicBarrier bothRunning = new CyclicBarrier(2);
        NotificationSink rendezvous = (userId, message) -> {
            try {
                bothRunning.await(10, TimeUnit.SECONDS);
            } catch (Exception e) {
                throw new IllegalStateException("Rendezvous failed", e);
            }
        };
        AutomationCoordinator chained = new AutomationCoordinator(
            fixture.ruleRepository, fixture.logRepository, fixture.entities,
            StandardActionHandlers.registry(fixture.entities, fixture.taskStore, rendezvous),
            new AutomationPolicy(ZoneId.of("UTC"), 5, Duration.ofMillis(200)),
            fixture.locks, fixture.metrics, fixture.clock);

        chained.createRule(AutomationRule.builder()
            .id("A").name("A").triggers(List.of(Trigger.of(TriggerType.MANUAL)))
            .actions(List.of(Action.sendNotification("a", List.of("u1")), Action.runAutomation("B")))
            .build());
        chained.createRule(AutomationRule.builder()
            .id("B").name("B").triggers(List.of(Trigger.of(TriggerType.MANUAL)))
            .actions(List.of(Action.sendNotification("b", List.of("u1")), Action.runAutomation("A")))
            .build());

        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            Future<Optional<AutomationLog>> runA = executor.submit(() -> chained.executeRule("A", "task", "T1", Map.of()));
            Future<Optional<AutomationLog>> runB = executor.submit(() -> chained.executeRule("B", "task", "T1", Map.of()));

            AutomationLog logA = runA.get(10, TimeUnit.SECONDS).orElseThrow();
            AutomationLog logB = runB.get(10, TimeUnit.SECONDS).orElseThrow();

            assertThat(List.of(logA, logB)).allSatisfy(log -> {
                assertThat(log.status()).isEqualTo(LogStatus.FAILED);
                assertThat(log.errorMessage()).contains("lock not acquired");
            });
        } finally {
            executor.shutdownNow();
        }
    }

    // ========== Dry Run ==========

    @Test
    @DisplayName("Dry run previews without changing anything")
    void testDryRun() {
        coordinator.createRule(onDone("r1",
            Action.updateField(TaskFields.PRIORITY, "low"),
            Action.createTask("Retro", null),
            Action.of(ActionType.SEND_EMAIL)).build());

        RuleTestResult result = coordinator.testRule("r1", TriggerType.STATUS_CHANGED, "task", "T1", Map.of(
            AutomationEvent.FROM_STATUS, FieldValue.symbol("todo"),
            AutomationEvent.TO_STATUS, FieldValue.symbol("done")));

        assertThat(result.triggerMatched()).isTrue();
        assertThat(result.conditionsMet()).isTrue();
        assertThat(result.wouldExecute()).isTrue();
        assertThat(result.plannedChanges()).hasSize(3);
        assertThat(result.plannedChanges().get(0).newValue().asText()).isEqualTo("low");
        assertThat(result.plannedChanges().get(1).detail()).isEqualTo("would create task 'Retro'");
        assertThat(result.plannedChanges().get(2).error()).contains("No handler registered");

        assertThat(coordinator.logs("r1")).isEmpty();
        assertThat(fixture.reload("T1").priority()).isEqualTo("medium");
        assertThat(fixture.taskStore.size()).isEqualTo(2);
        assertThat(coordinator.getRule("r1").executionCount()).isZero();
    }

    @Test
    @DisplayName("Dry run reports a trigger mismatch")
    void testDryRunMismatch() {
        coordinator.createRule(onDone("r1", Action.updateField(TaskFields.PRIORITY, "low")).build());

        RuleTestResult explicit = coordinator.testRule("r1", TriggerType.FIELD_UPDATED, "task", "T1", Map.of());
        RuleTestResult anyType = coordinator.testRule("r1", null, "task", "T1", Map.of(
            AutomationEvent.FROM_STATUS, FieldValue.symbol("todo"),
            AutomationEvent.TO_STATUS, FieldValue.symbol("done")));

        assertThat(explicit.triggerMatched()).isFalse();
        assertThat(explicit.wouldExecute()).isFalse();
        assertThat(anyType.triggerMatched()).isTrue();
    }

    // ========== Analytics ==========

    @Test
    @DisplayName("Analytics count outcomes, impact and error categories")
    void testAnalytics() {
        coordinator.createRule(AutomationRule.builder()
            .id("r1")
            .name("Follow-up on done")
            .triggers(List.of(Trigger.statusChanged(null, "done")))
            .actions(List.of(Action.createSubtask("Follow up", null)))
            .build());

        statusChanged("T1", "todo", "done");
        coordinator.executeRules(TriggerType.STATUS_CHANGED, "project", "P9",
            Map.of(AutomationEvent.TO_STATUS, FieldValue.symbol("done")));
        statusChanged("T1", "done", "review");
        statusChanged("T1", "done", "review");
        statusChanged("T1", "done", "review");

        AutomationAnalytics analytics = coordinator.analytics("r1", null, null);

        assertThat(analytics.totalExecutions()).isEqualTo(5);
        assertThat(analytics.successfulExecutions()).isEqualTo(1);
        assertThat(analytics.failedExecutions()).isEqualTo(1);
        assertThat(analytics.skippedExecutions()).isEqualTo(3);
        assertThat(analytics.errorRate()).isEqualTo(0.2);
        assertThat(analytics.entitiesAffected()).isEqualTo(1);
        assertThat(analytics.changesMade()).isEqualTo(1);
        assertThat(analytics.triggerCounts()).containsEntry(TriggerType.STATUS_CHANGED, 5L);
        assertThat(analytics.actionCounts()).containsEntry(ActionType.CREATE_SUBTASK, 2L);
        assertThat(analytics.errorCategories()).containsExactly(entry("not_found", 1L));
        assertThat(analytics.suggestions()).containsExactly(
            "High failure rate - review error logs and conditions",
            "Many skipped executions - review trigger conditions");
    }
}
