package com.taskgraph.engine.coordinator;

import com.taskgraph.core.condition.ConditionEvaluator;
import com.taskgraph.core.condition.ConditionLogic;
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
import com.taskgraph.core.model.automation.RuleTestResult;
import com.taskgraph.core.model.automation.Trigger;
import com.taskgraph.core.model.automation.TriggerType;
import com.taskgraph.core.model.task.TaskRecord;
import com.taskgraph.core.repository.AutomationLogRepository;
import com.taskgraph.core.repository.AutomationRuleRepository;
import com.taskgraph.core.spi.EventSubscriber;
import com.taskgraph.engine.automation.ActionContext;
import com.taskgraph.engine.automation.ActionExecutionException;
import com.taskgraph.engine.automation.ActionHandler;
import com.taskgraph.engine.automation.ActionHandlerRegistry;
import com.taskgraph.engine.automation.AutomationAnalyticsCalculator;
import com.taskgraph.engine.concurrent.KeyedLocks;
import com.taskgraph.engine.entity.EntityAccessor;
import com.taskgraph.engine.logging.LoggingContext;
import com.taskgraph.engine.metrics.EngineMetrics;
import com.taskgraph.engine.service.AutomationService;
import com.taskgraph.engine.workflow.StateActionRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Automation coordinator: evaluates rules against entities and runs their actions.
 *
 * Rules run synchronously on the caller's thread, one at a time, each under its own lock so
 * that the daily cap and execution counters stay consistent. Every evaluated rule leaves a
 * log; a failing action never propagates to the caller.
 */
public class AutomationCoordinator implements AutomationService, EventSubscriber, StateActionRunner {

    private static final Logger log = LoggerFactory.getLogger(AutomationCoordinator.class);

    private static final String RULE_SCOPE = "rule";

    private final AutomationRuleRepository ruleRepository;
    private final AutomationLogRepository logRepository;
    private final EntityAccessor entityAccessor;
    private final ActionHandlerRegistry handlers;
    private final AutomationPolicy policy;
    private final KeyedLocks locks;
    private final EngineMetrics metrics;
    private final Clock clock;
    private final ConditionEvaluator conditionEvaluator = new ConditionEvaluator();
    private final AutomationAnalyticsCalculator analyticsCalculator = new AutomationAnalyticsCalculator();

    public AutomationCoordinator(
            AutomationRuleRepository ruleRepository,
            AutomationLogRepository logRepository,
            EntityAccessor entityAccessor,
            ActionHandlerRegistry handlers,
            AutomationPolicy policy,
            KeyedLocks locks,
            EngineMetrics metrics,
            Clock clock) {
        this.ruleRepository = ruleRepository;
        this.logRepository = logRepository;
        this.entityAccessor = entityAccessor;
        this.handlers = handlers;
        this.policy = policy;
        this.locks = locks;
        this.metrics = metrics;
        this.clock = clock;
    }

    // ========== Rule Management ==========

    @Override
    public AutomationRule createRule(AutomationRule rule) {
        validateRule(rule);
        AutomationRule stored = rule.toBuilder()
            .id(rule.id() != null ? rule.id() : UUID.randomUUID().toString())
            .executionCount(0)
            .lastExecution(null)
            .createdAt(rule.createdAt() != null ? rule.createdAt() : clock.instant())
            .build();
        ruleRepository.save(stored);
        log.info("Created automation rule {} '{}' on {}", stored.id(), stored.name(),
            stored.triggers().stream().map(Trigger::type).distinct().collect(Collectors.toList()));
        return stored;
    }

    @Override
    public AutomationRule updateRule(String ruleId, AutomationRule rule) {
        validateRule(rule);
        return locks.withLock(KeyedLocks.key(RULE_SCOPE, ruleId), () -> {
            AutomationRule existing = getRule(ruleId);
            AutomationRule stored = rule.toBuilder()
                .id(ruleId)
                .executionCount(existing.executionCount())
                .lastExecution(existing.lastExecution())
                .createdBy(existing.createdBy())
                .createdAt(existing.createdAt())
                .build();
            ruleRepository.save(stored);
            log.info("Updated automation rule {}", ruleId);
            return stored;
        });
    }

    @Override
    public void deleteRule(String ruleId) {
        if (!ruleRepository.delete(ruleId)) {
            throw new NotFoundException("AutomationRule", ruleId);
        }
        log.info("Deleted automation rule {}", ruleId);
    }

    @Override
    public AutomationRule getRule(String ruleId) {
        return ruleRepository.findById(ruleId)
            .orElseThrow(() -> new NotFoundException("AutomationRule", ruleId));
    }

    @Override
    public List<AutomationRule> listRules() {
        return ruleRepository.findAll();
    }

    @Override
    public AutomationRule setActive(String ruleId, boolean active) {
        return locks.withLock(KeyedLocks.key(RULE_SCOPE, ruleId), () -> {
            AutomationRule updated = getRule(ruleId).withActive(active);
            ruleRepository.save(updated);
            log.info("Automation rule {} {}", ruleId, active ? "activated" : "deactivated");
            return updated;
        });
    }

    // ========== Execution ==========

    @Override
    public void onEvent(AutomationEvent event) {
        executeRules(event.triggerType(), event.entityType(), event.entityId(), event.payload());
    }

    @Override
    public void runRules(List<String> ruleIds, String entityType, String entityId) {
        for (String ruleId : ruleIds) {
            if (ruleRepository.findById(ruleId).isEmpty()) {
                log.warn("Workflow references unknown automation rule {}, skipping", ruleId);
                continue;
            }
            executeRule(ruleId, entityType, entityId, Map.of());
        }
    }

    @Override
    public List<AutomationLog> executeRules(TriggerType triggerType, String entityType, String entityId,
                                            Map<String, FieldValue> triggerData) {
        Map<String, FieldValue> data = triggerData == null ? Map.of() : triggerData;
        List<AutomationLog> logs = new ArrayList<>();
        for (AutomationRule rule : ruleRepository.findByTriggerType(triggerType)) {
            if (!rule.active()) {
                continue;
            }
            run(rule.id(), triggerType, entityType, entityId, data, 0, true).ifPresent(logs::add);
        }
        log.debug("Trigger {} on {}:{} evaluated {} rule(s)", triggerType, entityType, entityId, logs.size());
        return logs;
    }

    @Override
    public Optional<AutomationLog> executeRule(String ruleId, String entityType, String entityId,
                                               Map<String, FieldValue> triggerData) {
        getRule(ruleId);
        return run(ruleId, TriggerType.MANUAL, entityType, entityId,
            triggerData == null ? Map.of() : triggerData, 0, false);
    }

    @Override
    public RuleTestResult testRule(String ruleId, TriggerType triggerType, String entityType, String entityId,
                                   Map<String, FieldValue> triggerData) {
        AutomationRule rule = getRule(ruleId);
        Map<String, FieldValue> data = triggerData == null ? Map.of() : triggerData;
        Map<String, FieldValue> fields = entityAccessor.fieldValues(entityType, entityId);

        boolean triggerMatched = triggersMatch(rule, t -> t.matches(triggerType != null ? triggerType : t.type(), data));
        boolean conditionsMet = conditionEvaluator.evaluate(rule.conditions(), rule.conditionLogic(), fields);

        Instant now = clock.instant();
        ActionContext context = new ActionContext(rule, entityType, entityId, fields, data, 0, now,
            chained -> Optional.empty());
        List<ChangeRecord> planned = new ArrayList<>();
        for (Action action : rule.actions()) {
            Optional<ActionHandler> handler = handlers.find(action.type());
            if (handler.isEmpty()) {
                planned.add(ChangeRecord.failure(action.type(), entityType, entityId, noHandler(action.type()), now));
                continue;
            }
            try {
                planned.add(handler.get().preview(action, context));
            } catch (RuntimeException e) {
                planned.add(ChangeRecord.failure(action.type(), entityType, entityId, e.getMessage(), now));
            }
        }

        log.debug("Dry run of rule {} on {}:{}: trigger={} conditions={}",
            ruleId, entityType, entityId, triggerMatched, conditionsMet);
        return new RuleTestResult(ruleId, triggerMatched, conditionsMet, planned, now);
    }

    @Override
    public List<AutomationLog> logs(String ruleId) {
        getRule(ruleId);
        return logRepository.findByRule(ruleId, null, null);
    }

    @Override
    public AutomationAnalytics analytics(String ruleId, Instant from, Instant to) {
        getRule(ruleId);
        return analyticsCalculator.calculate(ruleId, logRepository.findByRule(ruleId, from, to), from, to);
    }

    // ========== Internal Methods ==========

    private Optional<AutomationLog> run(String ruleId, TriggerType triggerType, String entityType, String entityId,
                                        Map<String, FieldValue> data, int depth, boolean evaluateTriggers) {
        try (var ctx = LoggingContext.forRule(ruleId, entityId)) {
            return locks.withLock(KeyedLocks.key(RULE_SCOPE, ruleId),
                () -> runLocked(ruleId, triggerType, entityType, entityId, data, depth, evaluateTriggers));
        }
    }

    private Optional<AutomationLog> runLocked(String ruleId, TriggerType triggerType, String entityType,
                                              String entityId, Map<String, FieldValue> data, int depth,
                                              boolean evaluateTriggers) {
        Optional<AutomationRule> current = ruleRepository.findById(ruleId);
        if (current.isEmpty() || !current.get().active()) {
            log.debug("Rule {} is missing or inactive, not running", ruleId);
            return Optional.empty();
        }
        AutomationRule rule = current.get();

        Optional<TaskRecord> task = entityAccessor.task(entityType, entityId);
        boolean inScope = rule.scope().includes(
            task.map(TaskRecord::projectId).orElse(null),
            task.map(TaskRecord::boardId).orElse(null),
            task.map(TaskRecord::isSubtask).orElse(false));
        if (!inScope) {
            log.debug("Rule {} does not apply to {}:{}", ruleId, entityType, entityId);
            return Optional.empty();
        }
        if (dailyCapReached(rule)) {
            log.debug("Rule {} reached its daily cap of {}", ruleId, rule.maxExecutionsPerDay());
            return Optional.empty();
        }

        AutomationLog entry = AutomationLog.pending(rule, triggerType, entityType, entityId, data, clock.instant());
        logRepository.save(entry);

        if (evaluateTriggers && !triggersMatch(rule, t -> t.matches(triggerType, data))) {
            return Optional.of(skip(entry, "No trigger matched"));
        }
        Map<String, FieldValue> fields = entityAccessor.fieldValues(entityType, entityId);
        if (!conditionEvaluator.evaluate(rule.conditions(), rule.conditionLogic(), fields)) {
            return Optional.of(skip(entry, "Conditions not met"));
        }

        Instant startedAt = clock.instant();
        entry = entry.running(startedAt);
        logRepository.save(entry);

        ActionContext context = new ActionContext(rule, entityType, entityId, fields, data, depth, startedAt,
            chainedRuleId -> runChained(chainedRuleId, entityType, entityId, data, depth));

        List<ActionType> executed = new ArrayList<>();
        List<ChangeRecord> changes = new ArrayList<>();
        List<String> errors = new ArrayList<>();
        boolean failed = false;

        for (Action action : rule.actions()) {
            executed.add(action.type());
            try {
                ActionHandler handler = handlers.find(action.type())
                    .orElseThrow(() -> new ActionExecutionException(action.type(), noHandler(action.type())));
                changes.add(handler.execute(action, context));
            } catch (RuntimeException e) {
                String error = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
                metrics.actionFailed(action.type().name().toLowerCase());
                changes.add(ChangeRecord.failure(action.type(), entityType, entityId, error, clock.instant()));
                errors.add(action.type().name().toLowerCase() + ": " + error);
                log.warn("Action {} of rule {} failed on {}:{}: {}",
                    action.type(), ruleId, entityType, entityId, error);
                if (rule.stopOnError()) {
                    failed = true;
                    break;
                }
            }
        }

        LogStatus outcome = failed ? LogStatus.FAILED : LogStatus.SUCCESS;
        Instant finishedAt = clock.instant();
        AutomationLog finished = entry.finished(outcome, executed, changes,
            errors.isEmpty() ? null : String.join("; ", errors), finishedAt);
        logRepository.save(finished);
        if (outcome == LogStatus.SUCCESS) {
            ruleRepository.save(rule.withExecution(finishedAt));
        }

        metrics.ruleExecuted(outcome.name().toLowerCase());
        log.info("Rule {} '{}' on {}:{} finished {} ({} action(s), {} error(s))",
            ruleId, rule.name(), entityType, entityId, outcome, executed.size(), errors.size());
        return Optional.of(finished);
    }

    private Optional<AutomationLog> runChained(String ruleId, String entityType, String entityId,
                                               Map<String, FieldValue> data, int depth) {
        if (depth + 1 > policy.maxChainDepth()) {
            throw new ActionExecutionException(ActionType.RUN_AUTOMATION,
                "Automation chain exceeds maximum depth " + policy.maxChainDepth());
        }
        if (ruleRepository.findById(ruleId).isEmpty()) {
            throw new ActionExecutionException(ActionType.RUN_AUTOMATION, "Chained rule not found: " + ruleId);
        }
        // The calling rule's lock is still held, so the wait for this one is bounded
        try (var ctx = LoggingContext.forRule(ruleId, entityId)) {
            return locks.tryWithLock(KeyedLocks.key(RULE_SCOPE, ruleId), policy.chainLockTimeout(),
                () -> runLocked(ruleId, TriggerType.MANUAL, entityType, entityId, data, depth + 1, false),
                () -> new ActionExecutionException(ActionType.RUN_AUTOMATION, String.format(
                    "Chained rule %s is busy, lock not acquired within %s", ruleId, policy.chainLockTimeout())));
        }
    }

    private AutomationLog skip(AutomationLog entry, String reason) {
        AutomationLog skipped = entry.skipped(reason, clock.instant());
        logRepository.save(skipped);
        metrics.ruleExecuted(LogStatus.SKIPPED.name().toLowerCase());
        log.debug("Rule {} skipped for {}:{}: {}", entry.ruleId(), entry.entityType(), entry.entityId(), reason);
        return skipped;
    }

    private boolean dailyCapReached(AutomationRule rule) {
        if (rule.maxExecutionsPerDay() == null) {
            return false;
        }
        Instant startOfDay = LocalDate.now(clock.withZone(policy.zone()))
            .atStartOfDay(policy.zone())
            .toInstant();
        return logRepository.countByRuleSince(rule.id(), startOfDay) >= rule.maxExecutionsPerDay();
    }

    private static boolean triggersMatch(AutomationRule rule, Predicate<Trigger> matches) {
        if (rule.triggers().isEmpty()) {
            return false;
        }
        return rule.triggerLogic() == ConditionLogic.AND
            ? rule.triggers().stream().allMatch(matches)
            : rule.triggers().stream().anyMatch(matches);
    }

    private static String noHandler(ActionType type) {
        return "No handler registered for action type " + type.name().toLowerCase();
    }

    private static void validateRule(AutomationRule rule) {
        if (rule.name() == null || rule.name().isBlank()) {
            throw new ValidationException("name", "rule name is required");
        }
        if (rule.triggers().isEmpty()) {
            throw new ValidationException("triggers", "at least one trigger is required");
        }
        if (rule.actions().isEmpty()) {
            throw new ValidationException("actions", "at least one action is required");
        }
        if (rule.maxExecutionsPerDay() != null && rule.maxExecutionsPerDay() < 1) {
            throw new ValidationException("maxExecutionsPerDay", "must be at least 1");
        }
    }
}
