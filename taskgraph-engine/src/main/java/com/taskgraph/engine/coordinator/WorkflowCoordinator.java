package com.taskgraph.engine.coordinator;

import com.taskgraph.core.condition.ConditionEvaluator;
import com.taskgraph.core.condition.FieldValue;
import com.taskgraph.core.exception.DuplicateEntityException;
import com.taskgraph.core.exception.InvalidTransitionException;
import com.taskgraph.core.exception.NotFoundException;
import com.taskgraph.core.exception.TransitionRejection;
import com.taskgraph.core.exception.ValidationException;
import com.taskgraph.core.model.automation.AutomationEvent;
import com.taskgraph.core.model.workflow.StateDefinition;
import com.taskgraph.core.model.workflow.StateType;
import com.taskgraph.core.model.workflow.TransitionDefinition;
import com.taskgraph.core.model.workflow.WorkflowAnalytics;
import com.taskgraph.core.model.workflow.WorkflowDefinition;
import com.taskgraph.core.model.workflow.WorkflowInstance;
import com.taskgraph.core.model.workflow.WorkflowPolicy;
import com.taskgraph.core.repository.WorkflowDefinitionRepository;
import com.taskgraph.core.repository.WorkflowInstanceRepository;
import com.taskgraph.core.spi.EventPublisher;
import com.taskgraph.engine.cache.AuthorizationCache;
import com.taskgraph.engine.concurrent.KeyedLocks;
import com.taskgraph.engine.entity.EntityAccessor;
import com.taskgraph.engine.logging.LoggingContext;
import com.taskgraph.engine.metrics.EngineMetrics;
import com.taskgraph.engine.service.WorkflowService;
import com.taskgraph.engine.workflow.StateActionRunner;
import com.taskgraph.engine.workflow.TransitionAuthorizer;
import com.taskgraph.engine.workflow.WorkflowAnalyticsCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Workflow coordinator: validates definitions and drives instances through their states.
 *
 * Every change to an instance happens under that instance's lock and replaces the stored
 * record with a new immutable copy.
 */
public class WorkflowCoordinator implements WorkflowService {

    private static final Logger log = LoggerFactory.getLogger(WorkflowCoordinator.class);

    private static final String INSTANCE_SCOPE = "workflow-instance";
    private static final String ENTITY_SCOPE = "entity";

    private final WorkflowDefinitionRepository definitionRepository;
    private final WorkflowInstanceRepository instanceRepository;
    private final EntityAccessor entityAccessor;
    private final EventPublisher eventPublisher;
    private final StateActionRunner actionRunner;
    private final AuthorizationCache authorizationCache;
    private final TransitionAuthorizer authorizer;
    private final WorkflowAnalyticsCalculator analyticsCalculator;
    private final KeyedLocks locks;
    private final EngineMetrics metrics;
    private final Clock clock;
    private final ConditionEvaluator conditionEvaluator = new ConditionEvaluator();

    public WorkflowCoordinator(
            WorkflowDefinitionRepository definitionRepository,
            WorkflowInstanceRepository instanceRepository,
            EntityAccessor entityAccessor,
            EventPublisher eventPublisher,
            StateActionRunner actionRunner,
            AuthorizationCache authorizationCache,
            TransitionAuthorizer authorizer,
            WorkflowPolicy policy,
            KeyedLocks locks,
            EngineMetrics metrics,
            Clock clock) {
        this.definitionRepository = definitionRepository;
        this.instanceRepository = instanceRepository;
        this.entityAccessor = entityAccessor;
        this.eventPublisher = eventPublisher;
        this.actionRunner = actionRunner;
        this.authorizationCache = authorizationCache;
        this.authorizer = authorizer;
        this.analyticsCalculator = new WorkflowAnalyticsCalculator(policy);
        this.locks = locks;
        this.metrics = metrics;
        this.clock = clock;
    }

    // ========== Definitions ==========

    @Override
    public WorkflowDefinition createWorkflow(WorkflowDefinition definition) {
        validateDefinition(definition);

        String workflowId = definition.id() != null ? definition.id() : UUID.randomUUID().toString();
        if (definitionRepository.findById(workflowId).isPresent()) {
            throw new DuplicateEntityException("WorkflowDefinition", workflowId, workflowId);
        }
        WorkflowDefinition stored = definition.withIdentity(workflowId, 1, clock.instant());
        definitionRepository.save(stored);

        log.info("Registered workflow {} '{}' for entity type {} ({} states, {} transitions)",
            stored.id(), stored.name(), stored.entityType(), stored.states().size(), stored.transitions().size());
        return stored;
    }

    @Override
    public WorkflowDefinition updateWorkflow(String workflowId, WorkflowDefinition definition) {
        WorkflowDefinition existing = getWorkflow(workflowId);
        validateDefinition(definition);

        WorkflowDefinition stored = definition.withIdentity(workflowId, existing.version() + 1, existing.createdAt());
        definitionRepository.save(stored);
        authorizationCache.invalidateWorkflow(workflowId);

        log.info("Updated workflow {} to version {}", workflowId, stored.version());
        return stored;
    }

    @Override
    public void deleteWorkflow(String workflowId) {
        if (!definitionRepository.delete(workflowId)) {
            throw new NotFoundException("WorkflowDefinition", workflowId);
        }
        authorizationCache.invalidateWorkflow(workflowId);
        log.info("Deleted workflow {}", workflowId);
    }

    @Override
    public WorkflowDefinition getWorkflow(String workflowId) {
        return definitionRepository.findById(workflowId)
            .orElseThrow(() -> new NotFoundException("WorkflowDefinition", workflowId));
    }

    @Override
    public List<WorkflowDefinition> listWorkflows(String entityType) {
        return definitionRepository.findByEntityType(entityType);
    }

    // ========== Instances ==========

    @Override
    public WorkflowInstance applyWorkflow(String workflowId, String entityType, String entityId, String actorId) {
        WorkflowDefinition definition = getWorkflow(workflowId);
        if (!definition.active()) {
            throw new ValidationException("workflowId", "workflow " + workflowId + " is inactive");
        }
        if (entityType == null || !definition.entityType().equalsIgnoreCase(entityType)) {
            throw new ValidationException("entityType", String.format(
                "workflow %s applies to %s, not %s", workflowId, definition.entityType(), entityType));
        }

        String entityKey = KeyedLocks.key(ENTITY_SCOPE, definition.entityType() + ":" + entityId);
        WorkflowInstance instance = locks.withLock(entityKey, () -> {
            instanceRepository.findByEntity(definition.entityType(), entityId).ifPresent(existing -> {
                throw new DuplicateEntityException("WorkflowInstance",
                    definition.entityType() + ":" + entityId, existing.id());
            });
            WorkflowInstance created = WorkflowInstance.create(definition, entityId, actorId, clock.instant());
            instanceRepository.save(created);
            return created;
        });

        try (var ctx = LoggingContext.forWorkflowInstance(instance.id(), entityId)) {
            log.info("Applied workflow {} to {}:{} in state {}",
                workflowId, definition.entityType(), entityId, instance.currentStateId());
            actionRunner.runRules(definition.initialState().entryActions(), instance.entityType(), entityId);
        }
        return instance;
    }

    @Override
    public WorkflowInstance transition(TransitionRequest request) {
        WorkflowInstance current = getInstance(request.instanceId());
        try (var ctx = LoggingContext.forWorkflowInstance(current.id(), current.entityId())) {
            return locks.withLock(KeyedLocks.key(INSTANCE_SCOPE, current.id()), () -> doTransition(request));
        }
    }

    @Override
    public WorkflowInstance approve(String instanceId, String actorId, String comment) {
        WorkflowInstance current = getInstance(instanceId);
        try (var ctx = LoggingContext.forWorkflowInstance(current.id(), current.entityId())) {
            return locks.withLock(KeyedLocks.key(INSTANCE_SCOPE, instanceId), () -> {
                WorkflowInstance instance = getInstance(instanceId);
                WorkflowDefinition definition = getWorkflow(instance.workflowId());

                if (instance.completed()) {
                    throw reject(instance, instance.currentStateId(), TransitionRejection.WORKFLOW_COMPLETED);
                }
                StateDefinition state = pendingApprovalState(definition, instance)
                    .orElseThrow(() -> new ValidationException("stateId",
                        "no active state of instance " + instanceId + " awaits approval"));
                if (!authorizer.canApprove(definition, state, actorId)) {
                    throw reject(instance, state.id(), TransitionRejection.NOT_AN_APPROVER);
                }

                WorkflowInstance updated = instance.withApproval(state.id(), actorId);
                instanceRepository.update(updated);
                log.info("User {} approved state {} ({}/{}){}", actorId, state.id(),
                    updated.approvalCount(state.id()), state.requiredApprovals(),
                    comment == null ? "" : ": " + comment);
                return updated;
            });
        }
    }

    @Override
    public List<TransitionDefinition> availableTransitions(String instanceId, String actorId) {
        WorkflowInstance instance = getInstance(instanceId);
        if (instance.completed()) {
            return List.of();
        }
        WorkflowDefinition definition = getWorkflow(instance.workflowId());
        Map<String, FieldValue> fields = entityAccessor.fieldValues(instance.entityType(), instance.entityId());

        return outgoing(definition, instance).stream()
            .filter(t -> authorizer.canTransition(definition, t, actorId))
            .filter(t -> conditionEvaluator.evaluate(t.conditions(), t.conditionLogic(), fields))
            .collect(Collectors.toList());
    }

    @Override
    public WorkflowInstance getInstance(String instanceId) {
        return instanceRepository.findById(instanceId)
            .orElseThrow(() -> new NotFoundException("WorkflowInstance", instanceId));
    }

    @Override
    public Optional<WorkflowInstance> findInstance(String entityType, String entityId) {
        return instanceRepository.findByEntity(entityType, entityId);
    }

    @Override
    public WorkflowAnalytics analytics(String workflowId, Instant from, Instant to) {
        WorkflowDefinition definition = getWorkflow(workflowId);
        if (from != null && to != null && from.isAfter(to)) {
            throw new ValidationException("from", "period start is after period end");
        }
        return analyticsCalculator.calculate(
            definition,
            instanceRepository.findByWorkflow(workflowId),
            from != null ? from : Instant.EPOCH,
            to != null ? to : clock.instant(),
            clock.instant()
        );
    }

    // ========== Internal Methods ==========

    private WorkflowInstance doTransition(TransitionRequest request) {
        WorkflowInstance instance = getInstance(request.instanceId());
        WorkflowDefinition definition = getWorkflow(instance.workflowId());
        String toStateId = request.toStateId();

        if (instance.completed()) {
            throw reject(instance, toStateId, TransitionRejection.WORKFLOW_COMPLETED);
        }
        Optional<StateDefinition> target = definition.findState(toStateId);
        if (target.isEmpty()) {
            throw reject(instance, toStateId, TransitionRejection.NO_MATCHING_TRANSITION);
        }
        StateDefinition toState = target.get();

        List<TransitionDefinition> candidates = outgoing(definition, instance).stream()
            .filter(t -> t.toStateId().equals(toStateId))
            .collect(Collectors.toList());

        TransitionDefinition chosen = null;
        if (candidates.isEmpty()) {
            if (definition.enforceTransitions()) {
                throw reject(instance, toStateId, TransitionRejection.NO_MATCHING_TRANSITION);
            }
            log.debug("No defined transition to {}, moving ad hoc", toStateId);
        } else {
            Map<String, FieldValue> fields = entityAccessor.fieldValues(instance.entityType(), instance.entityId());
            boolean anyAuthorized = false;
            for (TransitionDefinition candidate : candidates) {
                if (!authorizer.canTransition(definition, candidate, request.actorId())) {
                    continue;
                }
                anyAuthorized = true;
                if (conditionEvaluator.evaluate(candidate.conditions(), candidate.conditionLogic(), fields)) {
                    chosen = candidate;
                    break;
                }
            }
            if (chosen == null) {
                throw reject(instance, toStateId, anyAuthorized
                    ? TransitionRejection.CONDITION_NOT_MET
                    : TransitionRejection.NO_PERMISSION);
            }
            if (chosen.commentRequired() && (request.comment() == null || request.comment().isBlank())) {
                throw reject(instance, toStateId, TransitionRejection.COMMENT_REQUIRED);
            }
        }

        String fromStateId = chosen != null ? chosen.fromStateId() : instance.currentStateId();
        StateDefinition fromState = definition.findState(fromStateId)
            .orElseThrow(() -> new NotFoundException("StateDefinition", fromStateId));
        if (fromState.requiresApproval() && instance.approvalCount(fromStateId) < fromState.requiredApprovals()) {
            throw reject(instance, toStateId, TransitionRejection.APPROVALS_PENDING);
        }

        // Exit actions see the instance still in fromState
        actionRunner.runRules(fromState.exitActions(), instance.entityType(), instance.entityId());

        Instant now = clock.instant();
        WorkflowInstance updated = enter(definition, instance, fromState, toState, chosen, request, now);
        instanceRepository.update(updated);

        actionRunner.runRules(toState.entryActions(), instance.entityType(), instance.entityId());
        if (chosen != null) {
            actionRunner.runRules(chosen.automationRuleIds(), instance.entityType(), instance.entityId());
        }

        Map<String, FieldValue> fieldUpdates = new LinkedHashMap<>();
        if (chosen != null) {
            fieldUpdates.putAll(chosen.updateFields());
        }
        fieldUpdates.putAll(request.fieldUpdates());
        if (!fieldUpdates.isEmpty()) {
            entityAccessor.update(instance.entityType(), instance.entityId(), fieldUpdates);
        }

        metrics.transitionPerformed(definition.id());
        if (updated.completed()) {
            metrics.workflowCompleted(definition.id());
        }
        log.info("Transitioned {}:{} from {} to {} by {}{}", instance.entityType(), instance.entityId(),
            fromStateId, toStateId, request.actorId(), updated.completed() ? " (completed)" : "");

        eventPublisher.publish(AutomationEvent.statusChanged(
            instance.entityType(), instance.entityId(), fromState.name(), toState.name(), now));
        return updated;
    }

    /**
     * Derive the instance after entering toState.
     * A parallel state joins the active set; any other state replaces it.
     */
    private WorkflowInstance enter(WorkflowDefinition definition, WorkflowInstance instance,
                                   StateDefinition fromState, StateDefinition toState,
                                   TransitionDefinition chosen, TransitionRequest request, Instant now) {
        boolean joins = definition.allowParallelStates() && toState.type() == StateType.PARALLEL;

        Set<String> leaving = joins ? Set.of() : new HashSet<>(instance.activeStates());
        Map<String, Long> timeInState = new LinkedHashMap<>(instance.timeInStateMinutes());
        Map<String, Instant> activeSince = new LinkedHashMap<>(instance.activeSince());
        Map<String, Set<String>> approvals = new LinkedHashMap<>(instance.approvals());

        for (String stateId : leaving) {
            Instant since = activeSince.remove(stateId);
            if (definition.trackTimeInStates() && since != null) {
                timeInState.merge(stateId, Duration.between(since, now).toMinutes(), Long::sum);
            }
            approvals.remove(stateId);
        }
        if (joins && activeSince.containsKey(toState.id()) && definition.trackTimeInStates()) {
            timeInState.merge(toState.id(),
                Duration.between(activeSince.get(toState.id()), now).toMinutes(), Long::sum);
        }
        activeSince.put(toState.id(), now);
        approvals.remove(toState.id());

        Set<String> activeStates = new LinkedHashSet<>(joins ? instance.activeStates() : Set.of());
        activeStates.add(toState.id());

        List<WorkflowInstance.StateEntry> stateHistory = new ArrayList<>(instance.stateHistory());
        stateHistory.add(new WorkflowInstance.StateEntry(
            toState.id(), fromState.id(), now, request.actorId(), request.comment()));
        List<WorkflowInstance.TransitionRecord> transitionHistory = new ArrayList<>(instance.transitionHistory());
        transitionHistory.add(new WorkflowInstance.TransitionRecord(
            chosen != null ? chosen.id() : null, fromState.id(), toState.id(), now, request.actorId(), request.comment()));

        WorkflowInstance.Builder builder = instance.toBuilder()
            .currentStateId(toState.id())
            .previousStateId(fromState.id())
            .activeStates(activeStates)
            .activeSince(activeSince)
            .stateHistory(stateHistory)
            .transitionHistory(transitionHistory)
            .timeInStateMinutes(timeInState)
            .approvals(approvals)
            .lastTransitionAt(now);
        if (toState.isFinal()) {
            builder.completed(now);
        }
        return builder.build();
    }

    /**
     * Transitions leaving the current state, or any active state in parallel workflows,
     * highest priority first.
     */
    private static List<TransitionDefinition> outgoing(WorkflowDefinition definition, WorkflowInstance instance) {
        Set<String> sources = definition.allowParallelStates()
            ? instance.activeStates()
            : Set.of(instance.currentStateId());
        return definition.transitions().stream()
            .filter(t -> sources.contains(t.fromStateId()))
            .sorted(Comparator.comparingInt(TransitionDefinition::priority).reversed())
            .collect(Collectors.toList());
    }

    private static Optional<StateDefinition> pendingApprovalState(WorkflowDefinition definition,
                                                                  WorkflowInstance instance) {
        Optional<StateDefinition> current = definition.findState(instance.currentStateId())
            .filter(StateDefinition::requiresApproval);
        if (current.isPresent()) {
            return current;
        }
        return instance.activeStates().stream()
            .sorted()
            .map(definition::findState)
            .flatMap(Optional::stream)
            .filter(StateDefinition::requiresApproval)
            .findFirst();
    }

    private InvalidTransitionException reject(WorkflowInstance instance, String toStateId, TransitionRejection reason) {
        metrics.transitionRejected(reason.name());
        log.warn("Rejected transition of instance {} from {} to {}: {}",
            instance.id(), instance.currentStateId(), toStateId, reason);
        return new InvalidTransitionException(instance.id(), instance.currentStateId(), toStateId, reason);
    }

    private static void validateDefinition(WorkflowDefinition definition) {
        if (definition.name() == null || definition.name().isBlank()) {
            throw new ValidationException("name", "workflow name is required");
        }
        if (definition.entityType() == null || definition.entityType().isBlank()) {
            throw new ValidationException("entityType", "entity type is required");
        }

        Set<String> stateIds = new HashSet<>();
        long initialStates = 0;
        for (StateDefinition state : definition.states()) {
            if (state.id() == null || !stateIds.add(state.id())) {
                throw new ValidationException("states", "duplicate or missing state id: " + state.id());
            }
            if (state.type() == null) {
                throw new ValidationException("states", "state " + state.id() + " has no type");
            }
            if (state.isInitial()) {
                initialStates++;
            }
            if (state.requiredApprovals() < 0) {
                throw new ValidationException("requiredApprovals", "state " + state.id() + " requires a negative count");
            }
            if (state.slaDuration() != null && (state.slaDuration().isNegative() || state.slaDuration().isZero())) {
                throw new ValidationException("slaDuration", "state " + state.id() + " must have a positive SLA");
            }
        }
        if (initialStates != 1) {
            throw new ValidationException("states", "exactly one initial state is required, found " + initialStates);
        }

        Set<String> transitionIds = new HashSet<>();
        for (TransitionDefinition transition : definition.transitions()) {
            if (transition.id() == null || !transitionIds.add(transition.id())) {
                throw new ValidationException("transitions", "duplicate or missing transition id: " + transition.id());
            }
            if (!stateIds.contains(transition.fromStateId()) || !stateIds.contains(transition.toStateId())) {
                throw new ValidationException("transitions", String.format(
                    "transition %s references unknown state (%s -> %s)",
                    transition.id(), transition.fromStateId(), transition.toStateId()));
            }
        }
    }
}
