package com.taskgraph.core.model;

import com.taskgraph.core.model.workflow.StateDefinition;
import com.taskgraph.core.model.workflow.StateType;
import com.taskgraph.core.model.workflow.TransitionDefinition;
import com.taskgraph.core.model.workflow.WorkflowDefinition;
import com.taskgraph.core.model.workflow.WorkflowInstance;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class WorkflowDefinitionTest {

    private final WorkflowDefinition definition = WorkflowDefinition.builder()
        .id("wf-1")
        .name("Review")
        .states(List.of(
            StateDefinition.of("open", "Open", StateType.INITIAL),
            StateDefinition.approval("review", "Review", 2, Set.of("lead"), Set.of()),
            StateDefinition.of("closed", "Closed", StateType.FINAL)
        ))
        .transitions(List.of(
            TransitionDefinition.builder("t1", "open", "review").priority(1).build(),
            TransitionDefinition.builder("t2", "open", "review").priority(5).build(),
            TransitionDefinition.builder("t3", "review", "closed").build()
        ))
        .build();

    @Test
    void initialState_shouldReturnTheInitialState() {
        assertEquals("open", definition.initialState().id());
    }

    @Test
    void transitionsFrom_shouldOrderByPriorityDescending() {
        List<TransitionDefinition> fromOpen = definition.transitionsFrom("open");

        assertEquals(List.of("t2", "t1"), fromOpen.stream().map(TransitionDefinition::id).toList());
    }

    @Test
    void canApprove_shouldRestrictToConfiguredApprovers() {
        StateDefinition review = definition.findState("review").orElseThrow();

        assertTrue(review.requiresApproval());
        assertTrue(review.canApprove("lead", null));
        assertFalse(review.canApprove("dev", "developer"));
    }

    @Test
    void create_shouldStartInInitialState() {
        Instant now = Instant.parse("2025-01-06T09:00:00Z");
        WorkflowInstance instance = WorkflowInstance.create(definition, "task-1", "u1", now);

        assertEquals("open", instance.currentStateId());
        assertEquals(Set.of("open"), instance.activeStates());
        assertEquals(1, instance.stateHistory().size());
        assertFalse(instance.completed());
    }

    @Test
    void minutesInState_shouldIncludeOpenStay() {
        Instant now = Instant.parse("2025-01-06T09:00:00Z");
        WorkflowInstance instance = WorkflowInstance.create(definition, "task-1", "u1", now);

        assertEquals(90, instance.minutesInState("open", now.plusSeconds(90 * 60)));
        assertEquals(0, instance.minutesInState("review", now.plusSeconds(90 * 60)));
    }
}
