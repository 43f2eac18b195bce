package com.taskgraph.core.condition;

import com.taskgraph.core.model.task.TaskRecord;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static com.taskgraph.core.condition.ConditionOperator.*;
import static org.junit.jupiter.api.Assertions.*;

class ConditionEvaluatorTest {

    private final ConditionEvaluator evaluator = new ConditionEvaluator();

    private final Map<String, FieldValue> task = Map.of(
        "status", FieldValue.symbol("in_progress"),
        "priority", FieldValue.symbol("HIGH"),
        "estimate", FieldValue.NumberValue.of(8),
        "dueDate", FieldValue.date(LocalDate.of(2025, 3, 14)),
        "title", FieldValue.text("Fix login page"),
        "tags", FieldValue.of(List.of("backend", "urgent")),
        "notes", FieldValue.text("   ")
    );

    @Test
    void equals_shouldCompareEnumsIgnoringCase() {
        assertTrue(evaluator.evaluate(Condition.of("priority", EQUALS, "high"), task));
        assertFalse(evaluator.evaluate(Condition.of("priority", EQUALS, "low"), task));
        assertTrue(evaluator.evaluate(Condition.of("priority", NOT_EQUALS, "low"), task));
    }

    @Test
    void equals_shouldCoerceTextToNumber() {
        assertTrue(evaluator.evaluate(Condition.of("estimate", EQUALS, "8.0"), task));
        assertTrue(evaluator.evaluate(Condition.of("estimate", EQUALS, 8), task));
    }

    @Test
    void greaterAndLessThan_shouldCompareNumbersNumerically() {
        assertTrue(evaluator.evaluate(Condition.of("estimate", GREATER_THAN, 5), task));
        assertFalse(evaluator.evaluate(Condition.of("estimate", GREATER_THAN, 10), task));
        assertTrue(evaluator.evaluate(Condition.of("estimate", LESS_THAN, "10"), task));
    }

    @Test
    void greaterAndLessThan_shouldCompareDatesChronologically() {
        assertTrue(evaluator.evaluate(Condition.of("dueDate", LESS_THAN, LocalDate.of(2025, 4, 1)), task));
        assertTrue(evaluator.evaluate(Condition.of("dueDate", GREATER_THAN, "2025-03-01"), task));
    }

    @Test
    void greaterThan_onMissingField_shouldBeFalse() {
        assertFalse(evaluator.evaluate(Condition.of("storyPoints", GREATER_THAN, 1), task));
        assertFalse(evaluator.evaluate(Condition.of("storyPoints", LESS_THAN, 1), task));
    }

    @Test
    void contains_shouldSearchTextAndLists() {
        assertTrue(evaluator.evaluate(Condition.of("title", CONTAINS, "login"), task));
        assertTrue(evaluator.evaluate(Condition.of("tags", CONTAINS, "urgent"), task));
        assertFalse(evaluator.evaluate(Condition.of("tags", CONTAINS, "frontend"), task));
        assertTrue(evaluator.evaluate(Condition.of("tags", NOT_CONTAINS, "frontend"), task));
    }

    @Test
    void in_shouldMatchAnyOption() {
        assertTrue(evaluator.evaluate(Condition.of("status", IN, List.of("todo", "in_progress")), task));
        assertFalse(evaluator.evaluate(Condition.of("status", IN, List.of("done")), task));
        assertTrue(evaluator.evaluate(Condition.of("status", NOT_IN, List.of("done", "cancelled")), task));
    }

    @Test
    void isEmpty_shouldTreatBlankAndMissingAsEmpty() {
        assertTrue(evaluator.evaluate(Condition.of("notes", IS_EMPTY, null), task));
        assertTrue(evaluator.evaluate(Condition.of("assigneeId", IS_EMPTY, null), task));
        assertTrue(evaluator.evaluate(Condition.of("title", IS_NOT_EMPTY, null), task));
    }

    @Test
    void evaluate_shouldCombineWithLogic() {
        List<Condition> conditions = List.of(
            Condition.of("priority", EQUALS, "high"),
            Condition.of("status", EQUALS, "done")
        );

        assertFalse(evaluator.evaluate(conditions, ConditionLogic.AND, task));
        assertTrue(evaluator.evaluate(conditions, ConditionLogic.OR, task));
    }

    @Test
    void evaluate_withNoConditions_shouldMatch() {
        assertTrue(evaluator.evaluate(List.of(), ConditionLogic.AND, task));
        assertTrue(evaluator.evaluate(List.of(), ConditionLogic.OR, task));
    }

    @Test
    void everyOperator_shouldBeHandled() {
        for (ConditionOperator operator : ConditionOperator.values()) {
            assertDoesNotThrow(() -> evaluator.evaluate(Condition.of("title", operator, "x"), task),
                operator.name());
        }
    }

    @Test
    void customCondition_shouldReadCustomFieldShadowedByStandardField() {
        TaskRecord record = new TaskRecord("T1", "p1", null, null, "todo", "Fix login page", null, null,
            "high", List.of(), null, Instant.parse("2025-03-03T09:00:00Z"),
            Map.of("status", FieldValue.text("green")));
        Map<String, FieldValue> fields = record.fieldValues();

        assertTrue(evaluator.evaluate(Condition.custom("status", EQUALS, "green"), fields));
        assertFalse(evaluator.evaluate(Condition.custom("status", EQUALS, "todo"), fields));
        assertTrue(evaluator.evaluate(Condition.of("status", EQUALS, "todo"), fields));
    }

    @Test
    void customCondition_onMissingCustomField_shouldNotFallBackToStandardField() {
        Map<String, FieldValue> fields = Map.of("status", FieldValue.symbol("todo"));

        assertTrue(evaluator.evaluate(Condition.custom("status", IS_EMPTY, null), fields));
        assertFalse(evaluator.evaluate(Condition.custom("status", EQUALS, "todo"), fields));
    }
}
