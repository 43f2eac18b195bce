package com.taskgraph.core.condition;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Evaluates conditions against a snapshot of entity field values.
 *
 * Comparison rules:
 * - numbers compare numerically, dates chronologically, text lexically
 * - when one side is a number or date, text on the other side is coerced if it parses
 * - enum symbols compare case-insensitively
 * - a missing field is the empty value
 * - custom-field conditions read the namespaced key, see {@link Condition#lookupKey()}
 *
 * Stateless and thread-safe.
 */
public class ConditionEvaluator {

    /**
     * Evaluate a list of conditions combined with the given logic.
     * An empty list always matches.
     */
    public boolean evaluate(List<Condition> conditions, ConditionLogic logic, Map<String, FieldValue> fields) {
        if (conditions == null || conditions.isEmpty()) {
            return true;
        }
        if (logic == ConditionLogic.OR) {
            return conditions.stream().anyMatch(c -> evaluate(c, fields));
        }
        return conditions.stream().allMatch(c -> evaluate(c, fields));
    }

    /**
     * Evaluate a single condition.
     */
    public boolean evaluate(Condition condition, Map<String, FieldValue> fields) {
        FieldValue actual = fields.getOrDefault(condition.lookupKey(), FieldValue.EMPTY);
        FieldValue expected = condition.value();

        return switch (condition.operator()) {
            case EQUALS -> matches(actual, expected);
            case NOT_EQUALS -> !matches(actual, expected);
            case GREATER_THAN -> compare(actual, expected).map(c -> c > 0).orElse(false);
            case LESS_THAN -> compare(actual, expected).map(c -> c < 0).orElse(false);
            case CONTAINS -> contains(actual, expected);
            case NOT_CONTAINS -> !contains(actual, expected);
            case IN -> in(actual, expected);
            case NOT_IN -> !in(actual, expected);
            case IS_EMPTY -> actual.isEmpty();
            case IS_NOT_EMPTY -> !actual.isEmpty();
        };
    }

    /**
     * Equality between two typed values under the coercion rules.
     */
    public boolean matches(FieldValue left, FieldValue right) {
        if (left.isEmpty() || right.isEmpty()) {
            return left.isEmpty() && right.isEmpty();
        }
        if (isNumeric(left, right)) {
            Optional<Integer> cmp = compareNumbers(left, right);
            if (cmp.isPresent()) {
                return cmp.get() == 0;
            }
        }
        if (isTemporal(left, right)) {
            Optional<Integer> cmp = compareDates(left, right);
            if (cmp.isPresent()) {
                return cmp.get() == 0;
            }
        }
        if (left.kind() == FieldValue.Kind.LIST && right.kind() == FieldValue.Kind.LIST) {
            List<FieldValue> a = ((FieldValue.ListValue) left).values();
            List<FieldValue> b = ((FieldValue.ListValue) right).values();
            if (a.size() != b.size()) {
                return false;
            }
            for (int i = 0; i < a.size(); i++) {
                if (!matches(a.get(i), b.get(i))) {
                    return false;
                }
            }
            return true;
        }
        if (left.kind() == FieldValue.Kind.ENUM || right.kind() == FieldValue.Kind.ENUM
                || left.kind() == FieldValue.Kind.BOOLEAN || right.kind() == FieldValue.Kind.BOOLEAN) {
            return left.asText().equalsIgnoreCase(right.asText());
        }
        return left.asText().equals(right.asText());
    }

    // ========== Internal Methods ==========

    private Optional<Integer> compare(FieldValue left, FieldValue right) {
        if (left.isEmpty() || right.isEmpty()) {
            return Optional.empty();
        }
        if (isNumeric(left, right)) {
            return compareNumbers(left, right);
        }
        if (isTemporal(left, right)) {
            return compareDates(left, right);
        }
        if (isTextual(left) && isTextual(right)) {
            return Optional.of(Integer.signum(left.asText().compareTo(right.asText())));
        }
        return Optional.empty();
    }

    private boolean contains(FieldValue actual, FieldValue expected) {
        if (expected.isEmpty()) {
            return false;
        }
        return switch (actual.kind()) {
            case LIST -> ((FieldValue.ListValue) actual).values().stream().anyMatch(v -> matches(v, expected));
            case TEXT, ENUM -> actual.asText().contains(expected.asText());
            case NUMBER, BOOLEAN, DATE, EMPTY -> false;
        };
    }

    private boolean in(FieldValue actual, FieldValue expected) {
        if (expected.kind() != FieldValue.Kind.LIST) {
            return matches(actual, expected);
        }
        List<FieldValue> options = ((FieldValue.ListValue) expected).values();
        if (actual.kind() == FieldValue.Kind.LIST) {
            return ((FieldValue.ListValue) actual).values().stream()
                .anyMatch(a -> options.stream().anyMatch(o -> matches(a, o)));
        }
        return options.stream().anyMatch(o -> matches(actual, o));
    }

    private static boolean isNumeric(FieldValue left, FieldValue right) {
        return left.kind() == FieldValue.Kind.NUMBER || right.kind() == FieldValue.Kind.NUMBER;
    }

    private static boolean isTemporal(FieldValue left, FieldValue right) {
        return left.kind() == FieldValue.Kind.DATE || right.kind() == FieldValue.Kind.DATE;
    }

    private static boolean isTextual(FieldValue value) {
        return value.kind() == FieldValue.Kind.TEXT || value.kind() == FieldValue.Kind.ENUM;
    }

    private static Optional<Integer> compareNumbers(FieldValue left, FieldValue right) {
        Optional<BigDecimal> a = left.asNumber();
        Optional<BigDecimal> b = right.asNumber();
        if (a.isEmpty() || b.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(Integer.signum(a.get().compareTo(b.get())));
    }

    private static Optional<Integer> compareDates(FieldValue left, FieldValue right) {
        Optional<LocalDate> a = left.asDate();
        Optional<LocalDate> b = right.asDate();
        if (a.isEmpty() || b.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(Integer.signum(a.get().compareTo(b.get())));
    }
}
