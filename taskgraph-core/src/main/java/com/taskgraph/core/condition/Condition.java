package com.taskgraph.core.condition;

/**
 * A single predicate over one field of an entity.
 *
 * @param fieldName   the field to read
 * @param operator    the comparison
 * @param value       the operand; ignored by unary operators
 * @param customField whether the field lives in the entity's custom fields
 */
public record Condition(
    String fieldName,
    ConditionOperator operator,
    FieldValue value,
    boolean customField
) {
    /** Key prefix under which entity snapshots carry custom fields. */
    public static final String CUSTOM_FIELD_PREFIX = "custom.";

    public Condition {
        if (fieldName == null || fieldName.isBlank()) {
            throw new IllegalArgumentException("fieldName must not be blank");
        }
        if (operator == null) {
            throw new IllegalArgumentException("operator must not be null");
        }
        value = value == null ? FieldValue.EMPTY : value;
    }

    /**
     * The key this condition reads from an entity snapshot.
     * Custom fields are namespaced so a standard field of the same name never shadows them.
     */
    public String lookupKey() {
        return customField ? CUSTOM_FIELD_PREFIX + fieldName : fieldName;
    }

    public static Condition of(String fieldName, ConditionOperator operator, Object value) {
        return new Condition(fieldName, operator, FieldValue.of(value), false);
    }

    public static Condition custom(String fieldName, ConditionOperator operator, Object value) {
        return new Condition(fieldName, operator, FieldValue.of(value), true);
    }
}
