package com.taskgraph.core.condition;

/**
 * Comparison applied between an entity field and a condition operand.
 */
public enum ConditionOperator {
    EQUALS,
    NOT_EQUALS,
    GREATER_THAN,
    LESS_THAN,
    CONTAINS,
    NOT_CONTAINS,
    IN,
    NOT_IN,
    IS_EMPTY,
    IS_NOT_EMPTY;

    /**
     * Check if the operator ignores its operand.
     */
    public boolean isUnary() {
        return this == IS_EMPTY || this == IS_NOT_EMPTY;
    }
}
