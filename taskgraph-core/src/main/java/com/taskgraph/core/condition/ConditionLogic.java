package com.taskgraph.core.condition;

/**
 * How a list of conditions or triggers is combined.
 */
public enum ConditionLogic {
    AND,
    OR
}
