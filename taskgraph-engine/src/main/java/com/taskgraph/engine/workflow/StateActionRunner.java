package com.taskgraph.engine.workflow;

import java.util.List;

/**
 * Runs the automation rules a workflow attaches to state entry, state exit and transitions.
 */
@FunctionalInterface
public interface StateActionRunner {

    /**
     * Runner for engines without automation.
     */
    StateActionRunner NONE = (ruleIds, entityType, entityId) -> { };

    /**
     * Run rules against an entity, in order. Failures stay inside each rule's log.
     *
     * @param ruleIds Automation rule IDs
     * @param entityType The entity type
     * @param entityId The entity ID
     */
    void runRules(List<String> ruleIds, String entityType, String entityId);
}
