package com.taskgraph.engine.service;

import com.taskgraph.core.condition.FieldValue;
import com.taskgraph.core.model.automation.AutomationAnalytics;
import com.taskgraph.core.model.automation.AutomationLog;
import com.taskgraph.core.model.automation.AutomationRule;
import com.taskgraph.core.model.automation.RuleTestResult;
import com.taskgraph.core.model.automation.TriggerType;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Automation rules: management, event-driven execution, dry runs and analytics.
 */
public interface AutomationService {

    /**
     * Register a rule.
     *
     * @param rule The rule; id and creation time are assigned when missing
     * @return The stored rule
     */
    AutomationRule createRule(AutomationRule rule);

    /**
     * Replace a rule's definition. Execution counters are kept.
     */
    AutomationRule updateRule(String ruleId, AutomationRule rule);

    void deleteRule(String ruleId);

    AutomationRule getRule(String ruleId);

    List<AutomationRule> listRules();

    AutomationRule setActive(String ruleId, boolean active);

    /**
     * Run every active rule listening for a trigger type against an entity.
     *
     * @param triggerType The firing trigger
     * @param entityType The entity type
     * @param entityId The entity ID
     * @param triggerData Event payload matched by trigger filters
     * @return One log per rule that was evaluated; rules excluded by scope or daily cap leave none
     */
    List<AutomationLog> executeRules(TriggerType triggerType, String entityType, String entityId,
                                     Map<String, FieldValue> triggerData);

    /**
     * Run one rule directly, bypassing its triggers.
     *
     * @return The log, or empty when the rule is inactive or excluded by scope or daily cap
     */
    Optional<AutomationLog> executeRule(String ruleId, String entityType, String entityId,
                                        Map<String, FieldValue> triggerData);

    /**
     * Dry run: report whether the rule would fire and what each action would change.
     * Nothing is modified and no log is written.
     *
     * @param triggerType Firing trigger; null checks each trigger against its own type
     */
    RuleTestResult testRule(String ruleId, TriggerType triggerType, String entityType, String entityId,
                            Map<String, FieldValue> triggerData);

    /**
     * Execution logs of a rule, oldest first.
     */
    List<AutomationLog> logs(String ruleId);

    AutomationAnalytics analytics(String ruleId, Instant from, Instant to);
}
