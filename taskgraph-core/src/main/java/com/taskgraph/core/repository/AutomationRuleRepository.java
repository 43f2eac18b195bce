package com.taskgraph.core.repository;

import com.taskgraph.core.model.automation.AutomationRule;
import com.taskgraph.core.model.automation.TriggerType;

import java.util.List;
import java.util.Optional;

/**
 * Repository for automation rules, indexed by trigger type.
 */
public interface AutomationRuleRepository {

    /**
     * Store a rule, replacing any with the same id and re-indexing its triggers.
     *
     * @param rule The rule
     */
    void save(AutomationRule rule);

    /**
     * Find a rule by ID.
     *
     * @param ruleId The rule ID
     * @return The rule if found
     */
    Optional<AutomationRule> findById(String ruleId);

    /**
     * List rules having at least one trigger of the given type, active or not.
     *
     * @param triggerType The trigger type
     * @return Matching rules in creation order
     */
    List<AutomationRule> findByTriggerType(TriggerType triggerType);

    /**
     * List all rules in creation order.
     *
     * @return All rules
     */
    List<AutomationRule> findAll();

    /**
     * Remove a rule.
     *
     * @param ruleId The rule ID
     * @return true if a rule was removed
     */
    boolean delete(String ruleId);
}
