package com.taskgraph.engine.persistence;

import com.taskgraph.core.model.automation.AutomationRule;
import com.taskgraph.core.model.automation.Trigger;
import com.taskgraph.core.model.automation.TriggerType;
import com.taskgraph.core.repository.AutomationRuleRepository;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * In-memory implementation of AutomationRuleRepository with a trigger-type index.
 */
@Repository
public class InMemoryAutomationRuleRepository implements AutomationRuleRepository {

    private final Map<String, AutomationRule> rules = new LinkedHashMap<>();
    private final Map<TriggerType, Set<String>> byTrigger = new EnumMap<>(TriggerType.class);

    @Override
    public synchronized void save(AutomationRule rule) {
        unindex(rule.id());
        rules.put(rule.id(), rule);
        for (Trigger trigger : rule.triggers()) {
            byTrigger.computeIfAbsent(trigger.type(), t -> new LinkedHashSet<>()).add(rule.id());
        }
    }

    @Override
    public synchronized Optional<AutomationRule> findById(String ruleId) {
        return Optional.ofNullable(rules.get(ruleId));
    }

    @Override
    public synchronized List<AutomationRule> findByTriggerType(TriggerType triggerType) {
        List<AutomationRule> result = new ArrayList<>();
        for (String ruleId : byTrigger.getOrDefault(triggerType, Set.of())) {
            result.add(rules.get(ruleId));
        }
        return result;
    }

    @Override
    public synchronized List<AutomationRule> findAll() {
        return new ArrayList<>(rules.values());
    }

    @Override
    public synchronized boolean delete(String ruleId) {
        unindex(ruleId);
        return rules.remove(ruleId) != null;
    }

    private void unindex(String ruleId) {
        byTrigger.values().forEach(ids -> ids.remove(ruleId));
    }
}
