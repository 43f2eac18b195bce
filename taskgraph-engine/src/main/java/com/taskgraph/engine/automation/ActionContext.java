package com.taskgraph.engine.automation;

import com.taskgraph.core.condition.FieldValue;
import com.taskgraph.core.model.automation.AutomationLog;
import com.taskgraph.core.model.automation.AutomationRule;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * What an action handler sees of the rule execution it belongs to.
 *
 * @param rule        the executing rule
 * @param entityType  target entity type
 * @param entityId    target entity id
 * @param fields      entity field values read before the first action ran
 * @param triggerData payload of the firing event
 * @param depth       0 for a rule fired by an event, +1 per run_automation hop
 * @param now         execution timestamp
 * @param chain       runs another rule one level deeper
 */
public record ActionContext(
    AutomationRule rule,
    String entityType,
    String entityId,
    Map<String, FieldValue> fields,
    Map<String, FieldValue> triggerData,
    int depth,
    Instant now,
    ChainRunner chain
) {
    public ActionContext {
        fields = fields == null ? Map.of() : Map.copyOf(fields);
        triggerData = triggerData == null ? Map.of() : Map.copyOf(triggerData);
    }

    public FieldValue field(String name) {
        return fields.getOrDefault(name, FieldValue.EMPTY);
    }

    /**
     * Runs a chained rule against the same entity.
     */
    @FunctionalInterface
    public interface ChainRunner {

        /**
         * @param ruleId rule to run
         * @return the chained rule's log; empty when it was excluded by scope, cap or inactivity
         * @throws ActionExecutionException when the chain would exceed its maximum depth
         */
        Optional<AutomationLog> run(String ruleId);
    }
}
