package com.taskgraph.core.model.automation;

import java.time.Instant;
import java.util.List;

/**
 * Outcome of a dry run. plannedChanges lists what each action would do.
 */
public record RuleTestResult(
    String ruleId,
    boolean triggerMatched,
    boolean conditionsMet,
    List<ChangeRecord> plannedChanges,
    Instant testedAt
) {
    public RuleTestResult {
        plannedChanges = List.copyOf(plannedChanges);
    }

    public boolean wouldExecute() {
        return triggerMatched && conditionsMet;
    }
}
