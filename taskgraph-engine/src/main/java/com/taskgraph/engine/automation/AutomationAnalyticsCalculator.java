package com.taskgraph.engine.automation;

import com.taskgraph.core.model.automation.ActionType;
import com.taskgraph.core.model.automation.AutomationAnalytics;
import com.taskgraph.core.model.automation.AutomationLog;
import com.taskgraph.core.model.automation.ChangeRecord;
import com.taskgraph.core.model.automation.LogStatus;
import com.taskgraph.core.model.automation.TriggerType;

import java.time.Instant;
import java.util.ArrayList;
import java.util.DoubleSummaryStatistics;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Summarizes a rule's execution logs over a period.
 */
public class AutomationAnalyticsCalculator {

    static final double HIGH_FAILURE_RATE = 0.1;
    static final double SLOW_EXECUTION_SECONDS = 5.0;
    static final double HIGH_SKIP_RATE = 0.5;

    public AutomationAnalytics calculate(String ruleId, List<AutomationLog> logs, Instant from, Instant to) {
        int total = logs.size();
        int successful = count(logs, LogStatus.SUCCESS);
        int failed = count(logs, LogStatus.FAILED);
        int skipped = count(logs, LogStatus.SKIPPED);

        DoubleSummaryStatistics seconds = logs.stream()
            .filter(l -> l.status() != LogStatus.SKIPPED)
            .map(AutomationLog::executionTime)
            .filter(Objects::nonNull)
            .mapToDouble(d -> d.toMillis() / 1000.0)
            .summaryStatistics();
        boolean timed = seconds.getCount() > 0;

        Set<String> entities = new HashSet<>();
        int changesMade = 0;
        Map<TriggerType, Long> triggerCounts = new EnumMap<>(TriggerType.class);
        Map<ActionType, Long> actionCounts = new EnumMap<>(ActionType.class);
        Map<String, Long> errorCategories = new LinkedHashMap<>();

        for (AutomationLog log : logs) {
            triggerCounts.merge(log.triggerType(), 1L, Long::sum);
            log.actionsExecuted().forEach(action -> actionCounts.merge(action, 1L, Long::sum));

            long applied = log.changes().stream().filter(c -> !c.failed()).count();
            if (log.status() == LogStatus.SUCCESS && applied > 0) {
                entities.add(log.entityType() + ":" + log.entityId());
            }
            changesMade += applied;

            if (log.status() != LogStatus.SKIPPED) {
                log.changes().stream()
                    .filter(ChangeRecord::failed)
                    .forEach(c -> errorCategories.merge(categorize(c.error()), 1L, Long::sum));
            }
        }

        double errorRate = total == 0 ? 0.0 : (double) failed / total;
        List<String> suggestions = new ArrayList<>();
        if (total > 0 && failed > total * HIGH_FAILURE_RATE) {
            suggestions.add("High failure rate - review error logs and conditions");
        }
        if (timed && seconds.getAverage() > SLOW_EXECUTION_SECONDS) {
            suggestions.add("Long execution time - consider optimizing actions");
        }
        if (total > 0 && skipped > total * HIGH_SKIP_RATE) {
            suggestions.add("Many skipped executions - review trigger conditions");
        }

        return new AutomationAnalytics(
            ruleId,
            from,
            to,
            total,
            successful,
            failed,
            skipped,
            timed ? seconds.getAverage() : null,
            timed ? seconds.getMax() : null,
            timed ? seconds.getMin() : null,
            entities.size(),
            changesMade,
            triggerCounts,
            actionCounts,
            errorRate,
            errorCategories,
            suggestions
        );
    }

    static String categorize(String error) {
        String text = error == null ? "" : error.toLowerCase(Locale.ROOT);
        if (text.contains("permission")) {
            return "permission";
        }
        if (text.contains("not found") || text.contains("not a known")) {
            return "not_found";
        }
        if (text.contains("no handler")) {
            return "unsupported_action";
        }
        if (text.contains("invalid") || text.contains("requires")) {
            return "validation";
        }
        return "other";
    }

    private static int count(List<AutomationLog> logs, LogStatus status) {
        return (int) logs.stream().filter(l -> l.status() == status).count();
    }
}
