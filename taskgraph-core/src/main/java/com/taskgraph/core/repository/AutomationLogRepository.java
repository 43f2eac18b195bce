package com.taskgraph.core.repository;

import com.taskgraph.core.model.automation.AutomationLog;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository for rule execution logs.
 * A log is saved once per status step; the latest copy wins.
 */
public interface AutomationLogRepository {

    /**
     * Store a log or replace the previous copy with the same id.
     *
     * @param log The execution log
     */
    void save(AutomationLog log);

    /**
     * Find a log by ID.
     *
     * @param logId The log ID
     * @return The log if found
     */
    Optional<AutomationLog> findById(String logId);

    /**
     * List logs of a rule triggered in [from, to), oldest first.
     *
     * @param ruleId The rule ID
     * @param from Inclusive lower bound, may be null
     * @param to Exclusive upper bound, may be null
     * @return Matching logs
     */
    List<AutomationLog> findByRule(String ruleId, Instant from, Instant to);

    /**
     * Count logs of a rule triggered at or after an instant.
     *
     * @param ruleId The rule ID
     * @param since Inclusive lower bound
     * @return Number of logs
     */
    long countByRuleSince(String ruleId, Instant since);
}
