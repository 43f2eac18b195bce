package com.taskgraph.engine.persistence;

import com.taskgraph.core.model.automation.AutomationLog;
import com.taskgraph.core.repository.AutomationLogRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * In-memory implementation of AutomationLogRepository.
 */
@Repository
public class InMemoryAutomationLogRepository implements AutomationLogRepository {

    private final Map<String, AutomationLog> logs = new ConcurrentHashMap<>();
    private final Map<String, List<String>> byRule = new ConcurrentHashMap<>();

    @Override
    public void save(AutomationLog log) {
        if (logs.put(log.id(), log) == null) {
            byRule.computeIfAbsent(log.ruleId(), r -> new CopyOnWriteArrayList<>()).add(log.id());
        }
    }

    @Override
    public Optional<AutomationLog> findById(String logId) {
        return Optional.ofNullable(logs.get(logId));
    }

    @Override
    public List<AutomationLog> findByRule(String ruleId, Instant from, Instant to) {
        return byRule.getOrDefault(ruleId, List.of()).stream()
            .map(logs::get)
            .filter(l -> from == null || !l.triggeredAt().isBefore(from))
            .filter(l -> to == null || l.triggeredAt().isBefore(to))
            .collect(Collectors.toList());
    }

    @Override
    public long countByRuleSince(String ruleId, Instant since) {
        return byRule.getOrDefault(ruleId, List.of()).stream()
            .map(logs::get)
            .filter(l -> !l.triggeredAt().isBefore(since))
            .count();
    }
}
