package com.taskgraph.engine.persistence;

import com.taskgraph.core.model.workflow.WorkflowDefinition;
import com.taskgraph.core.repository.WorkflowDefinitionRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory implementation of WorkflowDefinitionRepository.
 */
@Repository
public class InMemoryWorkflowDefinitionRepository implements WorkflowDefinitionRepository {

    private final Map<String, WorkflowDefinition> definitions = new ConcurrentHashMap<>();

    @Override
    public void save(WorkflowDefinition definition) {
        definitions.put(definition.id(), definition);
    }

    @Override
    public Optional<WorkflowDefinition> findById(String workflowId) {
        return Optional.ofNullable(definitions.get(workflowId));
    }

    @Override
    public List<WorkflowDefinition> findByEntityType(String entityType) {
        return definitions.values().stream()
            .filter(d -> entityType == null || entityType.equals(d.entityType()))
            .sorted((a, b) -> a.name().compareToIgnoreCase(b.name()))
            .collect(Collectors.toList());
    }

    @Override
    public boolean delete(String workflowId) {
        return definitions.remove(workflowId) != null;
    }
}
