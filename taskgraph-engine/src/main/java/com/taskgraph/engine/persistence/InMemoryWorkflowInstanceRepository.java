package com.taskgraph.engine.persistence;

import com.taskgraph.core.exception.DuplicateEntityException;
import com.taskgraph.core.model.workflow.WorkflowInstance;
import com.taskgraph.core.repository.WorkflowInstanceRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory implementation of WorkflowInstanceRepository.
 * Enforces the one-instance-per-entity constraint on save.
 */
@Repository
public class InMemoryWorkflowInstanceRepository implements WorkflowInstanceRepository {

    private final Map<String, WorkflowInstance> instances = new ConcurrentHashMap<>();
    private final Map<String, String> byEntity = new ConcurrentHashMap<>();

    @Override
    public void save(WorkflowInstance instance) {
        String entityKey = entityKey(instance.entityType(), instance.entityId());
        String existing = byEntity.putIfAbsent(entityKey, instance.id());
        if (existing != null) {
            throw new DuplicateEntityException("WorkflowInstance", entityKey, existing);
        }
        instances.put(instance.id(), instance);
    }

    @Override
    public void update(WorkflowInstance instance) {
        instances.put(instance.id(), instance);
    }

    @Override
    public Optional<WorkflowInstance> findById(String instanceId) {
        return Optional.ofNullable(instances.get(instanceId));
    }

    @Override
    public Optional<WorkflowInstance> findByEntity(String entityType, String entityId) {
        String instanceId = byEntity.get(entityKey(entityType, entityId));
        return instanceId == null ? Optional.empty() : findById(instanceId);
    }

    @Override
    public List<WorkflowInstance> findByWorkflow(String workflowId) {
        return instances.values().stream()
            .filter(i -> i.workflowId().equals(workflowId))
            .sorted((a, b) -> a.startedAt().compareTo(b.startedAt()))
            .collect(Collectors.toList());
    }

    private static String entityKey(String entityType, String entityId) {
        return entityType + ":" + entityId;
    }
}
