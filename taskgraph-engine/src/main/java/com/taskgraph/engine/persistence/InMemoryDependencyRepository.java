package com.taskgraph.engine.persistence;

import com.taskgraph.core.model.dependency.Dependency;
import com.taskgraph.core.model.dependency.DependencyType;
import com.taskgraph.core.repository.DependencyRepository;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * In-memory implementation of DependencyRepository.
 * Keeps insertion order so graph traversals are deterministic.
 */
@Repository
public class InMemoryDependencyRepository implements DependencyRepository {

    private final Map<String, Dependency> dependencies = Collections.synchronizedMap(new LinkedHashMap<>());

    @Override
    public void save(Dependency dependency) {
        dependencies.put(dependency.id(), dependency);
    }

    @Override
    public Optional<Dependency> findById(String dependencyId) {
        return Optional.ofNullable(dependencies.get(dependencyId));
    }

    @Override
    public Optional<Dependency> findActive(String sourceTaskId, String targetTaskId, DependencyType type) {
        return snapshot().stream()
            .filter(Dependency::active)
            .filter(d -> d.sourceTaskId().equals(sourceTaskId)
                      && d.targetTaskId().equals(targetTaskId)
                      && d.type() == type)
            .findFirst();
    }

    @Override
    public List<Dependency> findActiveByProject(String projectId) {
        return snapshot().stream()
            .filter(Dependency::active)
            .filter(d -> projectId.equals(d.projectId()))
            .collect(Collectors.toList());
    }

    @Override
    public List<Dependency> findActiveByTask(String taskId) {
        return snapshot().stream()
            .filter(Dependency::active)
            .filter(d -> d.involves(taskId))
            .collect(Collectors.toList());
    }

    @Override
    public boolean delete(String dependencyId) {
        return dependencies.remove(dependencyId) != null;
    }

    private List<Dependency> snapshot() {
        synchronized (dependencies) {
            return new ArrayList<>(dependencies.values());
        }
    }
}
