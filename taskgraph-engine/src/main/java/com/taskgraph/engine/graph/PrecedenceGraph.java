package com.taskgraph.engine.graph;

import com.taskgraph.core.model.dependency.Dependency;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Immutable precedence graph built from a snapshot of scheduling dependencies.
 *
 * Tasks live in an index arena: each task id maps to a dense int, and adjacency is kept
 * per index. Indices follow first appearance in the input, which makes every traversal
 * deterministic. blocked_by edges are normalized so that every edge runs from the task
 * that must finish first to the task that waits.
 */
public final class PrecedenceGraph {

    /**
     * A normalized edge between two task indices.
     */
    public record Edge(int from, int to, int lagDays) {}

    private final Map<String, Integer> index;
    private final List<String> taskIds;
    private final List<List<Edge>> successors;
    private final List<List<Edge>> predecessors;

    private PrecedenceGraph(Map<String, Integer> index, List<String> taskIds,
                            List<List<Edge>> successors, List<List<Edge>> predecessors) {
        this.index = index;
        this.taskIds = taskIds;
        this.successors = successors;
        this.predecessors = predecessors;
    }

    /**
     * Build from dependencies; non-scheduling and inactive edges are ignored.
     */
    public static PrecedenceGraph of(Collection<Dependency> dependencies) {
        return of(dependencies, List.of());
    }

    /**
     * Build from dependencies plus standalone tasks that have no edges.
     */
    public static PrecedenceGraph of(Collection<Dependency> dependencies, Collection<String> extraTaskIds) {
        Map<String, Integer> index = new LinkedHashMap<>();
        List<String> taskIds = new ArrayList<>();
        List<List<Edge>> successors = new ArrayList<>();
        List<List<Edge>> predecessors = new ArrayList<>();

        for (Dependency dependency : dependencies) {
            if (!dependency.active() || !dependency.isScheduling()) {
                continue;
            }
            int from = intern(dependency.predecessorId(), index, taskIds, successors, predecessors);
            int to = intern(dependency.successorId(), index, taskIds, successors, predecessors);
            Edge edge = new Edge(from, to, dependency.lagDays());
            successors.get(from).add(edge);
            predecessors.get(to).add(edge);
        }
        for (String taskId : extraTaskIds) {
            intern(taskId, index, taskIds, successors, predecessors);
        }

        return new PrecedenceGraph(
            Collections.unmodifiableMap(index),
            Collections.unmodifiableList(taskIds),
            freeze(successors),
            freeze(predecessors)
        );
    }

    public int size() {
        return taskIds.size();
    }

    public boolean isEmpty() {
        return taskIds.isEmpty();
    }

    public String taskId(int i) {
        return taskIds.get(i);
    }

    public List<String> taskIds() {
        return taskIds;
    }

    public OptionalInt indexOf(String taskId) {
        Integer i = index.get(taskId);
        return i == null ? OptionalInt.empty() : OptionalInt.of(i);
    }

    public List<Edge> successors(int i) {
        return successors.get(i);
    }

    public List<Edge> predecessors(int i) {
        return predecessors.get(i);
    }

    public int edgeCount() {
        return successors.stream().mapToInt(List::size).sum();
    }

    private static int intern(String taskId, Map<String, Integer> index, List<String> taskIds,
                              List<List<Edge>> successors, List<List<Edge>> predecessors) {
        Integer existing = index.get(taskId);
        if (existing != null) {
            return existing;
        }
        int i = taskIds.size();
        index.put(taskId, i);
        taskIds.add(taskId);
        successors.add(new ArrayList<>());
        predecessors.add(new ArrayList<>());
        return i;
    }

    private static List<List<Edge>> freeze(List<List<Edge>> adjacency) {
        List<List<Edge>> frozen = new ArrayList<>(adjacency.size());
        adjacency.forEach(edges -> frozen.add(List.copyOf(edges)));
        return Collections.unmodifiableList(frozen);
    }
}
