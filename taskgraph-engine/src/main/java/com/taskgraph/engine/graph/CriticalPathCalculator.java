package com.taskgraph.engine.graph;

import com.taskgraph.core.exception.CycleDetectedException;
import com.taskgraph.core.exception.ValidationException;
import com.taskgraph.core.model.dependency.CriticalPathAnalysis;
import com.taskgraph.core.model.dependency.TaskSchedule;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.ToIntFunction;

/**
 * Two-pass critical path method over a precedence graph.
 *
 * Forward pass in topological order: ES = max(0, max over predecessors of EF + lag).
 * Backward pass in reverse order: LF = min(project end, min over successors of LS - lag).
 * Slack = LS - ES; zero-slack tasks form the critical path.
 */
public class CriticalPathCalculator {

    private final CycleDetector cycleDetector;

    public CriticalPathCalculator(CycleDetector cycleDetector) {
        this.cycleDetector = cycleDetector;
    }

    /**
     * Kahn topological order of the graph's indices.
     *
     * @throws CycleDetectedException if the graph has a cycle
     */
    public int[] topologicalOrder(PrecedenceGraph graph) {
        int n = graph.size();
        int[] inDegree = new int[n];
        for (int v = 0; v < n; v++) {
            inDegree[v] = graph.predecessors(v).size();
        }

        Deque<Integer> ready = new ArrayDeque<>();
        for (int v = 0; v < n; v++) {
            if (inDegree[v] == 0) {
                ready.add(v);
            }
        }

        int[] order = new int[n];
        int count = 0;
        while (!ready.isEmpty()) {
            int v = ready.poll();
            order[count++] = v;
            for (PrecedenceGraph.Edge edge : graph.successors(v)) {
                if (--inDegree[edge.to()] == 0) {
                    ready.add(edge.to());
                }
            }
        }

        if (count < n) {
            List<List<String>> cycles = cycleDetector.findCycles(graph);
            throw new CycleDetectedException(cycles.isEmpty() ? List.of() : cycles.get(0));
        }
        return order;
    }

    /**
     * Compute the schedule of every task in the graph.
     *
     * @param projectId project the graph belongs to
     * @param graph     precedence graph
     * @param durations duration in days per task id; must be >= 0
     * @param startDate calendar date of day offset 0
     * @param now       analysis timestamp
     */
    public CriticalPathAnalysis compute(String projectId, PrecedenceGraph graph,
                                        ToIntFunction<String> durations,
                                        LocalDate startDate, Instant now) {
        int n = graph.size();
        int[] duration = new int[n];
        for (int v = 0; v < n; v++) {
            duration[v] = durations.applyAsInt(graph.taskId(v));
            if (duration[v] < 0) {
                throw new ValidationException("duration",
                    "task " + graph.taskId(v) + " has negative duration " + duration[v]);
            }
        }

        int[] order = topologicalOrder(graph);
        int[] position = new int[n];
        for (int i = 0; i < n; i++) {
            position[order[i]] = i;
        }

        // Forward pass
        int[] es = new int[n];
        int[] ef = new int[n];
        int projectEnd = 0;
        for (int v : order) {
            int start = 0;
            for (PrecedenceGraph.Edge edge : graph.predecessors(v)) {
                start = Math.max(start, ef[edge.from()] + edge.lagDays());
            }
            es[v] = start;
            ef[v] = start + duration[v];
            projectEnd = Math.max(projectEnd, ef[v]);
        }

        // Backward pass
        int[] ls = new int[n];
        int[] lf = new int[n];
        for (int i = n - 1; i >= 0; i--) {
            int v = order[i];
            int finish = projectEnd;
            for (PrecedenceGraph.Edge edge : graph.successors(v)) {
                finish = Math.min(finish, ls[edge.to()] - edge.lagDays());
            }
            lf[v] = finish;
            ls[v] = finish - duration[v];
        }

        Map<String, TaskSchedule> schedules = new LinkedHashMap<>();
        List<Integer> critical = new ArrayList<>();
        for (int v : order) {
            TaskSchedule schedule = new TaskSchedule(graph.taskId(v), duration[v], es[v], ef[v], ls[v], lf[v]);
            schedules.put(schedule.taskId(), schedule);
            if (schedule.isCritical()) {
                critical.add(v);
            }
        }
        critical.sort(Comparator.<Integer>comparingInt(v -> es[v]).thenComparingInt(v -> position[v]));

        List<String> criticalTasks = new ArrayList<>(critical.size());
        critical.forEach(v -> criticalTasks.add(graph.taskId(v)));

        return new CriticalPathAnalysis(projectId, criticalTasks, projectEnd, schedules, startDate, now);
    }
}
