package com.taskgraph.engine.graph;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Depth-first cycle search over a precedence graph.
 *
 * Iterative: the DFS path is an explicit stack with a per-node edge cursor, so graph depth
 * is bounded by heap, not by the thread stack. An edge into a node on the current path
 * closes a cycle; an edge into a finished node is skipped.
 */
public class CycleDetector {

    private static final byte UNVISITED = 0;
    private static final byte ON_PATH = 1;
    private static final byte DONE = 2;

    /**
     * Find all distinct cycles reachable by the search.
     *
     * Each cycle lists task ids in edge order, rotated to start at its smallest id; the
     * last task links back to the first. Cycles are returned in discovery order.
     */
    public List<List<String>> findCycles(PrecedenceGraph graph) {
        int n = graph.size();
        byte[] state = new byte[n];
        int[] cursor = new int[n];
        int[] pathPosition = new int[n];
        List<Integer> path = new ArrayList<>();
        Set<List<String>> cycles = new LinkedHashSet<>();

        for (int root = 0; root < n; root++) {
            if (state[root] != UNVISITED) {
                continue;
            }
            push(root, state, pathPosition, path);

            while (!path.isEmpty()) {
                int v = path.get(path.size() - 1);
                List<PrecedenceGraph.Edge> out = graph.successors(v);

                if (cursor[v] < out.size()) {
                    int w = out.get(cursor[v]++).to();
                    if (state[w] == ON_PATH) {
                        cycles.add(normalize(graph, path.subList(pathPosition[w], path.size())));
                    } else if (state[w] == UNVISITED) {
                        push(w, state, pathPosition, path);
                    }
                } else {
                    state[v] = DONE;
                    path.remove(path.size() - 1);
                }
            }
        }
        return new ArrayList<>(cycles);
    }

    public boolean hasCycle(PrecedenceGraph graph) {
        return !findCycles(graph).isEmpty();
    }

    private static void push(int v, byte[] state, int[] pathPosition, List<Integer> path) {
        state[v] = ON_PATH;
        pathPosition[v] = path.size();
        path.add(v);
    }

    private static List<String> normalize(PrecedenceGraph graph, List<Integer> cycle) {
        int start = 0;
        for (int i = 1; i < cycle.size(); i++) {
            if (graph.taskId(cycle.get(i)).compareTo(graph.taskId(cycle.get(start))) < 0) {
                start = i;
            }
        }
        List<String> ids = new ArrayList<>(cycle.size());
        for (int i = 0; i < cycle.size(); i++) {
            ids.add(graph.taskId(cycle.get((start + i) % cycle.size())));
        }
        return List.copyOf(ids);
    }
}
