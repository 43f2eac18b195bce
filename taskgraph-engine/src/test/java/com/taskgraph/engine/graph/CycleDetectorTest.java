package com.taskgraph.engine.graph;

import com.taskgraph.core.model.dependency.Dependency;
import com.taskgraph.core.model.dependency.DependencyType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class CycleDetectorTest {

    private final CycleDetector detector = new CycleDetector();

    private static Dependency edge(String source, String target, DependencyType type) {
        return Dependency.create("p1", source, target, type, 0, null, "u1", Instant.EPOCH);
    }

    private static Dependency blocks(String source, String target) {
        return edge(source, target, DependencyType.BLOCKS);
    }

    @Test
    @DisplayName("Acyclic graph has no cycles")
    void testAcyclicGraph() {
        PrecedenceGraph graph = PrecedenceGraph.of(List.of(
            blocks("A", "B"), blocks("B", "C"), blocks("A", "C"), blocks("C", "D")));

        assertThat(detector.findCycles(graph)).isEmpty();
        assertThat(detector.hasCycle(graph)).isFalse();
    }

    @Test
    @DisplayName("Cycle is reported in edge order starting at its smallest task id")
    void testCycleNormalized() {
        PrecedenceGraph graph = PrecedenceGraph.of(List.of(
            blocks("C", "A"), blocks("A", "B"), blocks("B", "C")));

        assertThat(detector.findCycles(graph)).containsExactly(List.of("A", "B", "C"));
    }

    @Test
    @DisplayName("blocked_by edges are reversed before searching")
    void testBlockedByNormalization() {
        // A blocks B, and A blocked_by B means B precedes A: A -> B -> A
        PrecedenceGraph graph = PrecedenceGraph.of(List.of(
            blocks("A", "B"), edge("A", "B", DependencyType.BLOCKED_BY)));

        assertThat(detector.findCycles(graph)).containsExactly(List.of("A", "B"));
    }

    @Test
    @DisplayName("Non-scheduling edges never form cycles")
    void testNonSchedulingIgnored() {
        PrecedenceGraph graph = PrecedenceGraph.of(List.of(
            edge("A", "B", DependencyType.RELATES_TO), edge("B", "A", DependencyType.RELATES_TO)));

        assertThat(graph.size()).isZero();
        assertThat(detector.findCycles(graph)).isEmpty();
    }

    @Test
    @DisplayName("Two disjoint cycles are both found")
    void testDisjointCycles() {
        PrecedenceGraph graph = PrecedenceGraph.of(List.of(
            blocks("A", "B"), blocks("B", "A"),
            blocks("X", "Y"), blocks("Y", "Z"), blocks("Z", "X")));

        assertThat(detector.findCycles(graph))
            .containsExactlyInAnyOrder(List.of("A", "B"), List.of("X", "Y", "Z"));
    }

    @Test
    @DisplayName("Deep chains do not overflow the thread stack")
    void testDeepChain() {
        List<Dependency> chain = new ArrayList<>();
        for (int i = 0; i < 20_000; i++) {
            chain.add(blocks("t" + i, "t" + (i + 1)));
        }
        assertThat(detector.findCycles(PrecedenceGraph.of(chain))).isEmpty();

        chain.add(blocks("t20000", "t0"));
        assertThat(detector.findCycles(PrecedenceGraph.of(chain))).hasSize(1);
    }
}
