package com.taskgraph.engine.graph;

import com.taskgraph.core.exception.CycleDetectedException;
import com.taskgraph.core.exception.ValidationException;
import com.taskgraph.core.model.dependency.CriticalPathAnalysis;
import com.taskgraph.core.model.dependency.Dependency;
import com.taskgraph.core.model.dependency.DependencyType;
import com.taskgraph.core.model.dependency.TaskSchedule;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class CriticalPathCalculatorTest {

    private static final LocalDate START = LocalDate.of(2025, 3, 3);

    private final CriticalPathCalculator calculator = new CriticalPathCalculator(new CycleDetector());

    private static Dependency blocks(String source, String target, int lag) {
        return Dependency.create("p1", source, target, DependencyType.BLOCKS, lag, null, "u1", Instant.EPOCH);
    }

    private CriticalPathAnalysis compute(List<Dependency> edges, Map<String, Integer> durations) {
        PrecedenceGraph graph = PrecedenceGraph.of(edges, durations.keySet());
        return calculator.compute("p1", graph, id -> durations.getOrDefault(id, 1), START, Instant.EPOCH);
    }

    @Test
    @DisplayName("Linear chain is entirely critical")
    void testLinearChain() {
        CriticalPathAnalysis analysis = compute(
            List.of(blocks("A", "B", 0), blocks("B", "C", 0)),
            Map.of("A", 2, "B", 3, "C", 1));

        assertThat(analysis.criticalTasks()).containsExactly("A", "B", "C");
        assertThat(analysis.projectDurationDays()).isEqualTo(6);
        assertThat(analysis.schedules().values()).allMatch(s -> s.slack() == 0);
        assertThat(analysis.projectEndDate()).isEqualTo(START.plusDays(6));
    }

    @Test
    @DisplayName("Shorter parallel branch carries slack")
    void testParallelBranchSlack() {
        // A(2) -> B(5) -> D(1), A(2) -> C(1) -> D(1)
        CriticalPathAnalysis analysis = compute(
            List.of(blocks("A", "B", 0), blocks("A", "C", 0), blocks("B", "D", 0), blocks("C", "D", 0)),
            Map.of("A", 2, "B", 5, "C", 1, "D", 1));

        assertThat(analysis.criticalTasks()).containsExactly("A", "B", "D");
        assertThat(analysis.projectDurationDays()).isEqualTo(8);

        TaskSchedule c = analysis.schedule("C").orElseThrow();
        assertThat(c.earliestStart()).isEqualTo(2);
        assertThat(c.latestStart()).isEqualTo(6);
        assertThat(c.slack()).isEqualTo(4);
        assertThat(analysis.earliestStartDate("C")).contains(START.plusDays(2));
    }

    @Test
    @DisplayName("Lag delays the successor")
    void testLag() {
        CriticalPathAnalysis analysis = compute(
            List.of(blocks("A", "B", 3)),
            Map.of("A", 2, "B", 1));

        assertThat(analysis.schedule("B").orElseThrow().earliestStart()).isEqualTo(5);
        assertThat(analysis.projectDurationDays()).isEqualTo(6);
        assertThat(analysis.criticalTasks()).containsExactly("A", "B");
    }

    @Test
    @DisplayName("Negative lag never pushes a start before day zero")
    void testNegativeLag() {
        CriticalPathAnalysis analysis = compute(
            List.of(blocks("A", "B", -5)),
            Map.of("A", 2, "B", 4));

        assertThat(analysis.schedule("B").orElseThrow().earliestStart()).isZero();
        assertThat(analysis.schedules().values()).allMatch(s -> s.slack() >= 0);
        assertThat(analysis.criticalTasks()).isNotEmpty();
    }

    @Test
    @DisplayName("Isolated tasks are scheduled at day zero")
    void testIsolatedTask() {
        CriticalPathAnalysis analysis = compute(List.of(), Map.of("solo", 4));

        assertThat(analysis.criticalTasks()).containsExactly("solo");
        assertThat(analysis.projectDurationDays()).isEqualTo(4);
    }

    @Test
    @DisplayName("Empty graph yields an empty analysis")
    void testEmpty() {
        CriticalPathAnalysis analysis = compute(List.of(), Map.of());

        assertThat(analysis.criticalTasks()).isEmpty();
        assertThat(analysis.projectDurationDays()).isZero();
    }

    @Test
    @DisplayName("Cyclic graph cannot be scheduled")
    void testCycleRejected() {
        assertThatThrownBy(() -> compute(List.of(blocks("A", "B", 0), blocks("B", "A", 0)), Map.of()))
            .isInstanceOf(CycleDetectedException.class)
            .satisfies(e -> assertThat(((CycleDetectedException) e).getCycle()).containsExactly("A", "B"));
    }

    @Test
    @DisplayName("Negative duration is rejected")
    void testNegativeDuration() {
        assertThatThrownBy(() -> compute(List.of(blocks("A", "B", 0)), Map.of("A", -1)))
            .isInstanceOf(ValidationException.class);
    }
}
