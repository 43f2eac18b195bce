package com.taskgraph.core.model;

import com.taskgraph.core.exception.ValidationException;
import com.taskgraph.core.model.dependency.Dependency;
import com.taskgraph.core.model.dependency.DependencyType;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class DependencyTest {

    private static final Instant NOW = Instant.parse("2025-01-06T00:00:00Z");

    @Test
    void blocks_shouldPutSourceFirst() {
        Dependency dependency = Dependency.create("p1", "A", "B", DependencyType.BLOCKS, 0, null, "u1", NOW);

        assertEquals("A", dependency.predecessorId());
        assertEquals("B", dependency.successorId());
    }

    @Test
    void blockedBy_shouldPutTargetFirst() {
        Dependency dependency = Dependency.create("p1", "A", "B", DependencyType.BLOCKED_BY, 0, null, "u1", NOW);

        assertEquals("B", dependency.predecessorId());
        assertEquals("A", dependency.successorId());
    }

    @Test
    void isScheduling_shouldOnlyIncludeBlockingTypes() {
        for (DependencyType type : DependencyType.values()) {
            boolean expected = type == DependencyType.BLOCKS || type == DependencyType.BLOCKED_BY;
            assertEquals(expected, type.isScheduling(), type.name());
        }
    }

    @Test
    void create_shouldRejectLagOutsideRange() {
        assertThrows(ValidationException.class,
            () -> Dependency.create("p1", "A", "B", DependencyType.BLOCKS, 366, null, "u1", NOW));
        assertThrows(ValidationException.class,
            () -> Dependency.create("p1", "A", "B", DependencyType.BLOCKS, -366, null, "u1", NOW));
        assertDoesNotThrow(
            () -> Dependency.create("p1", "A", "B", DependencyType.BLOCKS, -365, null, "u1", NOW));
    }
}
