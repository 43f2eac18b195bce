package com.taskgraph.core.model.dependency;

/**
 * Kind of relationship between two tasks.
 * Only scheduling types constrain ordering; the rest are informational links.
 */
public enum DependencyType {
    BLOCKS,         // source precedes target
    BLOCKED_BY,     // target precedes source
    RELATES_TO,
    DUPLICATES,
    PARENT_CHILD,
    CAUSED_BY,
    RESOLVES;

    /**
     * Check if this type takes part in cycle detection and critical-path analysis.
     */
    public boolean isScheduling() {
        return this == BLOCKS || this == BLOCKED_BY;
    }
}
