package com.taskgraph.core.model.automation;

import java.util.Set;

/**
 * Restricts a rule to tasks of certain projects or boards.
 * Empty id sets do not restrict.
 */
public record RuleScope(
    Set<String> projectIds,
    Set<String> boardIds,
    boolean appliesToSubtasks
) {
    public RuleScope {
        projectIds = projectIds == null ? Set.of() : Set.copyOf(projectIds);
        boardIds = boardIds == null ? Set.of() : Set.copyOf(boardIds);
    }

    public static RuleScope unrestricted() {
        return new RuleScope(Set.of(), Set.of(), true);
    }

    public static RuleScope projects(Set<String> projectIds) {
        return new RuleScope(projectIds, Set.of(), true);
    }

    /**
     * Check a task against the scope.
     *
     * @param projectId task project, may be null
     * @param boardId   task board, may be null
     * @param subtask   whether the task has a parent
     */
    public boolean includes(String projectId, String boardId, boolean subtask) {
        if (!projectIds.isEmpty() && (projectId == null || !projectIds.contains(projectId))) {
            return false;
        }
        if (!boardIds.isEmpty() && (boardId == null || !boardIds.contains(boardId))) {
            return false;
        }
        return appliesToSubtasks || !subtask;
    }
}
