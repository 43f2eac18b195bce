package com.taskgraph.core.model.workflow;

import java.time.Duration;
import java.util.List;
import java.util.Set;

/**
 * A state of a workflow definition.
 *
 * Entry and exit actions are automation rule ids run when the state is entered or left.
 */
public record StateDefinition(
    String id,
    String name,
    StateType type,

    // Approval
    int requiredApprovals,
    Set<String> approvalUsers,
    Set<String> approvalRoles,

    // Actions
    List<String> entryActions,
    List<String> exitActions,

    // Service level
    Duration slaDuration
) {
    public StateDefinition {
        approvalUsers = approvalUsers == null ? Set.of() : Set.copyOf(approvalUsers);
        approvalRoles = approvalRoles == null ? Set.of() : Set.copyOf(approvalRoles);
        entryActions = entryActions == null ? List.of() : List.copyOf(entryActions);
        exitActions = exitActions == null ? List.of() : List.copyOf(exitActions);
    }

    public static StateDefinition of(String id, String name, StateType type) {
        return new StateDefinition(id, name, type, 0, Set.of(), Set.of(), List.of(), List.of(), null);
    }

    public static StateDefinition approval(String id, String name, int requiredApprovals,
                                           Set<String> approvalUsers, Set<String> approvalRoles) {
        return new StateDefinition(id, name, StateType.APPROVAL, requiredApprovals,
            approvalUsers, approvalRoles, List.of(), List.of(), null);
    }

    public boolean isInitial() {
        return type == StateType.INITIAL;
    }

    public boolean isFinal() {
        return type.isTerminal();
    }

    public boolean requiresApproval() {
        return type == StateType.APPROVAL && requiredApprovals > 0;
    }

    /**
     * Anyone may approve when neither users nor roles are configured.
     */
    public boolean canApprove(String userId, String role) {
        if (approvalUsers.isEmpty() && approvalRoles.isEmpty()) {
            return true;
        }
        return approvalUsers.contains(userId) || (role != null && approvalRoles.contains(role));
    }

    public StateDefinition withSla(Duration sla) {
        return new StateDefinition(id, name, type, requiredApprovals, approvalUsers, approvalRoles,
            entryActions, exitActions, sla);
    }

    public StateDefinition withActions(List<String> entry, List<String> exit) {
        return new StateDefinition(id, name, type, requiredApprovals, approvalUsers, approvalRoles,
            entry, exit, slaDuration);
    }
}
