package com.taskgraph.engine.workflow;

import com.taskgraph.core.model.task.UserRecord;
import com.taskgraph.core.model.workflow.StateDefinition;
import com.taskgraph.core.model.workflow.TransitionDefinition;
import com.taskgraph.core.model.workflow.WorkflowDefinition;
import com.taskgraph.core.spi.UserDirectory;
import com.taskgraph.engine.cache.AuthorizationCache;

/**
 * Decides who may perform a transition or approve a state.
 * Answers are cached per (workflow, transition or state, user).
 */
public class TransitionAuthorizer {

    private final AuthorizationCache cache;
    private final UserDirectory userDirectory;

    public TransitionAuthorizer(AuthorizationCache cache, UserDirectory userDirectory) {
        this.cache = cache;
        this.userDirectory = userDirectory;
    }

    public boolean canTransition(WorkflowDefinition workflow, TransitionDefinition transition, String actorId) {
        if (transition.allowAll()) {
            return true;
        }
        if (actorId == null) {
            return false;
        }
        var key = new AuthorizationCache.Key(
            workflow.id(), AuthorizationCache.Subject.TRANSITION, transition.id(), actorId);
        return cache.isAllowed(key, () -> {
            if (transition.allowedUsers().contains(actorId)) {
                return true;
            }
            String role = roleOf(actorId);
            return role != null && transition.allowedRoles().contains(role);
        });
    }

    public boolean canApprove(WorkflowDefinition workflow, StateDefinition state, String actorId) {
        if (actorId == null) {
            return false;
        }
        var key = new AuthorizationCache.Key(
            workflow.id(), AuthorizationCache.Subject.APPROVAL, state.id(), actorId);
        return cache.isAllowed(key, () -> state.canApprove(actorId, roleOf(actorId)));
    }

    private String roleOf(String userId) {
        return userDirectory.get(userId).map(UserRecord::role).orElse(null);
    }
}
