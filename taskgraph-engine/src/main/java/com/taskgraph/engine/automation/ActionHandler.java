package com.taskgraph.engine.automation;

import com.taskgraph.core.model.automation.Action;
import com.taskgraph.core.model.automation.ActionType;
import com.taskgraph.core.model.automation.ChangeRecord;

/**
 * Carries out one action type.
 */
public interface ActionHandler {

    ActionType type();

    /**
     * Perform the action.
     *
     * @param action The action
     * @param context The rule execution
     * @return The change made
     * @throws ActionExecutionException if the action cannot be performed
     */
    ChangeRecord execute(Action action, ActionContext context);

    /**
     * Describe the change the action would make, without making it.
     *
     * @param action The action
     * @param context The rule execution
     * @return The planned change
     */
    ChangeRecord preview(Action action, ActionContext context);
}
