package com.taskgraph.engine.automation;

import com.taskgraph.core.exception.TaskGraphException;
import com.taskgraph.core.model.automation.ActionType;

/**
 * Thrown by an action handler when its action cannot be carried out.
 * Never leaves the automation engine; the message ends up in the rule's log.
 */
public class ActionExecutionException extends TaskGraphException {

    public static final String ERROR_CODE = "ACTION_FAILED";

    private final ActionType actionType;

    public ActionExecutionException(ActionType actionType, String message) {
        super(ERROR_CODE, message);
        this.actionType = actionType;
    }

    public ActionExecutionException(ActionType actionType, String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
        this.actionType = actionType;
    }

    public ActionType getActionType() {
        return actionType;
    }
}
