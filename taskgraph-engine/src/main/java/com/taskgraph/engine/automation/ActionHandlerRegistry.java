package com.taskgraph.engine.automation;

import com.taskgraph.core.model.automation.ActionType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Action handlers by action type. Registering a type again replaces its handler.
 */
public class ActionHandlerRegistry {

    private static final Logger log = LoggerFactory.getLogger(ActionHandlerRegistry.class);

    private final Map<ActionType, ActionHandler> handlers = new EnumMap<>(ActionType.class);

    public ActionHandlerRegistry() {
    }

    public ActionHandlerRegistry(Collection<? extends ActionHandler> initial) {
        initial.forEach(this::register);
    }

    public synchronized void register(ActionHandler handler) {
        ActionHandler previous = handlers.put(handler.type(), handler);
        if (previous != null) {
            log.info("Replaced handler for action type {}", handler.type());
        }
    }

    public synchronized Optional<ActionHandler> find(ActionType type) {
        return Optional.ofNullable(handlers.get(type));
    }

    public synchronized Set<ActionType> supportedTypes() {
        return Set.copyOf(handlers.keySet());
    }
}
