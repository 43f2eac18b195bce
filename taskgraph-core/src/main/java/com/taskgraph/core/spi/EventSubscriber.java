package com.taskgraph.core.spi;

import com.taskgraph.core.model.automation.AutomationEvent;

/**
 * Receives domain events routed through an {@link EventPublisher}.
 */
@FunctionalInterface
public interface EventSubscriber {

    void onEvent(AutomationEvent event);
}
