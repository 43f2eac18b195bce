package com.taskgraph.core.spi;

import com.taskgraph.core.model.automation.AutomationEvent;

/**
 * Domain event fan-out between engine components.
 * The dependency and workflow engines publish; the automation engine subscribes.
 */
public interface EventPublisher {

    /**
     * Deliver an event to every subscriber.
     *
     * @param event The event
     */
    void publish(AutomationEvent event);

    /**
     * Register a subscriber for all subsequent events.
     *
     * @param subscriber The subscriber
     */
    void subscribe(EventSubscriber subscriber);
}
