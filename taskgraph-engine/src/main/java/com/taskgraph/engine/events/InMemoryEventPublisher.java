package com.taskgraph.engine.events;

import com.taskgraph.core.model.automation.AutomationEvent;
import com.taskgraph.core.spi.EventPublisher;
import com.taskgraph.core.spi.EventSubscriber;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Synchronous in-process fan-out. Subscribers run on the publishing thread in
 * registration order; one failing subscriber does not stop the others.
 */
public class InMemoryEventPublisher implements EventPublisher {

    private static final Logger log = LoggerFactory.getLogger(InMemoryEventPublisher.class);

    private final List<EventSubscriber> subscribers = new CopyOnWriteArrayList<>();

    @Override
    public void publish(AutomationEvent event) {
        log.debug("Publishing {} for {}:{}", event.triggerType(), event.entityType(), event.entityId());
        for (EventSubscriber subscriber : subscribers) {
            try {
                subscriber.onEvent(event);
            } catch (RuntimeException e) {
                log.error("Subscriber failed on {} for {}:{}",
                    event.triggerType(), event.entityType(), event.entityId(), e);
            }
        }
    }

    @Override
    public void subscribe(EventSubscriber subscriber) {
        subscribers.add(subscriber);
    }

    public int subscriberCount() {
        return subscribers.size();
    }
}
