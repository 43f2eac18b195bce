package com.taskgraph.engine.events;

import com.taskgraph.core.model.automation.AutomationEvent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class InMemoryEventPublisherTest {

    @Test
    @DisplayName("Failing subscriber does not stop delivery to the others")
    void testFailingSubscriberIsolated() {
        InMemoryEventPublisher publisher = new InMemoryEventPublisher();
        List<String> received = new ArrayList<>();
        publisher.subscribe(event -> {
            throw new IllegalStateException("boom");
        });
        publisher.subscribe(event -> received.add(event.entityId()));

        publisher.publish(AutomationEvent.statusChanged("task", "T1", "todo", "done", Instant.EPOCH));

        assertThat(received).containsExactly("T1");
        assertThat(publisher.subscriberCount()).isEqualTo(2);
    }
}
