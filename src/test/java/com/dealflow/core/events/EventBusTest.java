package com.dealflow.core.events;

import com.dealflow.core.config.SupervisorProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link EventBus}.
 */
class EventBusTest {

    private SupervisorProperties properties;
    private EventBus eventBus;

    @BeforeEach
    void setUp() {
        properties = new SupervisorProperties();
        properties.setEventLogCapacity(3);
        properties.setEventLogWorkflows(2);
        eventBus = new EventBus(properties);
    }

    private static SupervisorEvent event(String type, String workflowId) {
        return new SupervisorEvent(type, workflowId, null, Map.of(), Instant.now());
    }

    @Nested
    @DisplayName("Subscriptions")
    class Subscriptions {

        @Test
        @DisplayName("type subscriber receives only its event type")
        void receivesOwnType() {
            List<SupervisorEvent> received = new CopyOnWriteArrayList<>();
            eventBus.subscribe(SupervisorEvent.ESCALATION_RAISED, received::add);

            eventBus.publish(event(SupervisorEvent.DECISION_MADE, "wf-1"));
            eventBus.publish(event(SupervisorEvent.ESCALATION_RAISED, "wf-2"));

            assertEquals(1, received.size());
            assertEquals("wf-2", received.get(0).workflowId());
        }

        @Test
        @DisplayName("unsubscribe stops delivery")
        void unsubscribe() {
            List<SupervisorEvent> received = new CopyOnWriteArrayList<>();
            var subscription = eventBus.subscribe(SupervisorEvent.DECISION_MADE, received::add);

            subscription.unsubscribe();
            eventBus.publish(event(SupervisorEvent.DECISION_MADE, "wf-1"));

            assertTrue(received.isEmpty());
        }

        @Test
        @DisplayName("global subscriber receives every event, including supervisor-wide ones")
        void receivesAll() {
            List<SupervisorEvent> received = new CopyOnWriteArrayList<>();
            eventBus.subscribeAll(received::add);

            eventBus.publish(event(SupervisorEvent.DECISION_MADE, "wf-1"));
            eventBus.publish(event(SupervisorEvent.ESCALATION_ANSWERED, null));

            assertEquals(2, received.size());
        }

        @Test
        @DisplayName("a failing subscriber does not block the others")
        void failingSubscriberIsolated() {
            List<SupervisorEvent> received = new CopyOnWriteArrayList<>();
            eventBus.subscribeAll(e -> {
                throw new IllegalStateException("boom");
            });
            eventBus.subscribeAll(received::add);

            eventBus.publish(event(SupervisorEvent.CONFLICT_RESOLVED, "wf-1"));

            assertEquals(1, received.size());
        }
    }

    @Nested
    @DisplayName("Workflow event log")
    class WorkflowLog {

        @Test
        @DisplayName("keeps the latest events of each workflow, oldest first")
        void keepsLatest() {
            for (String type : List.of("a", "b", "c", "d")) {
                eventBus.publish(event(type, "wf-1"));
            }
            eventBus.publish(event("x", "wf-2"));

            assertEquals(List.of("b", "c", "d"),
                    eventBus.events("wf-1").stream().map(SupervisorEvent::eventType).toList());
            assertEquals(1, eventBus.events("wf-2").size());
        }

        @Test
        @DisplayName("drops the least recently active workflow beyond the limit")
        void boundedWorkflows() {
            eventBus.publish(event("a", "wf-1"));
            eventBus.publish(event("a", "wf-2"));
            eventBus.publish(event("b", "wf-1"));
            eventBus.publish(event("a", "wf-3"));

            assertTrue(eventBus.events("wf-2").isEmpty());
            assertEquals(2, eventBus.events("wf-1").size());
            assertEquals(1, eventBus.events("wf-3").size());
        }

        @Test
        @DisplayName("supervisor-wide events are delivered but not logged")
        void supervisorWideNotLogged() {
            eventBus.publish(event(SupervisorEvent.ESCALATION_ANSWERED, null));
            assertTrue(eventBus.events("").isEmpty());
        }

        @Test
        @DisplayName("clearLogs empties every log")
        void clearLogs() {
            eventBus.publish(event("a", "wf-1"));
            eventBus.clearLogs();
            assertTrue(eventBus.events("wf-1").isEmpty());
        }
    }
}
