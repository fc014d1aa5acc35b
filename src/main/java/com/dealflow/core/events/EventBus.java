package com.dealflow.core.events;

import com.dealflow.core.config.SupervisorProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Supervisor event log with pub/sub delivery.
 * <p>
 * Every published event is appended to its workflow's log, which keeps the most recent
 * {@code eventLogCapacity} events for the {@code eventLogWorkflows} most recently active
 * workflows. Subscribers register for one event type or for all events. A failing
 * subscriber never prevents delivery to the others.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final int logCapacity;

    /** Subscribers keyed by event type. */
    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<SupervisorEvent>>> typeSubscribers =
            new ConcurrentHashMap<>();

    private final CopyOnWriteArrayList<Consumer<SupervisorEvent>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    /** Per-workflow logs in access order; guarded by itself. */
    private final LinkedHashMap<String, Deque<SupervisorEvent>> workflowLogs;

    public EventBus(SupervisorProperties properties) {
        this.logCapacity = Math.max(1, properties.getEventLogCapacity());
        int maxWorkflows = Math.max(1, properties.getEventLogWorkflows());
        this.workflowLogs = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Deque<SupervisorEvent>> eldest) {
                return size() > maxWorkflows;
            }
        };
    }

    public void publish(SupervisorEvent event) {
        log.debug("Publishing {} for workflow {}", event.eventType(), event.workflowId());
        record(event);

        List<Consumer<SupervisorEvent>> subs = typeSubscribers.get(event.eventType());
        if (subs != null) {
            for (Consumer<SupervisorEvent> subscriber : subs) {
                deliverSafely(subscriber, event);
            }
        }
        for (Consumer<SupervisorEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    /**
     * Subscribe to one event type, such as {@link SupervisorEvent#ESCALATION_RAISED}.
     *
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(String eventType, Consumer<SupervisorEvent> consumer) {
        typeSubscribers.computeIfAbsent(eventType, k -> new CopyOnWriteArrayList<>()).add(consumer);
        return () -> {
            CopyOnWriteArrayList<Consumer<SupervisorEvent>> subs = typeSubscribers.get(eventType);
            if (subs != null) {
                subs.remove(consumer);
            }
        };
    }

    public Subscription subscribeAll(Consumer<SupervisorEvent> consumer) {
        globalSubscribers.add(consumer);
        return () -> globalSubscribers.remove(consumer);
    }

    /**
     * The logged events of a workflow, oldest first.
     */
    public List<SupervisorEvent> events(String workflowId) {
        synchronized (workflowLogs) {
            Deque<SupervisorEvent> events = workflowLogs.get(workflowId);
            return events == null ? List.of() : List.copyOf(events);
        }
    }

    /**
     * Drops all logged events. Subscriptions stay in place.
     */
    public void clearLogs() {
        synchronized (workflowLogs) {
            workflowLogs.clear();
        }
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void record(SupervisorEvent event) {
        if (event.workflowId() == null || event.workflowId().isBlank()) {
            return;
        }
        synchronized (workflowLogs) {
            Deque<SupervisorEvent> events = workflowLogs.computeIfAbsent(event.workflowId(), k -> new ArrayDeque<>());
            events.addLast(event);
            while (events.size() > logCapacity) {
                events.removeFirst();
            }
        }
    }

    private void deliverSafely(Consumer<SupervisorEvent> subscriber, SupervisorEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.eventType(), e.getMessage(), e);
        }
    }
}
