package com.dealflow.core.decision;

import com.dealflow.core.config.SupervisorProperties;
import com.dealflow.core.model.DecisionType;
import com.dealflow.core.model.SupervisorDecision;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Append-only record of every decision the supervisor took, oldest first.
 * <p>
 * Bounded by {@code historyCapacity}; the oldest entries drop off once full. Decisions
 * that lost a decision conflict are marked discarded rather than removed.
 */
@Component
public class DecisionHistory {

    private final int capacity;
    private final Deque<SupervisorDecision> entries = new ArrayDeque<>();
    private final Set<String> discarded = new HashSet<>();

    public DecisionHistory(SupervisorProperties properties) {
        this.capacity = Math.max(1, properties.getHistoryCapacity());
    }

    public synchronized void append(SupervisorDecision decision) {
        entries.addLast(decision);
        while (entries.size() > capacity) {
            SupervisorDecision evicted = entries.removeFirst();
            discarded.remove(evicted.getId());
        }
    }

    /**
     * Returns up to {@code limit} most recent decisions, oldest first.
     */
    public synchronized List<SupervisorDecision> recent(int limit) {
        List<SupervisorDecision> all = new ArrayList<>(entries);
        int from = Math.max(0, all.size() - Math.max(0, limit));
        return List.copyOf(all.subList(from, all.size()));
    }

    /**
     * Routing and end decisions of a workflow that are neither executed nor discarded.
     */
    public synchronized List<SupervisorDecision> open(String workflowId) {
        return entries.stream()
                .filter(d -> workflowId.equals(d.getWorkflowId()))
                .filter(d -> d.getDecisionType() == DecisionType.ROUTE_TO_AGENT
                        || d.getDecisionType() == DecisionType.END_WORKFLOW)
                .filter(d -> !d.isExecuted() && !discarded.contains(d.getId()))
                .toList();
    }

    public synchronized Optional<SupervisorDecision> find(String decisionId) {
        return entries.stream().filter(d -> d.getId().equals(decisionId)).findFirst();
    }

    /**
     * Marks a decision as discarded. Returns false if it is unknown or already discarded.
     */
    public synchronized boolean discard(String decisionId) {
        if (find(decisionId).isEmpty()) {
            return false;
        }
        return discarded.add(decisionId);
    }

    public synchronized boolean isDiscarded(String decisionId) {
        return discarded.contains(decisionId);
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized void clear() {
        entries.clear();
        discarded.clear();
    }
}
