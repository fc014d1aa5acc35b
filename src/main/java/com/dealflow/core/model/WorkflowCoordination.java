package com.dealflow.core.model;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Live coordination record for one workflow. Created on the first coordination
 * update, mutated on every tick, archived (never removed) when the workflow ends.
 */
public class WorkflowCoordination {

    private final String workflowId;
    private final Set<String> activeAgents = new LinkedHashSet<>();
    private final Map<String, String> pendingTasks = new LinkedHashMap<>();
    private List<CoordinationStep> steps = List.of();
    private String coordinationId;
    private Instant lastCoordination;
    private boolean archived;

    public WorkflowCoordination(String workflowId) {
        this.workflowId = workflowId;
    }

    /**
     * Replaces the active agent set and merges pending tasks.
     */
    public synchronized void refresh(Set<String> agents, Map<String, String> tasks, Instant now) {
        activeAgents.clear();
        activeAgents.addAll(agents);
        pendingTasks.putAll(tasks);
        lastCoordination = now;
    }

    public synchronized void applyPlan(CoordinationPlan plan) {
        this.coordinationId = plan.coordinationId();
        this.steps = plan.steps();
        this.lastCoordination = plan.createdAt();
    }

    public synchronized void archive(Instant now) {
        archived = true;
        lastCoordination = now;
    }

    public String getWorkflowId() {
        return workflowId;
    }

    public synchronized Set<String> getActiveAgents() {
        return Set.copyOf(activeAgents);
    }

    public synchronized Map<String, String> getPendingTasks() {
        return Map.copyOf(pendingTasks);
    }

    public synchronized List<CoordinationStep> getSteps() {
        return steps;
    }

    public synchronized String getCoordinationId() {
        return coordinationId;
    }

    public synchronized Instant getLastCoordination() {
        return lastCoordination;
    }

    public synchronized boolean isArchived() {
        return archived;
    }
}
