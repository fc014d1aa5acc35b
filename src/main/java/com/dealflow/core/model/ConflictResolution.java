package com.dealflow.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * A detected inconsistency between agents and its arbitration outcome.
 * <p>
 * {@code resolved} moves from false to true at most once; the strategy and actions
 * recorded at that moment never change afterwards.
 */
public class ConflictResolution implements Serializable {

    public static final String RESOURCE_CONFLICT = "resource_conflict";
    public static final String DECISION_CONFLICT = "decision_conflict";

    private final String conflictId;
    private final List<String> conflictingAgents;
    private final String conflictType;
    private final String description;
    private final String resource;
    private final List<String> decisionIds;
    private final Instant detectedAt;

    private String resolutionStrategy;
    private boolean resolved;
    private List<String> actionsTaken = List.of();
    private Instant resolvedAt;

    public ConflictResolution(String conflictId, List<String> conflictingAgents, String conflictType,
                              String description, String resource, List<String> decisionIds,
                              Instant detectedAt) {
        if (conflictingAgents == null || conflictingAgents.size() < 2) {
            throw new IllegalArgumentException("A conflict involves at least two agents");
        }
        this.conflictId = conflictId != null ? conflictId : UUID.randomUUID().toString();
        this.conflictingAgents = List.copyOf(conflictingAgents);
        this.conflictType = conflictType;
        this.description = description != null ? description : "";
        this.resource = resource;
        this.decisionIds = decisionIds != null ? List.copyOf(decisionIds) : List.of();
        this.detectedAt = detectedAt;
        this.resolutionStrategy = "supervisor_mediation";
    }

    public static ConflictResolution resourceConflict(String resource, List<String> agents, Instant now) {
        return new ConflictResolution(null, agents, RESOURCE_CONFLICT,
                "Resource " + resource + " claimed by " + String.join(", ", agents),
                resource, List.of(), now);
    }

    public static ConflictResolution decisionConflict(List<String> agents, List<String> decisionIds,
                                                      String description, Instant now) {
        return new ConflictResolution(null, agents, DECISION_CONFLICT, description, null, decisionIds, now);
    }

    /**
     * Records the resolution. Returns false, leaving the record untouched, if it was
     * already resolved.
     */
    public synchronized boolean markResolved(String strategy, List<String> actions, Instant now) {
        if (resolved) {
            return false;
        }
        this.resolutionStrategy = strategy;
        this.actionsTaken = List.copyOf(actions);
        this.resolvedAt = now;
        this.resolved = true;
        return true;
    }

    public String getConflictId() {
        return conflictId;
    }

    public List<String> getConflictingAgents() {
        return conflictingAgents;
    }

    public String getConflictType() {
        return conflictType;
    }

    public String getDescription() {
        return description;
    }

    public String getResource() {
        return resource;
    }

    public List<String> getDecisionIds() {
        return decisionIds;
    }

    public Instant getDetectedAt() {
        return detectedAt;
    }

    public synchronized String getResolutionStrategy() {
        return resolutionStrategy;
    }

    public synchronized boolean isResolved() {
        return resolved;
    }

    public synchronized List<String> getActionsTaken() {
        return actionsTaken;
    }

    public synchronized Instant getResolvedAt() {
        return resolvedAt;
    }
}
