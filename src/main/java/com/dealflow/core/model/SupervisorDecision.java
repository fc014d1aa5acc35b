package com.dealflow.core.model;

import com.dealflow.core.error.InvalidDecisionException;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * A decision taken by the supervisor.
 * <p>
 * Everything except the execution marker is fixed at construction. A decision is
 * marked executed once the supervisor has applied it to the workflow state, or once
 * an external executor confirms it dispatched the routed task.
 */
public class SupervisorDecision implements Serializable {

    private final String id;
    private final String workflowId;
    private final DecisionType decisionType;
    private final String targetAgent;
    private final String action;
    private final String reasoning;
    private final Priority priority;
    private final double confidence;
    private final Map<String, Object> parameters;
    private final Instant createdAt;

    private volatile boolean executed;
    private volatile Instant executedAt;

    private SupervisorDecision(String id, String workflowId, DecisionDraft draft, Instant createdAt) {
        this.id = id;
        this.workflowId = workflowId;
        this.decisionType = draft.decisionType();
        this.targetAgent = draft.targetAgent();
        this.action = draft.action();
        this.reasoning = draft.reasoning();
        this.priority = draft.priority();
        this.confidence = draft.confidence();
        this.parameters = draft.parameters();
        this.createdAt = createdAt;
    }

    /**
     * Validates a draft and stamps it with an id and creation time.
     *
     * @throws InvalidDecisionException if the confidence is outside [0, 1] or a field
     *                                  required by the decision type is missing
     */
    public static SupervisorDecision fromDraft(DecisionDraft draft, String workflowId, Instant createdAt) {
        validate(draft);
        return new SupervisorDecision(UUID.randomUUID().toString(), workflowId, draft, createdAt);
    }

    static void validate(DecisionDraft draft) {
        if (draft.decisionType() == null) {
            throw new InvalidDecisionException("Decision type is required");
        }
        double c = draft.confidence();
        if (Double.isNaN(c) || c < 0.0 || c > 1.0) {
            throw new InvalidDecisionException("Confidence must be within [0, 1], got " + c);
        }
        if (draft.priority() == null) {
            throw new InvalidDecisionException("Priority is required for " + draft.decisionType());
        }
        if (isBlank(draft.action()) || isBlank(draft.reasoning())) {
            throw new InvalidDecisionException("Action and reasoning are required for " + draft.decisionType());
        }
        if (draft.decisionType() == DecisionType.ROUTE_TO_AGENT && isBlank(draft.targetAgent())) {
            throw new InvalidDecisionException("ROUTE_TO_AGENT requires a target agent");
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    /**
     * Marks the decision executed. Returns false if it already was.
     */
    public synchronized boolean markExecuted(Instant when) {
        if (executed) {
            return false;
        }
        executed = true;
        executedAt = when;
        return true;
    }

    public String getId() {
        return id;
    }

    public String getWorkflowId() {
        return workflowId;
    }

    public DecisionType getDecisionType() {
        return decisionType;
    }

    public String getTargetAgent() {
        return targetAgent;
    }

    public String getAction() {
        return action;
    }

    public String getReasoning() {
        return reasoning;
    }

    public Priority getPriority() {
        return priority;
    }

    public double getConfidence() {
        return confidence;
    }

    public Map<String, Object> getParameters() {
        return parameters;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public boolean isExecuted() {
        return executed;
    }

    public Instant getExecutedAt() {
        return executedAt;
    }

    @Override
    public String toString() {
        return "SupervisorDecision{" + decisionType
                + (targetAgent != null ? " -> " + targetAgent : "")
                + ", confidence=" + confidence
                + ", priority=" + priority
                + ", id=" + id + "}";
    }
}
