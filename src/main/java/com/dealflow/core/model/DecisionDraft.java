package com.dealflow.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A candidate decision produced by a decision rule, before it is validated and
 * stamped into a {@link SupervisorDecision}.
 */
public record DecisionDraft(
    DecisionType decisionType,
    String targetAgent,
    String action,
    String reasoning,
    Priority priority,
    double confidence,
    Map<String, Object> parameters
) {

    public DecisionDraft {
        parameters = parameters != null ? Collections.unmodifiableMap(new LinkedHashMap<>(parameters)) : Map.of();
    }

    public static DecisionDraft route(String targetAgent, String action, String reasoning, double confidence) {
        return new DecisionDraft(DecisionType.ROUTE_TO_AGENT, targetAgent, action, reasoning,
                Priority.MEDIUM, confidence, Map.of());
    }

    public static DecisionDraft escalate(String reasoning, Priority priority, double confidence,
                                         Map<String, Object> parameters) {
        return new DecisionDraft(DecisionType.ESCALATE_TO_HUMAN, null, "human_escalation", reasoning,
                priority, confidence, parameters);
    }

    public static DecisionDraft endWorkflow(String reasoning, double confidence) {
        return new DecisionDraft(DecisionType.END_WORKFLOW, null, "end", reasoning,
                Priority.MEDIUM, confidence, Map.of());
    }

    public static DecisionDraft continueWorkflow(String reasoning) {
        return new DecisionDraft(DecisionType.CONTINUE_WORKFLOW, null, "continue", reasoning,
                Priority.LOW, 1.0, Map.of());
    }
}
