package com.dealflow.core.model;

/**
 * Kinds of decisions the supervisor can make on a tick.
 */
public enum DecisionType {
    ROUTE_TO_AGENT,
    ESCALATE_TO_HUMAN,
    END_WORKFLOW,
    CONTINUE_WORKFLOW,
    RESOLVE_CONFLICT
}
