package com.dealflow.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted by the supervisor while it decides and tracks.
 *
 * @param eventType  one of the type constants below
 * @param workflowId the workflow this event belongs to (nullable for supervisor-wide events)
 * @param agent      the agent the event concerns (nullable)
 * @param payload    arbitrary key-value data associated with the event
 * @param timestamp  when the event occurred
 */
public record SupervisorEvent(
    String eventType,
    String workflowId,
    String agent,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static final String DECISION_MADE = "decision.made";
    public static final String ESCALATION_RAISED = "escalation.raised";
    public static final String ESCALATION_ANSWERED = "escalation.answered";
    public static final String CONFLICT_RESOLVED = "conflict.resolved";
    public static final String WORKFLOW_ENDED = "workflow.ended";
}
