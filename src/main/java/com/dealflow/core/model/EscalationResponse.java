package com.dealflow.core.model;

import java.io.Serializable;

/**
 * Supervisor's answer to a human operator's response on a pending escalation.
 */
public record EscalationResponse(
    String status,
    String action,
    String message
) implements Serializable {

    public static EscalationResponse approved() {
        return new EscalationResponse("approved", "continue", null);
    }

    public static EscalationResponse rejected() {
        return new EscalationResponse("rejected", "abort", null);
    }

    public static EscalationResponse clarificationNeeded() {
        return new EscalationResponse("clarification_needed", null, "Please respond with approve/reject");
    }
}
