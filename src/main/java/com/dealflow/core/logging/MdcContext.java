package com.dealflow.core.logging;

import org.slf4j.MDC;

/**
 * Supervisor MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setWorkflow(String workflowId) {
        MDC.put("workflowId", workflowId);
    }

    public static void setDecision(String workflowId, String decisionId, String agentType) {
        MDC.put("workflowId", workflowId);
        MDC.put("decisionId", decisionId);
        if (agentType != null) {
            MDC.put("agentType", agentType);
        } else {
            MDC.remove("agentType");
        }
    }

    public static void clear() {
        MDC.remove("workflowId");
        MDC.remove("decisionId");
        MDC.remove("agentType");
    }
}
