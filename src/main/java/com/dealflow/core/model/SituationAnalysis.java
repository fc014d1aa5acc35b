package com.dealflow.core.model;

import java.io.Serializable;
import java.util.List;
import java.util.Map;

/**
 * Snapshot of the workflow situation that the decision rules are evaluated against.
 *
 * @param workflowStatus      status of the workflow at analysis time
 * @param activeAgents        agents currently running
 * @param currentDeals        number of deals in the pipeline
 * @param pendingNegotiations number of active negotiations
 * @param systemHealth        health assessment for this tick
 * @param resourceUtilization coarse utilization indicators
 * @param bottlenecks         stalled-work descriptions
 * @param opportunities       ready-work descriptions
 */
public record SituationAnalysis(
    WorkflowStatus workflowStatus,
    List<String> activeAgents,
    int currentDeals,
    int pendingNegotiations,
    SystemHealth systemHealth,
    Map<String, Object> resourceUtilization,
    List<String> bottlenecks,
    List<String> opportunities
) implements Serializable {

    public SituationAnalysis {
        activeAgents = activeAgents != null ? List.copyOf(activeAgents) : List.of();
        systemHealth = systemHealth != null ? systemHealth : SystemHealth.healthy();
        resourceUtilization = resourceUtilization != null ? Map.copyOf(resourceUtilization) : Map.of();
        bottlenecks = bottlenecks != null ? List.copyOf(bottlenecks) : List.of();
        opportunities = opportunities != null ? List.copyOf(opportunities) : List.of();
    }

    /**
     * Minimal analysis carrying only a deal count and a health assessment.
     */
    public static SituationAnalysis of(int currentDeals, SystemHealth health) {
        return new SituationAnalysis(WorkflowStatus.RUNNING, List.of(), currentDeals, 0,
                health, Map.of(), List.of(), List.of());
    }
}
