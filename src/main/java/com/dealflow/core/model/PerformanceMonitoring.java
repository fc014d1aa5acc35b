package com.dealflow.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Performance view of the supervised system, replaced wholesale on every refresh.
 *
 * @param systemHealth          latest health assessment
 * @param bottlenecks           stalled-work descriptions
 * @param opportunities         ready-work descriptions
 * @param recommendations       suggestions derived from decision history
 * @param workflowStats         per-workflow counters keyed by workflow id
 * @param lastMonitoringUpdate  when this view was produced (null before the first refresh)
 */
public record PerformanceMonitoring(
    SystemHealth systemHealth,
    List<String> bottlenecks,
    List<String> opportunities,
    List<Recommendation> recommendations,
    Map<String, WorkflowStats> workflowStats,
    Instant lastMonitoringUpdate
) implements Serializable {

    public PerformanceMonitoring {
        bottlenecks = List.copyOf(bottlenecks);
        opportunities = List.copyOf(opportunities);
        recommendations = List.copyOf(recommendations);
        workflowStats = Map.copyOf(workflowStats);
    }

    public static PerformanceMonitoring initial() {
        return new PerformanceMonitoring(SystemHealth.healthy(), List.of(), List.of(), List.of(), Map.of(), null);
    }

    /**
     * Counters the monitor keeps for each workflow it has seen.
     */
    public record WorkflowStats(
        WorkflowStatus workflowStatus,
        int activeAgents,
        int errorCount
    ) implements Serializable {}
}
