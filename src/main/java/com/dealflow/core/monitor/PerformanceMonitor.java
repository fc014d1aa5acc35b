package com.dealflow.core.monitor;

import com.dealflow.core.config.SupervisorProperties;
import com.dealflow.core.model.*;
import com.dealflow.core.state.PipelineState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Assesses system health, finds stalled and ready work, and keeps the latest
 * {@link PerformanceMonitoring} view.
 * <p>
 * Health only ever gets worse within one assessment: degraded when agents report
 * error-priority messages, critical when the workflow is in error. The latest error
 * message texts are listed among the issues.
 */
@Component
public class PerformanceMonitor {

    private static final Logger log = LoggerFactory.getLogger(PerformanceMonitor.class);

    /** Most recent error message texts carried into health issues. */
    static final int REPORTED_ERROR_MESSAGES = 5;

    private final SupervisorProperties properties;
    private final RoutingPatternDetector patternDetector;
    private final Clock clock;

    private final AtomicReference<PerformanceMonitoring> current =
            new AtomicReference<>(PerformanceMonitoring.initial());

    public PerformanceMonitor(SupervisorProperties properties, RoutingPatternDetector patternDetector, Clock clock) {
        this.properties = properties;
        this.patternDetector = patternDetector;
        this.clock = clock;
    }

    public SystemHealth assessHealth(PipelineState state) {
        HealthLevel level = HealthLevel.HEALTHY;
        List<String> issues = new ArrayList<>();

        List<AgentMessage> errors = errorMessages(state);
        if (!errors.isEmpty()) {
            level = level.worse(HealthLevel.DEGRADED);
            issues.add(errors.size() + " error message(s) reported by agents");
            errors.subList(Math.max(0, errors.size() - REPORTED_ERROR_MESSAGES), errors.size()).stream()
                    .map(m -> m.agentType() + ": " + m.message())
                    .forEach(issues::add);
        }
        if (state.workflowStatus() == WorkflowStatus.ERROR) {
            level = level.worse(HealthLevel.CRITICAL);
            issues.add("Workflow " + state.workflowId() + " is in error state");
        }
        return new SystemHealth(level, issues);
    }

    public List<String> identifyBottlenecks(PipelineState state) {
        Instant cutoff = clock.instant().minus(properties.getStallThreshold());
        List<String> inFlight = properties.getInFlightStatuses().stream()
                .map(s -> s.toLowerCase(Locale.ROOT))
                .toList();
        return state.currentDeals().stream()
                .filter(d -> d.status() != null && inFlight.contains(d.status().toLowerCase(Locale.ROOT)))
                .filter(d -> d.lastUpdated() != null && d.lastUpdated().isBefore(cutoff))
                .map(d -> "Analysis bottleneck: deal " + d.id() + " stalled")
                .toList();
    }

    public List<String> identifyOpportunities(PipelineState state) {
        return state.currentDeals().stream()
                .filter(Deal::readyForOutreach)
                .map(d -> "Outreach opportunity: deal " + d.id() + " ready for contact")
                .toList();
    }

    /**
     * Suggestions derived from the most recent decisions.
     */
    public List<Recommendation> generateRecommendations(List<SupervisorDecision> recentDecisions) {
        List<Recommendation> recommendations = new ArrayList<>();
        int window = properties.getRecommendationWindow();
        patternDetector.dominantAgent(recentDecisions, window, properties.getRecommendationThreshold())
                .ifPresent(e -> recommendations.add(new Recommendation("optimization",
                        "Agent " + e.getKey() + " selected in " + e.getValue() + " of the last "
                                + Math.min(window, recentDecisions.size())
                                + " decisions; consider increasing " + e.getKey()
                                + " capacity or reviewing decision thresholds",
                        "medium")));
        if (patternDetector.isOscillating(recentDecisions)) {
            List<String> pair = patternDetector.oscillatingPair(recentDecisions);
            recommendations.add(new Recommendation("routing_oscillation",
                    "Routing alternates between " + pair.get(0) + " and " + pair.get(1)
                            + "; review rule thresholds",
                    "medium"));
        }
        return recommendations;
    }

    /**
     * Refreshes the monitoring view from the state and recent decisions.
     */
    public PerformanceMonitoring updateMonitoringData(PipelineState state, List<SupervisorDecision> recentDecisions) {
        SystemHealth health = assessHealth(state);
        List<String> bottlenecks = identifyBottlenecks(state);
        List<String> opportunities = identifyOpportunities(state);
        List<Recommendation> recommendations = generateRecommendations(recentDecisions);
        PerformanceMonitoring.WorkflowStats stats = new PerformanceMonitoring.WorkflowStats(
                state.workflowStatus(), state.activeAgents().size(), errorMessages(state).size());

        PerformanceMonitoring updated = current.updateAndGet(previous -> {
            Map<String, PerformanceMonitoring.WorkflowStats> perWorkflow = new HashMap<>(previous.workflowStats());
            if (!state.workflowId().isBlank()) {
                perWorkflow.put(state.workflowId(), stats);
            }
            return new PerformanceMonitoring(health, bottlenecks, opportunities, recommendations,
                    perWorkflow, clock.instant());
        });

        if (health.status() != HealthLevel.HEALTHY) {
            log.warn("System health {}: {}", health.status().value(), health.issues());
        }
        return updated;
    }

    public PerformanceMonitoring current() {
        return current.get();
    }

    public void reset() {
        current.set(PerformanceMonitoring.initial());
    }

    private List<AgentMessage> errorMessages(PipelineState state) {
        int threshold = properties.getErrorMessagePriority();
        return state.agentMessages().stream()
                .filter(m -> m.priority() >= threshold)
                .toList();
    }
}
