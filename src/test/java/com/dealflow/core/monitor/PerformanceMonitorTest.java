package com.dealflow.core.monitor;

import com.dealflow.core.config.SupervisorProperties;
import com.dealflow.core.model.*;
import com.dealflow.core.state.PipelineState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PerformanceMonitorTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private SupervisorProperties properties;
    private PerformanceMonitor monitor;

    @BeforeEach
    void setUp() {
        properties = new SupervisorProperties();
        monitor = new PerformanceMonitor(properties, new RoutingPatternDetector(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static AgentMessage message(int priority) {
        return AgentMessage.of("analyst", "msg", priority, Map.of(), NOW);
    }

    private static SupervisorDecision routeTo(String agent) {
        return SupervisorDecision.fromDraft(DecisionDraft.route(agent, "go", "because", 0.9), "wf-1", NOW);
    }

    @Nested
    @DisplayName("Health")
    class Health {

        @Test
        @DisplayName("quiet workflow is healthy")
        void healthy() {
            var health = monitor.assessHealth(PipelineState.initial("wf-1"));
            assertEquals(HealthLevel.HEALTHY, health.status());
            assertTrue(health.issues().isEmpty());
        }

        @Test
        @DisplayName("error-priority messages degrade health")
        void degraded() {
            var state = PipelineState.initial("wf-1")
                    .apply(Map.of("agentMessages", List.of(message(2), message(4))));

            var health = monitor.assessHealth(state);

            assertEquals(HealthLevel.DEGRADED, health.status());
            assertEquals(List.of("1 error message(s) reported by agents", "analyst: msg"), health.issues());
        }

        @Test
        @DisplayName("only the five latest error messages are listed")
        void latestErrorTexts() {
            var messages = new ArrayList<AgentMessage>();
            for (int i = 1; i <= 7; i++) {
                messages.add(AgentMessage.of("scout", "feed down #" + i, 4, Map.of(), NOW));
            }
            var state = PipelineState.initial("wf-1").apply(Map.of("agentMessages", messages));

            var issues = monitor.assessHealth(state).issues();

            assertEquals(6, issues.size());
            assertEquals("7 error message(s) reported by agents", issues.get(0));
            assertEquals("scout: feed down #3", issues.get(1));
            assertEquals("scout: feed down #7", issues.get(5));
        }

        @Test
        @DisplayName("workflow error is critical even with error messages present")
        void criticalWins() {
            var state = PipelineState.initial("wf-1").apply(Map.of(
                    "workflowStatus", WorkflowStatus.ERROR.name(),
                    "agentMessages", List.of(message(5))));

            var health = monitor.assessHealth(state);

            assertEquals(HealthLevel.CRITICAL, health.status());
            assertEquals(3, health.issues().size());
            assertTrue(health.issues().contains("analyst: msg"));
        }
    }

    @Test
    @DisplayName("deals stalled in analysis are bottlenecks")
    void bottlenecks() {
        var stalled = new Deal("D-1", "analyzing", false, false, NOW.minus(Duration.ofMinutes(10)), "analyst");
        var fresh = new Deal("D-2", "analyzing", false, false, NOW.minus(Duration.ofMinutes(1)), "analyst");
        var state = PipelineState.initial("wf-1").apply(Map.of("currentDeals", List.of(stalled, fresh)));

        assertEquals(List.of("Analysis bottleneck: deal D-1 stalled"), monitor.identifyBottlenecks(state));
    }

    @Test
    @DisplayName("agent timestamps in text and epoch form feed stall detection")
    void bottlenecksFromAgentTimestamps() {
        var state = PipelineState.initial("wf-1").apply(Map.of("currentDeals", List.of(
                Map.of("id", "D-1", "status", "analyzing", "last_updated", "2026-03-01 11:50:00.123456"),
                Map.of("id", "D-2", "status", "analyzing",
                        "last_updated", NOW.minus(Duration.ofMinutes(8)).toEpochMilli()),
                Map.of("id", "D-3", "status", "analyzing", "last_updated", "2026-03-01 11:58:00"),
                Map.of("id", "D-4", "status", "analyzing", "last_updated", "not a time"))));

        var bottlenecks = assertDoesNotThrow(() -> monitor.identifyBottlenecks(state));

        assertEquals(List.of(
                "Analysis bottleneck: deal D-1 stalled",
                "Analysis bottleneck: deal D-2 stalled"), bottlenecks);
    }

    @Test
    @DisplayName("approved deals without outreach are opportunities")
    void opportunities() {
        var ready = new Deal("D-1", "approved", true, false, NOW, null);
        var contacted = new Deal("D-2", "approved", true, true, NOW, null);
        var state = PipelineState.initial("wf-1").apply(Map.of("currentDeals", List.of(ready, contacted)));

        assertEquals(List.of("Outreach opportunity: deal D-1 ready for contact"), monitor.identifyOpportunities(state));
    }

    @Nested
    @DisplayName("Recommendations")
    class Recommendations {

        @Test
        @DisplayName("one agent dominating the window triggers a recommendation")
        void dominantAgent() {
            var recent = new ArrayList<SupervisorDecision>();
            for (int i = 0; i < 5; i++) {
                recent.add(routeTo("scout"));
            }
            recent.add(routeTo("analyst"));

            var recommendations = monitor.generateRecommendations(recent);

            assertEquals(1, recommendations.size());
            assertEquals("optimization", recommendations.get(0).type());
            assertTrue(recommendations.get(0).description().contains("scout"));
        }

        @Test
        @DisplayName("varied routing yields no recommendation")
        void varied() {
            var recent = List.of(routeTo("scout"), routeTo("scout"), routeTo("analyst"),
                    routeTo("negotiator"), routeTo("negotiator"), routeTo("scout"));
            assertTrue(monitor.generateRecommendations(recent).isEmpty());
        }

        @Test
        @DisplayName("alternating routing is reported as oscillation")
        void oscillation() {
            var recent = List.of(routeTo("scout"), routeTo("analyst"), routeTo("scout"), routeTo("analyst"));

            var recommendations = monitor.generateRecommendations(recent);

            assertEquals(1, recommendations.size());
            assertEquals("routing_oscillation", recommendations.get(0).type());
        }
    }

    @Test
    @DisplayName("updateMonitoringData refreshes the current view")
    void updateMonitoringData() {
        var state = PipelineState.initial("wf-1").apply(Map.of(
                "activeAgents", List.of("scout", "analyst"),
                "agentMessages", List.of(message(4))));

        var monitoring = monitor.updateMonitoringData(state, List.of());

        assertSame(monitoring, monitor.current());
        assertEquals(HealthLevel.DEGRADED, monitoring.systemHealth().status());
        assertEquals(NOW, monitoring.lastMonitoringUpdate());
        var stats = monitoring.workflowStats().get("wf-1");
        assertEquals(2, stats.activeAgents());
        assertEquals(1, stats.errorCount());
    }

    @Test
    @DisplayName("reset restores the initial view")
    void reset() {
        monitor.updateMonitoringData(PipelineState.initial("wf-1"), List.of());
        monitor.reset();
        assertNull(monitor.current().lastMonitoringUpdate());
    }
}
