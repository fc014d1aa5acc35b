package com.dealflow.core.metrics;

import com.dealflow.core.model.DecisionDraft;
import com.dealflow.core.model.HealthLevel;
import com.dealflow.core.model.SupervisorDecision;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class SupervisorMetricsTest {

    private SimpleMeterRegistry registry;
    private SupervisorMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new SupervisorMetrics(registry);
    }

    @Test
    @DisplayName("recordDecision tags type and target")
    void recordDecision() {
        metrics.recordDecision(SupervisorDecision.fromDraft(
                DecisionDraft.route("scout", "scout", "more deals", 0.9), "wf-1", Instant.now()));
        metrics.recordDecision(SupervisorDecision.fromDraft(
                DecisionDraft.endWorkflow("done", 0.85), "wf-1", Instant.now()));

        var routed = registry.find("dealflow.decisions.total")
                .tag("type", "ROUTE_TO_AGENT").tag("target", "scout").counter();
        var ended = registry.find("dealflow.decisions.total")
                .tag("type", "END_WORKFLOW").tag("target", "none").counter();

        assertNotNull(routed);
        assertNotNull(ended);
        assertEquals(1.0, routed.count());
        assertEquals(1.0, ended.count());
    }

    @Test
    @DisplayName("recordConflict separates resolved and unresolved")
    void recordConflict() {
        metrics.recordConflict("resource_conflict", true);
        metrics.recordConflict("resource_conflict", true);
        metrics.recordConflict("deadlock", false);

        var resolved = registry.find("dealflow.conflicts.total")
                .tag("type", "resource_conflict").tag("resolved", "true").counter();
        var unresolved = registry.find("dealflow.conflicts.total")
                .tag("type", "deadlock").tag("resolved", "false").counter();

        assertEquals(2.0, resolved.count());
        assertEquals(1.0, unresolved.count());
    }

    @Test
    @DisplayName("incrementEscalations counts by reason")
    void escalations() {
        metrics.incrementEscalations("system_health");
        var counter = registry.find("dealflow.escalations.total").tag("reason", "system_health").counter();
        assertNotNull(counter);
        assertEquals(1.0, counter.count());
    }

    @Test
    @DisplayName("recordHealth uses lowercase level")
    void health() {
        metrics.recordHealth(HealthLevel.DEGRADED);
        assertNotNull(registry.find("dealflow.health.assessments").tag("status", "degraded").counter());
    }

    @Test
    @DisplayName("recordTickDuration creates a timer")
    void tickDuration() {
        metrics.recordTickDuration(25);
        var timer = registry.find("dealflow.tick.duration").timer();
        assertNotNull(timer);
        assertEquals(1, timer.count());
    }
}
