package com.dealflow.core.monitor;

import com.dealflow.core.model.DecisionDraft;
import com.dealflow.core.model.SupervisorDecision;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RoutingPatternDetectorTest {

    private RoutingPatternDetector detector;

    @BeforeEach
    void setUp() {
        detector = new RoutingPatternDetector();
    }

    private static SupervisorDecision routeTo(String agent) {
        return SupervisorDecision.fromDraft(DecisionDraft.route(agent, "go", "because", 0.9),
                "wf-1", Instant.parse("2026-03-01T12:00:00Z"));
    }

    private static SupervisorDecision end() {
        return SupervisorDecision.fromDraft(DecisionDraft.endWorkflow("done", 0.85),
                "wf-1", Instant.parse("2026-03-01T12:00:00Z"));
    }

    @Test
    @DisplayName("No oscillation with fewer than four routed decisions")
    void tooFewDecisions() {
        assertFalse(detector.isOscillating(List.of(routeTo("scout"), routeTo("analyst"), routeTo("scout"))));
    }

    @Test
    @DisplayName("Oscillation detected with A-B-A-B pattern")
    void alternating() {
        assertTrue(detector.isOscillating(List.of(
                routeTo("scout"), routeTo("analyst"), routeTo("scout"), routeTo("analyst"))));
    }

    @Test
    @DisplayName("No oscillation with consistent routing A-A-A-A")
    void consistent() {
        assertFalse(detector.isOscillating(List.of(
                routeTo("scout"), routeTo("scout"), routeTo("scout"), routeTo("scout"))));
    }

    @Test
    @DisplayName("Decisions without a target are skipped")
    void untargetedSkipped() {
        assertTrue(detector.isOscillating(List.of(
                routeTo("scout"), end(), routeTo("analyst"), routeTo("scout"), routeTo("analyst"))));
    }

    @Test
    @DisplayName("Dominant agent only counts the window")
    void dominantWithinWindow() {
        var recent = List.of(routeTo("scout"), routeTo("scout"), routeTo("analyst"),
                routeTo("analyst"), routeTo("analyst"));

        assertTrue(detector.dominantAgent(recent, 3, 3).isPresent());
        assertEquals("analyst", detector.dominantAgent(recent, 3, 3).get().getKey());
        assertTrue(detector.dominantAgent(recent, 5, 4).isEmpty());
    }
}
