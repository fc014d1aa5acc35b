package com.dealflow.core.coordination;

import com.dealflow.core.model.CoordinationMode;
import com.dealflow.core.model.CoordinationStep;
import com.dealflow.core.state.PipelineState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class CoordinationManagerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private CoordinationManager manager;

    @BeforeEach
    void setUp() {
        manager = new CoordinationManager(Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("sequential plan chains each agent on its predecessor")
    void sequentialPlan() {
        var plan = manager.createCoordinationPlan(List.of("scout", "analyst", "negotiator"),
                CoordinationMode.SEQUENTIAL, PipelineState.initial("wf-1"));

        assertEquals(3, plan.steps().size());
        assertNull(plan.steps().get(0).dependsOn());
        assertEquals("scout", plan.steps().get(1).dependsOn());
        assertEquals("analyst", plan.steps().get(2).dependsOn());
        assertEquals(List.of(1, 2, 3), plan.steps().stream().map(CoordinationStep::step).toList());
        assertEquals("wf-1", plan.workflowId());
    }

    @Test
    @DisplayName("parallel plan has no dependencies")
    void parallelPlan() {
        var plan = manager.createCoordinationPlan(List.of("scout", "analyst"),
                CoordinationMode.PARALLEL, PipelineState.initial("wf-1"));

        assertTrue(plan.steps().stream().allMatch(s -> s.dependsOn() == null));
    }

    @Test
    @DisplayName("each plan gets a fresh id and does not touch coordinations")
    void plansArePure() {
        var state = PipelineState.initial("wf-1");
        var a = manager.createCoordinationPlan(List.of("scout"), CoordinationMode.SEQUENTIAL, state);
        var b = manager.createCoordinationPlan(List.of("scout"), CoordinationMode.SEQUENTIAL, state);

        assertNotEquals(a.coordinationId(), b.coordinationId());
        assertTrue(manager.coordination("wf-1").isEmpty());
    }

    @Test
    @DisplayName("updateCoordination upserts and is idempotent")
    void updateIdempotent() {
        var state = PipelineState.initial("wf-1").apply(Map.of(
                "activeAgents", List.of("scout", "analyst"),
                "pendingTasks", Map.of("scout", "scout")));

        manager.updateCoordination(state);
        manager.updateCoordination(state);

        assertEquals(1, manager.all().size());
        var coordination = manager.coordination("wf-1").orElseThrow();
        assertEquals(Set.of("scout", "analyst"), coordination.getActiveAgents());
        assertEquals(Map.of("scout", "scout"), coordination.getPendingTasks());
        assertEquals(NOW, coordination.getLastCoordination());
    }

    @Test
    @DisplayName("active agents follow the state while pending tasks merge")
    void activeAgentsReplaced() {
        manager.updateCoordination(PipelineState.initial("wf-1").apply(Map.of(
                "activeAgents", List.of("scout", "analyst"),
                "pendingTasks", Map.of("scout", "scout"))));
        manager.updateCoordination(PipelineState.initial("wf-1").apply(Map.of(
                "activeAgents", List.of("analyst"),
                "pendingTasks", Map.of("analyst", "analyze"))));

        var coordination = manager.coordination("wf-1").orElseThrow();
        assertEquals(Set.of("analyst"), coordination.getActiveAgents());
        assertEquals(Map.of("scout", "scout", "analyst", "analyze"), coordination.getPendingTasks());
    }

    @Test
    @DisplayName("archived coordinations are kept but no longer updated")
    void archivedNotUpdated() {
        manager.updateCoordination(PipelineState.initial("wf-1").apply(Map.of("activeAgents", List.of("scout"))));
        manager.archive("wf-1");
        manager.updateCoordination(PipelineState.initial("wf-1").apply(Map.of("activeAgents", List.of("analyst"))));

        var coordination = manager.coordination("wf-1").orElseThrow();
        assertTrue(coordination.isArchived());
        assertEquals(Set.of("scout"), coordination.getActiveAgents());
    }

    @Test
    @DisplayName("applyPlan records steps on the workflow")
    void applyPlan() {
        var plan = manager.createCoordinationPlan(List.of("analyst", "negotiator"),
                CoordinationMode.SEQUENTIAL, PipelineState.initial("wf-1"));
        manager.applyPlan("wf-1", plan);

        var coordination = manager.coordination("wf-1").orElseThrow();
        assertEquals(plan.coordinationId(), coordination.getCoordinationId());
        assertEquals(2, coordination.getSteps().size());
    }

    @Test
    @DisplayName("reset clears all coordinations")
    void reset() {
        manager.updateCoordination(PipelineState.initial("wf-1"));
        manager.reset();
        assertTrue(manager.all().isEmpty());
    }
}
