package com.dealflow.core.state;

import com.dealflow.core.model.AgentMessage;
import com.dealflow.core.model.Deal;
import com.dealflow.core.model.WorkflowStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PipelineStateTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    @Test
    @DisplayName("initial state carries defaults")
    void initialDefaults() {
        var state = PipelineState.initial("wf-1");

        assertEquals("wf-1", state.workflowId());
        assertEquals(WorkflowStatus.IDLE, state.workflowStatus());
        assertEquals("supervisor", state.currentStep());
        assertTrue(state.nextAction().isEmpty());
        assertTrue(state.currentDeals().isEmpty());
        assertTrue(state.agentMessages().isEmpty());
        assertFalse(state.humanApprovalRequired());
        assertTrue(state.decision().isEmpty());
    }

    @Test
    @DisplayName("agent messages accumulate through the appender channel")
    void agentMessagesAccumulate() {
        var first = AgentMessage.of("scout", "found deals", 2, Map.of(), NOW);
        var second = AgentMessage.of("analyst", "analysis failed", 4, Map.of(), NOW);

        var state = PipelineState.initial("wf-1")
                .apply(Map.of("agentMessages", List.of(first)))
                .apply(Map.of("agentMessages", List.of(second)));

        assertEquals(2, state.agentMessages().size());
        assertEquals("scout", state.agentMessages().get(0).agentType());
        assertEquals("analyst", state.agentMessages().get(1).agentType());
    }

    @Test
    @DisplayName("plain channels are overwritten")
    void plainChannelsOverwritten() {
        var state = PipelineState.initial("wf-1")
                .apply(Map.of("nextAction", "scout"))
                .apply(Map.of("nextAction", "analyst"));

        assertEquals("analyst", state.nextAction().orElseThrow());
    }

    @Test
    @DisplayName("map-shaped deals and messages are converted")
    void mapShapedItemsConverted() {
        var state = PipelineState.initial("wf-1").apply(Map.of(
                "currentDeals", List.of(Map.of("id", "D-1", "status", "discovered")),
                "agentMessages", List.of(Map.of("agentType", "scout", "message", "hello", "priority", 2))));

        Deal deal = state.currentDeals().get(0);
        assertEquals("D-1", deal.id());
        assertFalse(deal.analyzed());
        assertEquals("hello", state.agentMessages().get(0).message());
    }

    @Test
    @DisplayName("workflow status accepts lowercase strings")
    void workflowStatusFromString() {
        var state = PipelineState.initial("wf-1").apply(Map.of("workflowStatus", "error"));
        assertEquals(WorkflowStatus.ERROR, state.workflowStatus());
    }

    @Test
    @DisplayName("resource claims and pending tasks are returned as mutable copies")
    void collectionCopies() {
        var state = PipelineState.initial("wf-1").apply(Map.of(
                "resourceClaims", Map.of("analyst", List.of("deal-1")),
                "pendingTasks", Map.of("scout", "scout")));

        var tasks = state.pendingTasks();
        tasks.put("analyst", "analyze");

        assertEquals(List.of("deal-1"), state.resourceClaims().get("analyst"));
        assertEquals(1, state.pendingTasks().size());
    }

    @Test
    @DisplayName("market conditions and investment criteria pass through untouched")
    void businessContextPassThrough() {
        var initial = PipelineState.initial("wf-1");
        assertTrue(initial.marketConditions().isEmpty());
        assertTrue(initial.investmentCriteria().isEmpty());

        var state = initial.apply(Map.of(
                "marketConditions", Map.of("interest_rate", 6.5, "trend", "cooling"),
                "investmentCriteria", Map.of("max_price", 450000, "min_cap_rate", 0.07)));

        assertEquals("cooling", state.marketConditions().get("trend"));
        assertEquals(6.5, state.marketConditions().get("interest_rate"));
        assertEquals(450000, state.investmentCriteria().get("max_price"));
        assertEquals(0.07, state.investmentCriteria().get("min_cap_rate"));
    }
}
