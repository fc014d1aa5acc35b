package com.dealflow.core.state;

import com.dealflow.core.model.*;
import org.bsc.langgraph4j.state.AgentState;
import org.bsc.langgraph4j.state.Channel;
import org.bsc.langgraph4j.state.Channels;
import org.bsc.langgraph4j.state.Reducer;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Shared workflow state for the deal pipeline.
 * <p>
 * Extends LangGraph4j's {@link AgentState} with typed accessors. Worker agents and
 * the supervisor never mutate an instance; they produce partial updates that are
 * merged through {@link #SCHEMA}. Agent messages and conflict resolutions use
 * appender channels, every other key is overwritten on update.
 */
public class PipelineState extends AgentState {

    public static final Map<String, Channel<?>> SCHEMA = Map.ofEntries(
        // ── Workflow ─────────────────────────────────────────────────
        Map.entry("workflowId",            Channels.base(() -> "")),
        Map.entry("workflowStatus",        Channels.base(() -> WorkflowStatus.IDLE.name())),
        Map.entry("currentStep",           Channels.base(() -> "supervisor")),
        Map.entry("nextAction",            Channels.base(() -> "")),
        Map.entry("lastUpdated",           Channels.base((Reducer<Instant>) null)),

        // ── Pipeline ─────────────────────────────────────────────────
        Map.entry("currentDeals",          Channels.base((Supplier<List<Object>>) List::of)),
        Map.entry("activeNegotiations",    Channels.base((Supplier<List<Object>>) List::of)),
        Map.entry("activeAgents",          Channels.base((Supplier<List<String>>) List::of)),
        Map.entry("pendingTasks",          Channels.base((Supplier<Map<String, String>>) Map::of)),
        Map.entry("resourceClaims",        Channels.base((Supplier<Map<String, List<String>>>) Map::of)),

        // ── Pass-through context ─────────────────────────────────────
        Map.entry("marketConditions",      Channels.base((Supplier<Map<String, Object>>) Map::of)),
        Map.entry("investmentCriteria",    Channels.base((Supplier<Map<String, Object>>) Map::of)),

        // ── Human oversight ──────────────────────────────────────────
        Map.entry("humanApprovalRequired", Channels.base(() -> false)),
        Map.entry("escalationReason",      Channels.base(() -> "")),

        // ── Supervisor tick outputs ──────────────────────────────────
        Map.entry("situationAnalysis",     Channels.base((Reducer<SituationAnalysis>) null)),
        Map.entry("decision",              Channels.base((Reducer<SupervisorDecision>) null)),

        // ── Appender channels (list accumulation) ────────────────────
        Map.entry("agentMessages",         Channels.appender(ArrayList::new)),
        Map.entry("conflictResolutions",   Channels.appender(ArrayList::new))
    );

    public PipelineState(Map<String, Object> initData) {
        super(initData);
    }

    /**
     * Fresh state for a workflow, with every channel at its default.
     */
    public static PipelineState initial(String workflowId) {
        return new PipelineState(AgentState.updateState(
                new HashMap<>(), Map.of("workflowId", workflowId), SCHEMA));
    }

    /**
     * Returns a new state with the partial update merged through the channel schema.
     */
    public PipelineState apply(Map<String, Object> partialState) {
        return new PipelineState(AgentState.updateState(this, partialState, SCHEMA));
    }

    // ── Workflow accessors ───────────────────────────────────────────

    public String workflowId() {
        return this.<String>value("workflowId").orElse("");
    }

    public WorkflowStatus workflowStatus() {
        Object raw = this.<Object>value("workflowStatus").orElse(WorkflowStatus.IDLE.name());
        if (raw instanceof WorkflowStatus ws) return ws;
        return WorkflowStatus.valueOf(String.valueOf(raw).toUpperCase());
    }

    public String currentStep() {
        return this.<String>value("currentStep").orElse("supervisor");
    }

    public Optional<String> nextAction() {
        return this.<String>value("nextAction").filter(s -> !s.isBlank());
    }

    public Optional<Instant> lastUpdated() {
        return value("lastUpdated");
    }

    // ── Pipeline accessors ───────────────────────────────────────────

    public List<Deal> currentDeals() {
        Optional<Object> raw = value("currentDeals");
        return raw.map(obj -> (List<?>) obj)
                .orElse(List.of())
                .stream()
                .map(item -> item instanceof Deal d ? d : Deal.fromMap((Map<?, ?>) item))
                .toList();
    }

    public List<Negotiation> activeNegotiations() {
        Optional<Object> raw = value("activeNegotiations");
        return raw.map(obj -> (List<?>) obj)
                .orElse(List.of())
                .stream()
                .map(item -> item instanceof Negotiation n ? n : Negotiation.fromMap((Map<?, ?>) item))
                .toList();
    }

    public Set<String> activeAgents() {
        Optional<Object> raw = value("activeAgents");
        var agents = new LinkedHashSet<String>();
        raw.ifPresent(obj -> ((Collection<?>) obj).forEach(a -> agents.add(String.valueOf(a))));
        return agents;
    }

    public Map<String, String> pendingTasks() {
        Optional<Object> raw = value("pendingTasks");
        var tasks = new LinkedHashMap<String, String>();
        raw.ifPresent(obj -> ((Map<?, ?>) obj).forEach((k, v) -> tasks.put(String.valueOf(k), String.valueOf(v))));
        return tasks;
    }

    /**
     * Resources each agent currently claims, keyed by agent.
     */
    public Map<String, List<String>> resourceClaims() {
        Optional<Object> raw = value("resourceClaims");
        var claims = new LinkedHashMap<String, List<String>>();
        raw.ifPresent(obj -> ((Map<?, ?>) obj).forEach((agent, resources) ->
                claims.put(String.valueOf(agent),
                        ((Collection<?>) resources).stream().map(String::valueOf).toList())));
        return claims;
    }

    public Map<String, Object> marketConditions() {
        return this.<Map<String, Object>>value("marketConditions").orElse(Map.of());
    }

    public Map<String, Object> investmentCriteria() {
        return this.<Map<String, Object>>value("investmentCriteria").orElse(Map.of());
    }

    // ── Human oversight accessors ────────────────────────────────────

    public boolean humanApprovalRequired() {
        return this.<Boolean>value("humanApprovalRequired").orElse(false);
    }

    public String escalationReason() {
        return this.<String>value("escalationReason").orElse("");
    }

    // ── Tick output accessors ────────────────────────────────────────

    public Optional<SituationAnalysis> situationAnalysis() {
        return value("situationAnalysis");
    }

    public Optional<SupervisorDecision> decision() {
        return value("decision");
    }

    // ── Appender accessors ───────────────────────────────────────────

    public List<AgentMessage> agentMessages() {
        Optional<Object> raw = value("agentMessages");
        return raw.map(obj -> (List<?>) obj)
                .orElse(List.of())
                .stream()
                .map(item -> item instanceof AgentMessage m ? m : AgentMessage.fromMap((Map<?, ?>) item))
                .toList();
    }

    public List<ConflictResolution> conflictResolutions() {
        return this.<List<ConflictResolution>>value("conflictResolutions").orElse(List.of());
    }
}
