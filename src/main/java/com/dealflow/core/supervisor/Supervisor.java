package com.dealflow.core.supervisor;

import com.dealflow.core.agent.AgentTaskExecutor;
import com.dealflow.core.agent.AgentTaskResult;
import com.dealflow.core.config.SupervisorProperties;
import com.dealflow.core.conflict.ConflictResolver;
import com.dealflow.core.conflict.ResolutionOutcome;
import com.dealflow.core.coordination.CoordinationManager;
import com.dealflow.core.decision.DecisionEngine;
import com.dealflow.core.decision.DecisionHistory;
import com.dealflow.core.error.SupervisorException;
import com.dealflow.core.error.UnknownTaskException;
import com.dealflow.core.events.EventBus;
import com.dealflow.core.events.SupervisorEvent;
import com.dealflow.core.logging.MdcContext;
import com.dealflow.core.metrics.SupervisorMetrics;
import com.dealflow.core.model.*;
import com.dealflow.core.monitor.PerformanceMonitor;
import com.dealflow.core.state.PipelineState;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.GraphStateException;
import org.bsc.langgraph4j.RunnableConfig;
import org.bsc.langgraph4j.StateGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import static org.bsc.langgraph4j.StateGraph.END;
import static org.bsc.langgraph4j.StateGraph.START;
import static org.bsc.langgraph4j.action.AsyncEdgeAction.edge_async;
import static org.bsc.langgraph4j.action.AsyncNodeAction.node_async;

/**
 * Top-level orchestrator of the deal pipeline.
 * <p>
 * Each {@link #processState} call runs one supervisor tick as a compiled LangGraph4j graph:
 * <pre>
 *   START -> analyze_situation -> make_decision -> [routeAfterDecision]
 *            -> route_to_agent | escalate_to_human | end_workflow | continue_workflow
 *         -> update_coordination -> resolve_conflicts -> update_monitoring -> END
 * </pre>
 * Ticks of one workflow are serialized; different workflows tick in parallel.
 * Escalations wait in a queue until a human approves or rejects them, and while one is
 * pending for a workflow no agent is routed for it.
 */
@Service
public class Supervisor implements AgentTaskExecutor {

    private static final Logger log = LoggerFactory.getLogger(Supervisor.class);

    public static final String MAKE_ROUTING_DECISION = "make_routing_decision";
    public static final String COORDINATE_AGENTS = "coordinate_agents";
    public static final String RESOLVE_CONFLICT = "resolve_conflict";
    public static final String MONITOR_PERFORMANCE = "monitor_performance";
    public static final String ESCALATE_TO_HUMAN = "escalate_to_human";

    static final String AGENT_TYPE = "supervisor";
    static final int MESSAGE_PRIORITY = 3;

    private static final Set<String> APPROVALS = Set.of("approve", "approved", "yes", "continue", "proceed");
    private static final Set<String> REJECTIONS = Set.of("reject", "rejected", "no", "stop", "abort");

    /** Trigger of operator-requested escalations; these are never merged. */
    static final String MANUAL_TRIGGER = "manual";

    private final SupervisorProperties properties;
    private final DecisionEngine decisionEngine;
    private final DecisionHistory decisionHistory;
    private final CoordinationManager coordinationManager;
    private final ConflictResolver conflictResolver;
    private final PerformanceMonitor performanceMonitor;
    private final EventBus eventBus;
    private final SupervisorMetrics metrics;
    private final TaskResultMapper resultMapper;
    private final Clock clock;

    final WorkflowLocks workflowLocks = new WorkflowLocks();
    private final List<SupervisorDecision> pendingHumanDecisions = new ArrayList<>();
    private final CompiledGraph<PipelineState> tickGraph;

    public Supervisor(SupervisorProperties properties,
                      DecisionEngine decisionEngine,
                      DecisionHistory decisionHistory,
                      CoordinationManager coordinationManager,
                      ConflictResolver conflictResolver,
                      PerformanceMonitor performanceMonitor,
                      EventBus eventBus,
                      SupervisorMetrics metrics,
                      TaskResultMapper resultMapper,
                      Clock clock) throws GraphStateException {
        this.properties = properties;
        this.decisionEngine = decisionEngine;
        this.decisionHistory = decisionHistory;
        this.coordinationManager = coordinationManager;
        this.conflictResolver = conflictResolver;
        this.performanceMonitor = performanceMonitor;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.resultMapper = resultMapper;
        this.clock = clock;

        if (!decisionEngine.isInitialized()) {
            decisionEngine.initialize();
        }

        var graph = new StateGraph<>(PipelineState.SCHEMA, PipelineState::new)
                .addNode("analyze_situation", node_async(this::analyzeSituation))
                .addNode("make_decision", node_async(this::makeDecision))
                .addNode("route_to_agent", node_async(this::routeToAgent))
                .addNode("escalate_to_human", node_async(this::escalate))
                .addNode("end_workflow", node_async(this::endWorkflow))
                .addNode("continue_workflow", node_async(this::continueWorkflow))
                .addNode("update_coordination", node_async(this::updateCoordination))
                .addNode("resolve_conflicts", node_async(this::resolveConflicts))
                .addNode("update_monitoring", node_async(this::updateMonitoring))
                .addEdge(START, "analyze_situation")
                .addEdge("analyze_situation", "make_decision")
                .addConditionalEdges("make_decision",
                        edge_async(this::routeAfterDecision),
                        Map.of("route_to_agent", "route_to_agent",
                                "escalate_to_human", "escalate_to_human",
                                "end_workflow", "end_workflow",
                                "continue_workflow", "continue_workflow"))
                .addEdge("route_to_agent", "update_coordination")
                .addEdge("escalate_to_human", "update_coordination")
                .addEdge("end_workflow", "update_coordination")
                .addEdge("continue_workflow", "update_coordination")
                .addEdge("update_coordination", "resolve_conflicts")
                .addEdge("resolve_conflicts", "update_monitoring")
                .addEdge("update_monitoring", END);

        this.tickGraph = graph.compile();
        log.info("Supervisor tick graph compiled");
    }

    // ── Tick ─────────────────────────────────────────────────────────

    /**
     * Runs one supervisor tick over the state and returns the updated state.
     */
    public PipelineState processState(PipelineState state) {
        String workflowId = state.workflowId();
        return workflowLocks.withLock(workflowId, () -> {
            MdcContext.setWorkflow(workflowId);
            long start = System.currentTimeMillis();
            try {
                var config = RunnableConfig.builder()
                        .threadId(workflowId)
                        .build();
                var result = tickGraph.invoke(state.data(), config);
                return result.orElseThrow(() ->
                        new SupervisorException("Supervisor tick returned no state for workflow " + workflowId));
            } finally {
                metrics.recordTickDuration(System.currentTimeMillis() - start);
                MdcContext.clear();
            }
        });
    }

    Map<String, Object> analyzeSituation(PipelineState state) {
        return Map.of(
                "situationAnalysis", analyze(state),
                "lastUpdated", clock.instant());
    }

    Map<String, Object> makeDecision(PipelineState state) {
        SituationAnalysis analysis = state.situationAnalysis().orElseGet(() -> analyze(state));
        return Map.of("decision", decide(state, analysis));
    }

    String routeAfterDecision(PipelineState state) {
        DecisionType type = state.decision()
                .map(SupervisorDecision::getDecisionType)
                .orElse(DecisionType.CONTINUE_WORKFLOW);
        return switch (type) {
            case ROUTE_TO_AGENT -> "route_to_agent";
            case ESCALATE_TO_HUMAN -> "escalate_to_human";
            case END_WORKFLOW -> "end_workflow";
            case CONTINUE_WORKFLOW, RESOLVE_CONFLICT -> "continue_workflow";
        };
    }

    Map<String, Object> routeToAgent(PipelineState state) {
        SupervisorDecision decision = tracked(state);
        Map<String, String> tasks = state.pendingTasks();
        tasks.put(decision.getTargetAgent(), decision.getAction());
        decision.markExecuted(clock.instant());

        log.info("Routing workflow {} to {} ({}): {}", state.workflowId(),
                decision.getTargetAgent(), decision.getAction(), decision.getReasoning());
        return Map.of(
                "nextAction", decision.getTargetAgent(),
                "currentStep", decision.getTargetAgent(),
                "pendingTasks", tasks,
                "agentMessages", List.of(decisionMessage(decision)));
    }

    Map<String, Object> escalate(PipelineState state) {
        SupervisorDecision decision = tracked(state);
        raiseEscalation(decision);
        return Map.of(
                "humanApprovalRequired", true,
                "escalationReason", decision.getReasoning(),
                "nextAction", "",
                "agentMessages", List.of(decisionMessage(decision)));
    }

    Map<String, Object> endWorkflow(PipelineState state) {
        SupervisorDecision decision = tracked(state);
        decision.markExecuted(clock.instant());
        coordinationManager.archive(state.workflowId());

        log.info("Workflow {} completed: {}", state.workflowId(), decision.getReasoning());
        publish(SupervisorEvent.WORKFLOW_ENDED, state.workflowId(), null, Map.of("reason", decision.getReasoning()));
        return Map.of(
                "workflowStatus", WorkflowStatus.COMPLETED.name(),
                "nextAction", "end",
                "currentStep", AGENT_TYPE,
                "agentMessages", List.of(decisionMessage(decision)));
    }

    Map<String, Object> continueWorkflow(PipelineState state) {
        SupervisorDecision decision = tracked(state);
        decision.markExecuted(clock.instant());
        return Map.of(
                "nextAction", "",
                "agentMessages", List.of(decisionMessage(decision)));
    }

    Map<String, Object> updateCoordination(PipelineState state) {
        coordinationManager.updateCoordination(state);
        return Map.of();
    }

    Map<String, Object> resolveConflicts(PipelineState state) {
        PipelineState working = state;
        List<ConflictResolution> handled = new ArrayList<>();
        boolean claimsChanged = false;
        String escalationReason = null;

        for (ConflictResolution conflict : conflictResolver.detectConflicts(state)) {
            try {
                ResolutionOutcome outcome = conflictResolver.resolveConflict(conflict, working);
                if (outcome.changesClaims()) {
                    working = working.apply(Map.of("resourceClaims", outcome.resourceClaims()));
                    claimsChanged = true;
                }
                metrics.recordConflict(conflict.getConflictType(), true);
                publish(SupervisorEvent.CONFLICT_RESOLVED, state.workflowId(), null, Map.of(
                        "conflictId", conflict.getConflictId(),
                        "conflictType", conflict.getConflictType(),
                        "actions", outcome.actionsTaken()));
            } catch (SupervisorException e) {
                log.warn("Conflict {} could not be resolved: {}", conflict.getConflictId(), e.getMessage());
                metrics.recordConflict(conflict.getConflictType(), false);
                SupervisorDecision escalation = errorEscalation(state.workflowId(), "Conflict resolution failed", e);
                raiseEscalation(escalation);
                escalationReason = escalation.getReasoning();
            }
            handled.add(conflict);
        }

        Map<String, Object> update = new HashMap<>();
        if (!handled.isEmpty()) {
            update.put("conflictResolutions", handled);
        }
        if (claimsChanged) {
            update.put("resourceClaims", working.resourceClaims());
        }
        if (escalationReason != null) {
            update.put("humanApprovalRequired", true);
            update.put("escalationReason", escalationReason);
        }
        return update;
    }

    Map<String, Object> updateMonitoring(PipelineState state) {
        PerformanceMonitoring monitoring = performanceMonitor.updateMonitoringData(
                state, decisionHistory.recent(properties.getRecommendationWindow()));
        metrics.recordHealth(monitoring.systemHealth().status());

        boolean pending = hasPendingEscalation(state.workflowId());
        Map<String, Object> update = new HashMap<>();
        update.put("humanApprovalRequired", pending);
        if (!pending) {
            update.put("escalationReason", "");
        }
        update.put("lastUpdated", clock.instant());
        return update;
    }

    // ── Task dispatch ────────────────────────────────────────────────

    @Override
    public List<String> availableTasks() {
        return List.of(MAKE_ROUTING_DECISION, COORDINATE_AGENTS, RESOLVE_CONFLICT,
                MONITOR_PERFORMANCE, ESCALATE_TO_HUMAN);
    }

    /**
     * Runs a supervisor task.
     *
     * @throws UnknownTaskException if the task name is not one of {@link #availableTasks()}
     */
    @Override
    public AgentTaskResult executeTask(String taskName, Map<String, Object> data, PipelineState state) {
        if (taskName == null || !availableTasks().contains(taskName)) {
            throw new UnknownTaskException(taskName);
        }
        Map<String, Object> input = data != null ? data : Map.of();
        return workflowLocks.withLock(state.workflowId(), () -> {
            MdcContext.setWorkflow(state.workflowId());
            long start = System.nanoTime();
            try {
                return switch (taskName) {
                    case MAKE_ROUTING_DECISION -> makeRoutingDecisionTask(state, start);
                    case COORDINATE_AGENTS -> coordinateAgentsTask(input, state, start);
                    case RESOLVE_CONFLICT -> resolveConflictTask(input, state, start);
                    case MONITOR_PERFORMANCE -> monitorPerformanceTask(state, start);
                    case ESCALATE_TO_HUMAN -> escalateTask(input, state, start);
                    default -> throw new UnknownTaskException(taskName);
                };
            } finally {
                MdcContext.clear();
            }
        });
    }

    private AgentTaskResult makeRoutingDecisionTask(PipelineState state, long start) {
        SituationAnalysis analysis = analyze(state);
        SupervisorDecision decision = decide(state, analysis);
        if (decision.getDecisionType() == DecisionType.ESCALATE_TO_HUMAN) {
            raiseEscalation(decision);
        }
        return AgentTaskResult.success(Map.of(
                        "decision", resultMapper.toMap(decision),
                        "analysis", resultMapper.toMap(analysis)),
                decision.getConfidence(), elapsed(start));
    }

    private AgentTaskResult coordinateAgentsTask(Map<String, Object> data, PipelineState state, long start) {
        if (!(data.get("agents") instanceof List<?> rawAgents) || rawAgents.isEmpty()) {
            return AgentTaskResult.failure("coordinate_agents requires a non-empty 'agents' list", elapsed(start));
        }
        CoordinationMode mode;
        try {
            Object rawMode = data.get("mode");
            mode = CoordinationMode.fromValue(rawMode != null ? String.valueOf(rawMode) : null);
        } catch (IllegalArgumentException e) {
            return AgentTaskResult.failure(e.getMessage(), elapsed(start));
        }
        List<String> agents = rawAgents.stream().map(String::valueOf).toList();
        CoordinationPlan plan = coordinationManager.createCoordinationPlan(agents, mode, state);
        coordinationManager.applyPlan(state.workflowId(), plan);
        return AgentTaskResult.success(Map.of("coordination_plan", resultMapper.toMap(plan)), 1.0, elapsed(start));
    }

    private AgentTaskResult resolveConflictTask(Map<String, Object> data, PipelineState state, long start) {
        ConflictResolution conflict;
        try {
            conflict = conflictFromInput(data);
        } catch (IllegalArgumentException e) {
            return AgentTaskResult.failure(e.getMessage(), elapsed(start));
        }

        try {
            ResolutionOutcome outcome = conflictResolver.resolveConflict(conflict, state);
            metrics.recordConflict(conflict.getConflictType(), true);
            return AgentTaskResult.success(Map.of("resolution_result", resultMapper.toMap(outcome)),
                    1.0, elapsed(start));
        } catch (SupervisorException e) {
            log.warn("Conflict {} could not be resolved: {}", conflict.getConflictId(), e.getMessage());
            metrics.recordConflict(String.valueOf(conflict.getConflictType()), false);
            raiseEscalation(errorEscalation(state.workflowId(), "Conflict resolution failed", e));
            return AgentTaskResult.failure(e.getMessage(), elapsed(start));
        }
    }

    private ConflictResolution conflictFromInput(Map<String, Object> data) {
        if (data.get("conflict_id") instanceof String id && !data.containsKey("conflict_type")) {
            return conflictResolver.activeConflicts().stream()
                    .filter(c -> c.getConflictId().equals(id))
                    .findFirst()
                    .orElseThrow(() -> new IllegalArgumentException("No active conflict " + id));
        }
        if (!(data.get("conflicting_agents") instanceof List<?> rawAgents)) {
            throw new IllegalArgumentException("resolve_conflict requires 'conflicting_agents' or a known 'conflict_id'");
        }
        List<String> decisionIds = data.get("decision_ids") instanceof List<?> ids
                ? ids.stream().map(String::valueOf).toList()
                : List.of();
        return new ConflictResolution(
                data.get("conflict_id") instanceof String id ? id : null,
                rawAgents.stream().map(String::valueOf).toList(),
                data.get("conflict_type") instanceof String type ? type : null,
                data.get("description") instanceof String desc ? desc : null,
                data.get("resource") instanceof String resource ? resource : null,
                decisionIds,
                clock.instant());
    }

    private AgentTaskResult monitorPerformanceTask(PipelineState state, long start) {
        PerformanceMonitoring monitoring = performanceMonitor.updateMonitoringData(
                state, decisionHistory.recent(properties.getRecommendationWindow()));
        metrics.recordHealth(monitoring.systemHealth().status());
        return AgentTaskResult.success(Map.of(
                        "performance_data", resultMapper.toMap(monitoring),
                        "recommendations", resultMapper.toMaps(monitoring.recommendations())),
                1.0, elapsed(start));
    }

    @SuppressWarnings("unchecked")
    private AgentTaskResult escalateTask(Map<String, Object> data, PipelineState state, long start) {
        String reason = data.get("reason") instanceof String r && !r.isBlank() ? r : "Manual escalation requested";
        Map<String, Object> context = data.get("context") instanceof Map<?, ?> c ? (Map<String, Object>) c : Map.of();
        SupervisorDecision decision = escalateToHuman(state.workflowId(), reason, context);
        return AgentTaskResult.success(Map.of(
                        "escalation_id", decision.getId(),
                        "status", "escalated"),
                1.0, elapsed(start));
    }

    // ── Human escalation ─────────────────────────────────────────────

    public SupervisorDecision escalateToHuman(String reason, Map<String, Object> context) {
        return escalateToHuman("", reason, context);
    }

    /**
     * Queues a HIGH priority escalation for a human operator.
     */
    public SupervisorDecision escalateToHuman(String workflowId, String reason, Map<String, Object> context) {
        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("context", context != null ? context : Map.of());
        parameters.put("trigger", MANUAL_TRIGGER);
        SupervisorDecision decision = SupervisorDecision.fromDraft(
                DecisionDraft.escalate(reason, Priority.HIGH, 1.0, parameters),
                workflowId != null ? workflowId : "", clock.instant());
        decisionHistory.append(decision);
        metrics.recordDecision(decision);
        raiseEscalation(decision);
        return decision;
    }

    /**
     * Applies a human operator's answer to every pending escalation, across all
     * workflows. Approval and rejection both drain the whole queue; anything else
     * leaves it untouched. Use {@link #handleHumanResponse(String, String)} to answer
     * for a single workflow.
     */
    public EscalationResponse handleHumanResponse(String response) {
        return answerEscalations(null, response);
    }

    /**
     * Applies a human operator's answer to the escalations pending for one workflow.
     * Escalations of other workflows stay queued.
     */
    public EscalationResponse handleHumanResponse(String workflowId, String response) {
        return answerEscalations(workflowId != null ? workflowId : "", response);
    }

    private EscalationResponse answerEscalations(String workflowId, String response) {
        String normalized = response != null ? response.trim().toLowerCase(Locale.ROOT) : "";
        EscalationResponse answer;
        int drained;
        synchronized (pendingHumanDecisions) {
            if (APPROVALS.contains(normalized)) {
                answer = EscalationResponse.approved();
            } else if (REJECTIONS.contains(normalized)) {
                answer = EscalationResponse.rejected();
            } else {
                log.info("Unrecognized human response '{}', asking for clarification", response);
                return EscalationResponse.clarificationNeeded();
            }
            int before = pendingHumanDecisions.size();
            if (workflowId == null) {
                pendingHumanDecisions.clear();
            } else {
                pendingHumanDecisions.removeIf(d -> workflowId.equals(d.getWorkflowId()));
            }
            drained = before - pendingHumanDecisions.size();
        }

        log.info("Human response {}: {} pending escalation(s) cleared", answer.status(), drained);
        metrics.recordHumanResponse(answer.status());
        publish(SupervisorEvent.ESCALATION_ANSWERED, workflowId, null,
                Map.of("status", answer.status(), "cleared", drained));
        return answer;
    }

    public EscalationState escalationState() {
        synchronized (pendingHumanDecisions) {
            return pendingHumanDecisions.isEmpty() ? EscalationState.NONE_PENDING : EscalationState.PENDING_APPROVAL;
        }
    }

    public boolean isHumanApprovalRequired() {
        return escalationState() == EscalationState.PENDING_APPROVAL;
    }

    public List<SupervisorDecision> pendingHumanDecisions() {
        synchronized (pendingHumanDecisions) {
            return List.copyOf(pendingHumanDecisions);
        }
    }

    // ── Introspection ────────────────────────────────────────────────

    public List<SupervisorDecision> decisionHistory(int limit) {
        return decisionHistory.recent(limit);
    }

    /**
     * Recent supervisor events of a workflow, oldest first.
     */
    public List<SupervisorEvent> workflowEvents(String workflowId) {
        return eventBus.events(workflowId);
    }

    public Map<String, Object> performanceSummary() {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("monitoring_data", resultMapper.toMap(performanceMonitor.current()));
        summary.put("decision_count", decisionHistory.size());
        summary.put("active_conflicts", conflictResolver.activeConflicts().size());
        summary.put("workflow_coordinations", coordinationManager.all().size());
        summary.put("pending_escalations", pendingHumanDecisions().size());
        return summary;
    }

    /**
     * Marks a proposed routing decision executed once an external executor dispatched it.
     * Returns false for unknown, discarded or already executed decisions.
     */
    public boolean confirmDispatch(String decisionId) {
        if (decisionHistory.isDiscarded(decisionId)) {
            return false;
        }
        return decisionHistory.find(decisionId)
                .map(d -> d.markExecuted(clock.instant()))
                .orElse(false);
    }

    /**
     * Clears all supervisor-held state between workflow runs.
     */
    public void reset() {
        decisionHistory.clear();
        coordinationManager.reset();
        conflictResolver.reset();
        performanceMonitor.reset();
        eventBus.clearLogs();
        synchronized (pendingHumanDecisions) {
            pendingHumanDecisions.clear();
        }
        log.info("Supervisor reset");
    }

    // ── Internals ────────────────────────────────────────────────────

    private SituationAnalysis analyze(PipelineState state) {
        Map<String, Object> utilization = Map.of(
                "activeAgents", state.activeAgents().size(),
                "pendingTasks", state.pendingTasks().size());
        return new SituationAnalysis(
                state.workflowStatus(),
                List.copyOf(state.activeAgents()),
                state.currentDeals().size(),
                state.activeNegotiations().size(),
                performanceMonitor.assessHealth(state),
                utilization,
                performanceMonitor.identifyBottlenecks(state),
                performanceMonitor.identifyOpportunities(state));
    }

    /**
     * Asks the engine for a decision, turning engine failures into a critical escalation
     * and deferring routing while a human answer is pending. The result is recorded.
     */
    private SupervisorDecision decide(PipelineState state, SituationAnalysis analysis) {
        String workflowId = state.workflowId();
        SupervisorDecision decision;
        try {
            decision = decisionEngine.makeDecision(state, analysis);
        } catch (SupervisorException e) {
            log.error("Decision making failed for workflow {}: {}", workflowId, e.getMessage(), e);
            decision = errorEscalation(workflowId, "Decision making failed", e);
        }

        if (decision.getDecisionType() == DecisionType.ROUTE_TO_AGENT && hasPendingEscalation(workflowId)) {
            log.info("Deferring routing to {} for workflow {} until a human responds",
                    decision.getTargetAgent(), workflowId);
            decision = SupervisorDecision.fromDraft(
                    DecisionDraft.continueWorkflow("Awaiting human response; routing to "
                            + decision.getTargetAgent() + " deferred"),
                    workflowId, clock.instant());
        }

        decisionHistory.append(decision);
        metrics.recordDecision(decision);
        MdcContext.setDecision(workflowId, decision.getId(), decision.getTargetAgent());
        log.info("Decision {}: {}", decision.getDecisionType(), decision.getReasoning());
        publish(SupervisorEvent.DECISION_MADE, workflowId, decision.getTargetAgent(), Map.of(
                "decisionId", decision.getId(),
                "decisionType", decision.getDecisionType().name(),
                "confidence", decision.getConfidence()));
        return decision;
    }

    private SupervisorDecision errorEscalation(String workflowId, String what, SupervisorException e) {
        SupervisorDecision decision = SupervisorDecision.fromDraft(
                DecisionDraft.escalate(what + ": " + e.getMessage(), Priority.CRITICAL, 1.0,
                        Map.of("trigger", "supervisor_error", "error", e.getClass().getSimpleName())),
                workflowId, clock.instant());
        decisionHistory.append(decision);
        metrics.recordDecision(decision);
        return decision;
    }

    /**
     * Queues an escalation for a human. An automatic escalation is dropped while one with
     * the same workflow and trigger is still unanswered, so a persisting fault is asked
     * about once.
     */
    private void raiseEscalation(SupervisorDecision decision) {
        decision.markExecuted(clock.instant());
        String trigger = triggerOf(decision);
        synchronized (pendingHumanDecisions) {
            if (!MANUAL_TRIGGER.equals(trigger) && pendingHumanDecisions.stream().anyMatch(pending ->
                    Objects.equals(pending.getWorkflowId(), decision.getWorkflowId())
                            && trigger.equals(triggerOf(pending)))) {
                log.debug("Escalation {} already pending for workflow {}, not queued again",
                        trigger, decision.getWorkflowId());
                return;
            }
            pendingHumanDecisions.add(decision);
        }
        metrics.incrementEscalations(trigger);
        log.warn("Escalated to human ({}): {}", decision.getPriority(), decision.getReasoning());
        publish(SupervisorEvent.ESCALATION_RAISED, decision.getWorkflowId(), null, Map.of(
                "decisionId", decision.getId(),
                "priority", decision.getPriority().name(),
                "reason", decision.getReasoning()));
    }

    private static String triggerOf(SupervisorDecision decision) {
        return String.valueOf(decision.getParameters().getOrDefault("trigger", "unspecified"));
    }

    private boolean hasPendingEscalation(String workflowId) {
        synchronized (pendingHumanDecisions) {
            return pendingHumanDecisions.stream().anyMatch(d -> workflowId.equals(d.getWorkflowId()));
        }
    }

    /**
     * The history's instance of the state's decision. State values may be copies.
     */
    private SupervisorDecision tracked(PipelineState state) {
        SupervisorDecision fromState = state.decision()
                .orElseThrow(() -> new SupervisorException("No decision in state for workflow " + state.workflowId()));
        return decisionHistory.find(fromState.getId()).orElse(fromState);
    }

    private AgentMessage decisionMessage(SupervisorDecision decision) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("decision_id", decision.getId());
        data.put("decision_type", decision.getDecisionType().name());
        data.put("confidence", decision.getConfidence());
        data.put("target_agent", decision.getTargetAgent());
        return AgentMessage.of(AGENT_TYPE,
                "Strategic decision: " + decision.getAction() + ". Reasoning: " + decision.getReasoning(),
                MESSAGE_PRIORITY, data, clock.instant());
    }

    private void publish(String type, String workflowId, String agent, Map<String, Object> payload) {
        eventBus.publish(new SupervisorEvent(type, workflowId, agent, payload, clock.instant()));
    }

    private static Duration elapsed(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
}
