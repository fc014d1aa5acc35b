package com.dealflow.core.decision;

import com.dealflow.core.model.*;
import com.dealflow.core.state.PipelineState;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.BiFunction;

/**
 * The built-in routing rules of the deal pipeline.
 */
public final class DecisionRules {

    public static final String ESCALATE_TO_HUMAN = "escalate_to_human";
    public static final String ROUTE_TO_ANALYST = "route_to_analyst";
    public static final String ROUTE_TO_NEGOTIATOR = "route_to_negotiator";
    public static final String END_WORKFLOW = "end_workflow";
    public static final String ROUTE_TO_SCOUT = "route_to_scout";

    private DecisionRules() {}

    /**
     * Builds the standard rule set.
     *
     * @param lowWaterMark pipelines with fewer deals than this are routed to the scout
     */
    public static List<DecisionRule> standard(int lowWaterMark) {
        return List.of(
                new PredicateRule(ESCALATE_TO_HUMAN, 100, DecisionRules::criticalHealth),
                new PredicateRule(ROUTE_TO_ANALYST, 90, DecisionRules::unanalyzedDeals),
                new PredicateRule(ROUTE_TO_NEGOTIATOR, 80, DecisionRules::approvedWithoutOutreach),
                new PredicateRule(END_WORKFLOW, 75, DecisionRules::allDealsClosed),
                new PredicateRule(ROUTE_TO_SCOUT, 70, (state, analysis) -> pipelineBelow(lowWaterMark, analysis)));
    }

    static Optional<DecisionDraft> criticalHealth(PipelineState state, SituationAnalysis analysis) {
        SystemHealth health = analysis.systemHealth();
        if (!health.isCritical()) {
            return Optional.empty();
        }
        return Optional.of(DecisionDraft.escalate(
                "System health critical: " + health.issues(),
                Priority.CRITICAL, 1.0,
                Map.of("issues", health.issues(), "trigger", "system_health")));
    }

    static Optional<DecisionDraft> unanalyzedDeals(PipelineState state, SituationAnalysis analysis) {
        List<String> ids = state.currentDeals().stream()
                .filter(d -> !d.analyzed())
                .map(Deal::id)
                .toList();
        if (ids.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new DecisionDraft(DecisionType.ROUTE_TO_AGENT, "analyst", "analyze",
                "Found " + ids.size() + " unanalyzed deals requiring analysis",
                Priority.MEDIUM, 0.95, Map.of("dealIds", ids)));
    }

    static Optional<DecisionDraft> approvedWithoutOutreach(PipelineState state, SituationAnalysis analysis) {
        List<String> ids = state.currentDeals().stream()
                .filter(Deal::readyForOutreach)
                .map(Deal::id)
                .toList();
        if (ids.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new DecisionDraft(DecisionType.ROUTE_TO_AGENT, "negotiator", "negotiate",
                "Found " + ids.size() + " approved deals ready for outreach",
                Priority.MEDIUM, 0.92, Map.of("dealIds", ids)));
    }

    static Optional<DecisionDraft> allDealsClosed(PipelineState state, SituationAnalysis analysis) {
        List<Deal> deals = state.currentDeals();
        if (deals.isEmpty() || !state.activeNegotiations().isEmpty()) {
            return Optional.empty();
        }
        boolean allClosed = deals.stream().allMatch(d -> d.hasStatus(DealStatus.CLOSED));
        if (!allClosed) {
            return Optional.empty();
        }
        return Optional.of(DecisionDraft.endWorkflow(
                "Workflow objectives met: " + deals.size() + " deals closed", 0.85));
    }

    static Optional<DecisionDraft> pipelineBelow(int lowWaterMark, SituationAnalysis analysis) {
        int count = analysis.currentDeals();
        if (count >= lowWaterMark) {
            return Optional.empty();
        }
        return Optional.of(DecisionDraft.route("scout", "scout",
                "Pipeline has only " + count + " deals, need to scout for more", 0.90));
    }

    /**
     * A rule backed by a function of the state and analysis.
     */
    record PredicateRule(
        String name,
        int priority,
        BiFunction<PipelineState, SituationAnalysis, Optional<DecisionDraft>> condition
    ) implements DecisionRule {

        @Override
        public Optional<DecisionDraft> evaluate(PipelineState state, SituationAnalysis analysis) {
            return condition.apply(state, analysis);
        }
    }
}
