package com.dealflow.core.conflict;

import com.dealflow.core.config.SupervisorProperties;
import com.dealflow.core.decision.DecisionHistory;
import com.dealflow.core.error.UnhandledConflictTypeException;
import com.dealflow.core.model.ConflictResolution;
import com.dealflow.core.model.DecisionType;
import com.dealflow.core.model.SupervisorDecision;
import com.dealflow.core.state.PipelineState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Detects and arbitrates conflicts between agents.
 * <p>
 * Two kinds are detected: a resource claimed by more than one active agent, and open
 * decisions of one workflow pointing at different outcomes. Both are settled by
 * priority. A conflict detected again before it is resolved maps to the same record.
 */
@Component
public class ConflictResolver {

    private static final Logger log = LoggerFactory.getLogger(ConflictResolver.class);

    static final String PRIORITY_BASED = "priority_based";
    static final String SUPERVISOR = "supervisor";

    private final SupervisorProperties properties;
    private final DecisionHistory history;
    private final Clock clock;

    /** Unresolved conflicts keyed by what they contend over. */
    private final ConcurrentHashMap<String, ConflictResolution> active = new ConcurrentHashMap<>();

    public ConflictResolver(SupervisorProperties properties, DecisionHistory history, Clock clock) {
        this.properties = properties;
        this.history = history;
        this.clock = clock;
    }

    public List<ConflictResolution> detectConflicts(PipelineState state) {
        return detectConflicts(state, history.open(state.workflowId()));
    }

    /**
     * Returns the conflicts present in the state and the given open decisions.
     * A clean state yields an empty list.
     */
    public List<ConflictResolution> detectConflicts(PipelineState state, List<SupervisorDecision> openDecisions) {
        List<ConflictResolution> conflicts = new ArrayList<>();
        conflicts.addAll(detectResourceConflicts(state));
        detectDecisionConflict(openDecisions).ifPresent(conflicts::add);
        if (!conflicts.isEmpty()) {
            log.info("Detected {} conflict(s) in workflow {}", conflicts.size(), state.workflowId());
        }
        return conflicts;
    }

    private List<ConflictResolution> detectResourceConflicts(PipelineState state) {
        Set<String> running = state.activeAgents();
        Map<String, List<String>> claimants = new LinkedHashMap<>();
        state.resourceClaims().forEach((agent, resources) -> {
            if (!running.contains(agent)) {
                return;
            }
            for (String resource : resources) {
                List<String> agents = claimants.computeIfAbsent(resource, r -> new ArrayList<>());
                if (!agents.contains(agent)) {
                    agents.add(agent);
                }
            }
        });

        List<ConflictResolution> found = new ArrayList<>();
        claimants.forEach((resource, agents) -> {
            if (agents.size() >= 2) {
                String key = "resource:" + state.workflowId() + ":" + resource;
                found.add(active.computeIfAbsent(key,
                        k -> ConflictResolution.resourceConflict(resource, agents, clock.instant())));
            }
        });
        return found;
    }

    private Optional<ConflictResolution> detectDecisionConflict(List<SupervisorDecision> openDecisions) {
        Set<String> outcomes = new LinkedHashSet<>();
        Set<String> agents = new LinkedHashSet<>();
        for (SupervisorDecision d : openDecisions) {
            outcomes.add(d.getDecisionType() + ":" + d.getTargetAgent());
            agents.add(agentOf(d));
        }
        if (outcomes.size() < 2 || agents.size() < 2) {
            return Optional.empty();
        }
        List<String> ids = openDecisions.stream().map(SupervisorDecision::getId).sorted().toList();
        String key = "decision:" + String.join(",", ids);
        String description = "Open decisions disagree: " + String.join(" vs ", outcomes);
        return Optional.of(active.computeIfAbsent(key,
                k -> ConflictResolution.decisionConflict(List.copyOf(agents), ids, description, clock.instant())));
    }

    /**
     * Resolves a conflict. Re-resolving a resolved record returns its recorded actions
     * and changes nothing.
     *
     * @throws UnhandledConflictTypeException if no strategy exists for the conflict type
     */
    public ResolutionOutcome resolveConflict(ConflictResolution conflict, PipelineState state) {
        if (conflict.isResolved()) {
            return new ResolutionOutcome(conflict.getConflictId(), true, conflict.getResolutionStrategy(),
                    conflict.getActionsTaken(), null, List.of());
        }

        ResolutionOutcome outcome = switch (String.valueOf(conflict.getConflictType())) {
            case ConflictResolution.RESOURCE_CONFLICT -> resolveResourceConflict(conflict, state);
            case ConflictResolution.DECISION_CONFLICT -> resolveDecisionConflict(conflict);
            default -> throw new UnhandledConflictTypeException(conflict.getConflictId(), conflict.getConflictType());
        };

        if (!conflict.markResolved(outcome.strategy(), outcome.actionsTaken(), clock.instant())) {
            // Another tick got there first; report what it recorded
            return new ResolutionOutcome(conflict.getConflictId(), true, conflict.getResolutionStrategy(),
                    conflict.getActionsTaken(), null, List.of());
        }
        active.values().remove(conflict);
        outcome.discardedDecisionIds().forEach(history::discard);
        log.info("Resolved {} {}: {}", conflict.getConflictType(), conflict.getConflictId(), outcome.actionsTaken());
        return outcome;
    }

    private ResolutionOutcome resolveResourceConflict(ConflictResolution conflict, PipelineState state) {
        String resource = conflict.getResource();
        String winner = conflict.getConflictingAgents().stream()
                .min(Comparator.comparingInt((String a) -> properties.agentPriority(a)).reversed()
                        .thenComparing(Comparator.naturalOrder()))
                .orElseThrow();

        Map<String, List<String>> claims = new LinkedHashMap<>();
        state.resourceClaims().forEach((agent, resources) -> {
            if (!agent.equals(winner) && conflict.getConflictingAgents().contains(agent)) {
                claims.put(agent, resources.stream().filter(r -> !r.equals(resource)).toList());
            } else {
                claims.put(agent, resources);
            }
        });

        List<String> actions = List.of("Reallocated resources", "Assigned " + resource + " to " + winner);
        return new ResolutionOutcome(conflict.getConflictId(), true, PRIORITY_BASED, actions, claims, List.of());
    }

    private ResolutionOutcome resolveDecisionConflict(ConflictResolution conflict) {
        List<SupervisorDecision> decisions = conflict.getDecisionIds().stream()
                .map(history::find)
                .flatMap(Optional::stream)
                .toList();
        SupervisorDecision winner = decisions.stream()
                .max(Comparator.comparing(SupervisorDecision::getPriority)
                        .thenComparingDouble(SupervisorDecision::getConfidence)
                        .thenComparing(SupervisorDecision::getCreatedAt))
                .orElse(null);

        List<String> actions = new ArrayList<>();
        actions.add("Applied priority-based resolution");
        List<String> losers = new ArrayList<>();
        if (winner != null) {
            actions.add("Kept decision " + winner.getId() + " (" + agentOf(winner) + ")");
            decisions.stream()
                    .filter(d -> d != winner)
                    .forEach(d -> losers.add(d.getId()));
        }
        return new ResolutionOutcome(conflict.getConflictId(), true, PRIORITY_BASED, actions, null, losers);
    }

    public List<ConflictResolution> activeConflicts() {
        return List.copyOf(active.values());
    }

    public void reset() {
        active.clear();
    }

    private static String agentOf(SupervisorDecision decision) {
        return decision.getDecisionType() == DecisionType.ROUTE_TO_AGENT ? decision.getTargetAgent() : SUPERVISOR;
    }
}
