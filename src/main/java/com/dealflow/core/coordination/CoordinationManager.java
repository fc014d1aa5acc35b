package com.dealflow.core.coordination;

import com.dealflow.core.model.CoordinationMode;
import com.dealflow.core.model.CoordinationPlan;
import com.dealflow.core.model.CoordinationStep;
import com.dealflow.core.model.WorkflowCoordination;
import com.dealflow.core.state.PipelineState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tracks which agents are active per workflow and builds execution plans over agents.
 * <p>
 * Plans only declare intent. Sequential plans chain each agent on its predecessor;
 * parallel plans carry no dependencies.
 */
@Component
public class CoordinationManager {

    private static final Logger log = LoggerFactory.getLogger(CoordinationManager.class);

    static final int ESTIMATED_STEP_SECONDS = 60;

    private final ConcurrentHashMap<String, WorkflowCoordination> coordinations = new ConcurrentHashMap<>();
    private final Clock clock;

    public CoordinationManager(Clock clock) {
        this.clock = clock;
    }

    /**
     * Builds a plan for the given agents. Does not touch any coordination record.
     */
    public CoordinationPlan createCoordinationPlan(List<String> agents, CoordinationMode mode, PipelineState state) {
        List<CoordinationStep> steps = new ArrayList<>();
        for (int i = 0; i < agents.size(); i++) {
            String dependsOn = mode == CoordinationMode.SEQUENTIAL && i > 0 ? agents.get(i - 1) : null;
            steps.add(new CoordinationStep(i + 1, agents.get(i), dependsOn, ESTIMATED_STEP_SECONDS));
        }
        return new CoordinationPlan(UUID.randomUUID().toString(), state.workflowId(),
                agents, mode, steps, clock.instant());
    }

    /**
     * Upserts the coordination record of the state's workflow: replaces its active
     * agents, merges pending tasks and stamps the coordination time. Archived records
     * are left untouched.
     */
    public void updateCoordination(PipelineState state) {
        String workflowId = state.workflowId();
        if (workflowId.isBlank()) {
            return;
        }
        WorkflowCoordination coordination = coordinations.computeIfAbsent(workflowId, WorkflowCoordination::new);
        if (coordination.isArchived()) {
            log.debug("Skipping coordination update for archived workflow {}", workflowId);
            return;
        }
        coordination.refresh(state.activeAgents(), state.pendingTasks(), clock.instant());
    }

    public void applyPlan(String workflowId, CoordinationPlan plan) {
        coordinations.computeIfAbsent(workflowId, WorkflowCoordination::new).applyPlan(plan);
        log.info("Applied {} plan {} with {} steps to workflow {}",
                plan.mode().value(), plan.coordinationId(), plan.steps().size(), workflowId);
    }

    public void archive(String workflowId) {
        WorkflowCoordination coordination = coordinations.computeIfAbsent(workflowId, WorkflowCoordination::new);
        coordination.archive(clock.instant());
        log.info("Archived coordination for workflow {}", workflowId);
    }

    public Optional<WorkflowCoordination> coordination(String workflowId) {
        return Optional.ofNullable(coordinations.get(workflowId));
    }

    public Collection<WorkflowCoordination> all() {
        return List.copyOf(coordinations.values());
    }

    public void reset() {
        coordinations.clear();
    }
}
