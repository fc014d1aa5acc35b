package com.dealflow.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * Declared execution-order graph over agents for one workflow.
 */
public record CoordinationPlan(
    String coordinationId,
    String workflowId,
    List<String> agents,
    CoordinationMode mode,
    List<CoordinationStep> steps,
    Instant createdAt
) implements Serializable {

    public CoordinationPlan {
        agents = List.copyOf(agents);
        steps = List.copyOf(steps);
    }
}
