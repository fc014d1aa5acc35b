package com.dealflow.core.decision;

import com.dealflow.core.model.DecisionDraft;
import com.dealflow.core.model.SituationAnalysis;
import com.dealflow.core.state.PipelineState;

import java.util.Optional;

/**
 * A named condition that proposes a decision when it matches the current situation.
 * <p>
 * Rules are evaluated in descending {@link #priority()} order. Implementations must be
 * side-effect free; the same inputs always yield the same draft.
 */
public interface DecisionRule {

    String name();

    /**
     * Static evaluation priority. Higher is evaluated first; priorities are unique within a catalog.
     */
    int priority();

    Optional<DecisionDraft> evaluate(PipelineState state, SituationAnalysis analysis);
}
