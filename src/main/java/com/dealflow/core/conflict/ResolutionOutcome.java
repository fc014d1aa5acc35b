package com.dealflow.core.conflict;

import java.util.List;
import java.util.Map;

/**
 * Result of resolving one conflict.
 *
 * @param conflictId           the resolved conflict
 * @param resolved             whether the conflict is resolved
 * @param strategy             strategy that was applied
 * @param actionsTaken         human-readable actions, first entry is the summary
 * @param resourceClaims       replacement for the state's resource claims, or null when unchanged
 * @param discardedDecisionIds decisions dropped in favour of the winner
 */
public record ResolutionOutcome(
    String conflictId,
    boolean resolved,
    String strategy,
    List<String> actionsTaken,
    Map<String, List<String>> resourceClaims,
    List<String> discardedDecisionIds
) {

    public ResolutionOutcome {
        actionsTaken = List.copyOf(actionsTaken);
        discardedDecisionIds = discardedDecisionIds != null ? List.copyOf(discardedDecisionIds) : List.of();
    }

    public boolean changesClaims() {
        return resourceClaims != null;
    }
}
