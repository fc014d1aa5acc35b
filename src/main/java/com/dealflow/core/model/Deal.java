package com.dealflow.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * A unit of business work flowing through the pipeline, as seen by the supervisor.
 *
 * @param id                unique deal identifier
 * @param status            pipeline stage, lowercase (see {@link DealStatus})
 * @param analyzed          whether the analyst has produced an analysis
 * @param outreachInitiated whether the negotiator has contacted the owner
 * @param lastUpdated       when the deal last changed (nullable)
 * @param assignedTo        agent currently working the deal (nullable)
 */
public record Deal(
    String id,
    String status,
    boolean analyzed,
    boolean outreachInitiated,
    Instant lastUpdated,
    String assignedTo
) implements Serializable {

    public boolean hasStatus(DealStatus expected) {
        return expected.matches(status);
    }

    public boolean readyForOutreach() {
        return hasStatus(DealStatus.APPROVED) && !outreachInitiated;
    }

    /**
     * Builds a deal from a loosely typed map as produced by worker agents.
     * A missing {@code analyzed} flag is derived from the status.
     */
    public static Deal fromMap(Map<?, ?> map) {
        String status = map.get("status") instanceof String s ? s : DealStatus.DISCOVERED.value();
        boolean analyzed = map.get("analyzed") instanceof Boolean b ? b : DealStatus.impliesAnalyzed(status);
        boolean outreach = map.get("outreachInitiated") instanceof Boolean b ? b
                : map.get("outreach_initiated") instanceof Boolean b2 && b2;
        Object rawUpdated = map.containsKey("lastUpdated") ? map.get("lastUpdated") : map.get("last_updated");
        Object rawAssigned = map.containsKey("assignedTo") ? map.get("assignedTo") : map.get("assigned_to");
        return new Deal(
                String.valueOf(map.get("id")),
                status,
                analyzed,
                outreach,
                Timestamps.parse(rawUpdated),
                rawAssigned instanceof String a ? a : null);
    }
}
