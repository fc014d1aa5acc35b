package com.dealflow.core.model;

import java.io.Serializable;
import java.util.Map;

/**
 * An active negotiation with a deal's owner.
 */
public record Negotiation(
    String id,
    String dealId,
    String status
) implements Serializable {

    public static Negotiation fromMap(Map<?, ?> map) {
        Object dealId = map.containsKey("dealId") ? map.get("dealId") : map.get("deal_id");
        return new Negotiation(
                String.valueOf(map.get("id")),
                dealId != null ? String.valueOf(dealId) : null,
                map.get("status") instanceof String s ? s : "");
    }
}
