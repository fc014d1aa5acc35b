package com.dealflow.core.model;

import java.util.Locale;

/**
 * Pipeline stages a deal moves through. Deals carry the status as a lowercase
 * string; this enum gives the known values a name.
 */
public enum DealStatus {
    DISCOVERED,
    ANALYZING,
    ANALYZED,
    APPROVED,
    OUTREACH_INITIATED,
    IN_NEGOTIATION,
    UNDER_CONTRACT,
    CLOSING,
    CLOSED,
    REJECTED,
    DEAD;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean matches(String status) {
        return status != null && value().equalsIgnoreCase(status);
    }

    /**
     * Whether a deal in the given status has necessarily been through analysis.
     * Used when a deal record does not carry an explicit {@code analyzed} flag.
     */
    public static boolean impliesAnalyzed(String status) {
        if (status == null) return false;
        for (var s : values()) {
            if (s.matches(status)) {
                return s.ordinal() >= ANALYZED.ordinal();
            }
        }
        return false;
    }
}
