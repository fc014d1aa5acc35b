package com.dealflow.core.model;

import java.util.Locale;

/**
 * Shape of a coordination plan.
 * <p>
 * SEQUENTIAL: strict hand-off, each agent waits for the previous one.
 * PARALLEL: fan-out, no step depends on another. This declares intent only;
 * actual concurrent execution belongs to the external executor.
 */
public enum CoordinationMode {
    SEQUENTIAL,
    PARALLEL;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static CoordinationMode fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return SEQUENTIAL;
        }
        try {
            return valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown coordination mode: " + raw, e);
        }
    }
}
