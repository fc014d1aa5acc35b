package com.dealflow.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * System health levels, ordered from best to worst.
 */
public enum HealthLevel {
    HEALTHY,
    DEGRADED,
    CRITICAL;

    /**
     * Returns the worse of the two levels. Health never improves within one assessment.
     */
    public HealthLevel worse(HealthLevel other) {
        return other != null && other.compareTo(this) > 0 ? other : this;
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
