package com.dealflow.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Outcome of one health assessment pass.
 *
 * @param status worst level found during the pass
 * @param issues human-readable descriptions of what lowered the level
 */
public record SystemHealth(
    HealthLevel status,
    List<String> issues
) implements Serializable {

    public SystemHealth {
        issues = issues != null ? List.copyOf(issues) : List.of();
    }

    public static SystemHealth healthy() {
        return new SystemHealth(HealthLevel.HEALTHY, List.of());
    }

    public boolean isCritical() {
        return status == HealthLevel.CRITICAL;
    }
}
