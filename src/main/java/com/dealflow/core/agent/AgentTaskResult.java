package com.dealflow.core.agent;

import java.io.Serializable;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of an agent task, in the shape every worker agent returns.
 *
 * @param success         whether the task completed
 * @param data            result payload on success, empty on failure
 * @param error           failure description, null on success
 * @param confidenceScore agent's confidence in the result, in [0, 1]
 * @param executionTime   wall-clock time spent on the task
 */
public record AgentTaskResult(
    boolean success,
    Map<String, Object> data,
    String error,
    double confidenceScore,
    Duration executionTime
) implements Serializable {

    public AgentTaskResult {
        data = data != null ? Collections.unmodifiableMap(new LinkedHashMap<>(data)) : Map.of();
    }

    public static AgentTaskResult success(Map<String, Object> data, double confidenceScore, Duration executionTime) {
        return new AgentTaskResult(true, data, null, confidenceScore, executionTime);
    }

    public static AgentTaskResult failure(String error, Duration executionTime) {
        return new AgentTaskResult(false, Map.of(), error, 0.0, executionTime);
    }
}
