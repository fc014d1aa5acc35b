package com.dealflow.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * A message posted to the workflow state by an agent.
 *
 * @param id        message identifier
 * @param agentType the posting agent (e.g. "supervisor", "analyst")
 * @param message   human-readable text
 * @param priority  1 (low) to 5 (critical); 4 and above count as errors for health assessment
 * @param timestamp when the message was posted
 * @param data      structured payload, never null
 */
public record AgentMessage(
    String id,
    String agentType,
    String message,
    int priority,
    Instant timestamp,
    Map<String, Object> data
) implements Serializable {

    public static final int MIN_PRIORITY = 1;
    public static final int MAX_PRIORITY = 5;

    public AgentMessage {
        if (priority < MIN_PRIORITY || priority > MAX_PRIORITY) {
            throw new IllegalArgumentException("Message priority must be between 1 and 5, got " + priority);
        }
        data = data != null ? Collections.unmodifiableMap(new LinkedHashMap<>(data)) : Map.of();
    }

    public static AgentMessage of(String agentType, String message, int priority,
                                  Map<String, Object> data, Instant timestamp) {
        return new AgentMessage(UUID.randomUUID().toString(), agentType, message, priority, timestamp, data);
    }

    @SuppressWarnings("unchecked")
    public static AgentMessage fromMap(Map<?, ?> map) {
        Object agent = map.containsKey("agentType") ? map.get("agentType")
                : map.containsKey("agent_type") ? map.get("agent_type") : map.get("agent");
        int priority = map.get("priority") instanceof Number n ? n.intValue() : MIN_PRIORITY;
        return new AgentMessage(
                map.get("id") instanceof String id ? id : UUID.randomUUID().toString(),
                agent != null ? String.valueOf(agent) : "unknown",
                map.get("message") instanceof String m ? m : "",
                Math.max(MIN_PRIORITY, Math.min(MAX_PRIORITY, priority)),
                Timestamps.parse(map.get("timestamp")),
                map.get("data") instanceof Map<?, ?> d ? (Map<String, Object>) d : Map.of());
    }
}
