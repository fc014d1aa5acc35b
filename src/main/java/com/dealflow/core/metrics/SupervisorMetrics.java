package com.dealflow.core.metrics;

import com.dealflow.core.model.HealthLevel;
import com.dealflow.core.model.SupervisorDecision;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for supervisor decisions and arbitration.
 */
@Service
public class SupervisorMetrics {

    private final MeterRegistry registry;

    public SupervisorMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordDecision(SupervisorDecision decision) {
        Counter.builder("dealflow.decisions.total")
                .tag("type", decision.getDecisionType().name())
                .tag("target", decision.getTargetAgent() != null ? decision.getTargetAgent() : "none")
                .register(registry)
                .increment();
    }

    public void incrementEscalations(String reason) {
        Counter.builder("dealflow.escalations.total")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordHumanResponse(String status) {
        Counter.builder("dealflow.escalations.responses")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    /**
     * @param conflictType type of the arbitrated conflict
     * @param resolved     false when no strategy applied and the conflict was escalated
     */
    public void recordConflict(String conflictType, boolean resolved) {
        Counter.builder("dealflow.conflicts.total")
                .tag("type", conflictType)
                .tag("resolved", String.valueOf(resolved))
                .register(registry)
                .increment();
    }

    public void recordHealth(HealthLevel level) {
        Counter.builder("dealflow.health.assessments")
                .tag("status", level.value())
                .register(registry)
                .increment();
    }

    public void recordTickDuration(long ms) {
        Timer.builder("dealflow.tick.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }
}
