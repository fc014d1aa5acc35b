package com.dealflow.core.monitor;

import com.dealflow.core.model.SupervisorDecision;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Finds routing patterns in recent decisions: one agent dominating the window, or
 * routing that alternates between two agents (A-B-A-B pattern).
 */
@Component
public class RoutingPatternDetector {

    /**
     * Returns the agent targeted by at least {@code threshold} of the last {@code window} decisions.
     */
    public Optional<Map.Entry<String, Integer>> dominantAgent(List<SupervisorDecision> recent, int window, int threshold) {
        List<SupervisorDecision> tail = recent.subList(Math.max(0, recent.size() - window), recent.size());
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (SupervisorDecision d : tail) {
            if (d.getTargetAgent() != null) {
                counts.merge(d.getTargetAgent(), 1, Integer::sum);
            }
        }
        return counts.entrySet().stream()
                .filter(e -> e.getValue() >= threshold)
                .max(Map.Entry.comparingByValue())
                .map(e -> Map.entry(e.getKey(), e.getValue()));
    }

    /**
     * True when the last four routed targets alternate between two distinct agents.
     */
    public boolean isOscillating(List<SupervisorDecision> recent) {
        List<String> targets = recent.stream()
                .map(SupervisorDecision::getTargetAgent)
                .filter(Objects::nonNull)
                .toList();
        if (targets.size() < 4) {
            return false;
        }
        List<String> last = targets.subList(targets.size() - 4, targets.size());
        // target[N] matches target[N-2] but differs from target[N-1]
        return last.get(0).equals(last.get(2))
                && last.get(1).equals(last.get(3))
                && !last.get(0).equals(last.get(1));
    }

    /**
     * The two agents of an oscillation, most recent last. Only meaningful when {@link #isOscillating} holds.
     */
    List<String> oscillatingPair(List<SupervisorDecision> recent) {
        List<String> targets = recent.stream()
                .map(SupervisorDecision::getTargetAgent)
                .filter(Objects::nonNull)
                .toList();
        return targets.subList(targets.size() - 2, targets.size());
    }
}
