package com.dealflow.core.decision;

import com.dealflow.core.error.ConfigurationException;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Validated, priority-ordered set of decision rules.
 */
public final class DecisionRuleCatalog {

    private final List<DecisionRule> rules;

    private DecisionRuleCatalog(List<DecisionRule> rules) {
        this.rules = rules;
    }

    /**
     * Validates the rules and orders them by descending priority.
     *
     * @throws ConfigurationException if the list is empty, names or priorities repeat,
     *                                or the human escalation rule is not evaluated first
     */
    public static DecisionRuleCatalog of(List<DecisionRule> rules) {
        if (rules == null || rules.isEmpty()) {
            throw new ConfigurationException("Decision rule catalog is empty");
        }
        Set<String> names = new HashSet<>();
        Set<Integer> priorities = new HashSet<>();
        for (DecisionRule rule : rules) {
            if (!names.add(rule.name())) {
                throw new ConfigurationException("Duplicate decision rule name: " + rule.name());
            }
            if (!priorities.add(rule.priority())) {
                throw new ConfigurationException("Duplicate decision rule priority " + rule.priority()
                        + " (rule " + rule.name() + ")");
            }
        }

        List<DecisionRule> sorted = new ArrayList<>(rules);
        sorted.sort(Comparator.comparingInt(DecisionRule::priority).reversed());

        boolean hasEscalation = names.contains(DecisionRules.ESCALATE_TO_HUMAN);
        if (hasEscalation && !DecisionRules.ESCALATE_TO_HUMAN.equals(sorted.get(0).name())) {
            throw new ConfigurationException("Rule " + DecisionRules.ESCALATE_TO_HUMAN
                    + " must have the highest priority, found " + sorted.get(0).name() + " above it");
        }
        return new DecisionRuleCatalog(List.copyOf(sorted));
    }

    public List<DecisionRule> rules() {
        return rules;
    }

    public int size() {
        return rules.size();
    }
}
