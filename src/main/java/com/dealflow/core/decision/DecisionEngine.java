package com.dealflow.core.decision;

import com.dealflow.core.config.SupervisorProperties;
import com.dealflow.core.error.ConfigurationException;
import com.dealflow.core.model.DecisionDraft;
import com.dealflow.core.model.SituationAnalysis;
import com.dealflow.core.model.SupervisorDecision;
import com.dealflow.core.state.PipelineState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * Picks the next supervisor decision by evaluating the rule catalog against the
 * current situation.
 * <p>
 * The first rule, in descending priority, whose draft clears the confidence threshold
 * wins. When none does, the pipeline keeps scouting at low confidence.
 */
@Component
public class DecisionEngine {

    private static final Logger log = LoggerFactory.getLogger(DecisionEngine.class);

    static final double FALLBACK_CONFIDENCE = 0.5;

    private final SupervisorProperties properties;
    private final Clock clock;

    private volatile DecisionRuleCatalog catalog;

    public DecisionEngine(SupervisorProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Loads the standard rule set.
     */
    public void initialize() {
        initialize(DecisionRules.standard(properties.getLowWaterMark()));
    }

    public void initialize(List<DecisionRule> rules) {
        this.catalog = DecisionRuleCatalog.of(rules);
        log.info("Decision engine initialized with {} rules (threshold {})",
                catalog.size(), properties.getConfidenceThreshold());
    }

    public boolean isInitialized() {
        return catalog != null;
    }

    /**
     * Returns the decision for this tick.
     *
     * @throws ConfigurationException if {@link #initialize()} has not run
     * @throws com.dealflow.core.error.InvalidDecisionException if a matching rule yields a malformed draft
     */
    public SupervisorDecision makeDecision(PipelineState state, SituationAnalysis analysis) {
        DecisionRuleCatalog rules = this.catalog;
        if (rules == null) {
            throw new ConfigurationException("Decision engine used before initialize()");
        }

        double threshold = properties.getConfidenceThreshold();
        for (DecisionRule rule : rules.rules()) {
            Optional<DecisionDraft> draft = rule.evaluate(state, analysis);
            if (draft.isEmpty()) {
                continue;
            }
            SupervisorDecision candidate = SupervisorDecision.fromDraft(draft.get(), state.workflowId(), clock.instant());
            if (candidate.getConfidence() >= threshold) {
                log.debug("Rule {} matched: {}", rule.name(), candidate);
                return candidate;
            }
            log.debug("Rule {} matched below threshold ({} < {})", rule.name(), candidate.getConfidence(), threshold);
        }

        log.debug("No rule cleared threshold {}, falling back to scouting", threshold);
        return SupervisorDecision.fromDraft(
                DecisionDraft.route("scout", "scout", "Default action: continue scouting for deals", FALLBACK_CONFIDENCE),
                state.workflowId(), clock.instant());
    }
}
