package com.claim.dates.scoring;

import com.claim.dates.core.model.DateCandidate;

/**
 * Capped bonus for dates that recur across the case.
 */
public class FrequencyBonusRule implements ScoringRule {

    public static final String NAME = "frequency";

    @Override
    public RuleOutcome apply(DateCandidate candidate, int frequency, ScoringContext context) {
        if (frequency < 2) {
            return RuleOutcome.NEUTRAL;
        }
        ScoringWeights w = context.weights();
        return RuleOutcome.of(Math.min((frequency - 1) * w.getFrequencyStep(), w.getFrequencyCap()));
    }

    @Override
    public String name() {
        return NAME;
    }
}
