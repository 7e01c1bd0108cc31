package com.claim.dates.scoring;

import com.claim.dates.core.model.DateCandidate;

/**
 * Base score by category.
 */
public class TypePriorityRule implements ScoringRule {

    public static final String NAME = "type-priority";

    @Override
    public RuleOutcome apply(DateCandidate candidate, int frequency, ScoringContext context) {
        return RuleOutcome.of(context.weights().typeScore(candidate.categoryOrDefault()));
    }

    @Override
    public String name() {
        return NAME;
    }
}
