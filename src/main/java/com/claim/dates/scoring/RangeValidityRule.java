package com.claim.dates.scoring;

import com.claim.dates.core.model.DateCandidate;
import com.claim.dates.core.model.DateCategory;

/**
 * Vetoes dates outside the plausible year window. Expiry dates may lie far in
 * the future and are only checked against the lower bound.
 */
public class RangeValidityRule implements ScoringRule {

    public static final String NAME = "range-validity";

    @Override
    public RuleOutcome apply(DateCandidate candidate, int frequency, ScoringContext context) {
        ScoringWeights weights = context.weights();
        int year = candidate.getNormalizedDate().getYear();
        if (year < weights.getMinYear()) {
            return RuleOutcome.veto("year " + year + " before " + weights.getMinYear());
        }
        int maxYear = context.processingDate().getYear() + weights.getMaxYearsAhead();
        if (year > maxYear && candidate.categoryOrDefault() != DateCategory.INSURANCE_EXPIRY) {
            return RuleOutcome.veto("year " + year + " after " + maxYear);
        }
        return RuleOutcome.NEUTRAL;
    }

    @Override
    public String name() {
        return NAME;
    }
}
