package com.claim.dates.scoring;

import com.claim.dates.core.model.DateCandidate;
import com.claim.dates.core.model.DateCategory;
import com.claim.dates.core.model.RangeBoundary;

/**
 * Rewards coverage-start dates and penalizes coverage-end dates. A start signal
 * wins when both are present.
 */
public class InsurancePeriodRoleRule implements ScoringRule {

    public static final String NAME = "insurance-period-role";

    @Override
    public RuleOutcome apply(DateCandidate candidate, int frequency, ScoringContext context) {
        if (isStart(candidate, context)) {
            return RuleOutcome.of(context.weights().getInsuranceStartBonus());
        }
        if (isEnd(candidate, context)) {
            return RuleOutcome.of(context.weights().getInsuranceEndPenalty());
        }
        return RuleOutcome.NEUTRAL;
    }

    private boolean isStart(DateCandidate candidate, ScoringContext context) {
        DateCategory category = candidate.categoryOrDefault();
        if (category == DateCategory.INSURANCE_EXPIRY) {
            return false;
        }
        RangeBoundary boundary = candidate.getRangeBoundary();
        if (boundary != null && boundary.insurancePeriod()
                && boundary.isEarlierBoundary(candidate.getNormalizedDate())) {
            return true;
        }
        return category == DateCategory.INSURANCE_ENROLLMENT
                || KeywordDictionary.containsAny(candidate.getContextSnippet(), context.keywords().enrollment());
    }

    private boolean isEnd(DateCandidate candidate, ScoringContext context) {
        RangeBoundary boundary = candidate.getRangeBoundary();
        if (boundary != null && boundary.insurancePeriod()
                && !boundary.isEarlierBoundary(candidate.getNormalizedDate())) {
            return true;
        }
        return candidate.categoryOrDefault() == DateCategory.INSURANCE_EXPIRY
                || KeywordDictionary.containsAny(candidate.getContextSnippet(), context.keywords().expiry());
    }

    @Override
    public String name() {
        return NAME;
    }
}
