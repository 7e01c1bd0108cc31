package com.claim.dates.scoring;

import com.claim.dates.core.model.DateCandidate;

import java.time.temporal.ChronoUnit;

/**
 * Tiered bonus for dates close to the claim (or processing) date, in either direction.
 */
public class RecencyRule implements ScoringRule {

    public static final String NAME = "recency";

    @Override
    public RuleOutcome apply(DateCandidate candidate, int frequency, ScoringContext context) {
        ScoringWeights w = context.weights();
        long distance = Math.abs(ChronoUnit.DAYS.between(candidate.getNormalizedDate(), context.recencyReference()));
        if (distance <= w.getRecentDays()) {
            return RuleOutcome.of(w.getRecentBonus());
        }
        if (distance <= w.getYearDays()) {
            return RuleOutcome.of(w.getYearBonus());
        }
        if (distance <= w.getFiveYearDays()) {
            return RuleOutcome.of(w.getFiveYearBonus());
        }
        return RuleOutcome.NEUTRAL;
    }

    @Override
    public String name() {
        return NAME;
    }
}
