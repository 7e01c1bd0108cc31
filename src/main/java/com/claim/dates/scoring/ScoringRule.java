package com.claim.dates.scoring;

import com.claim.dates.core.model.DateCandidate;

/**
 * One phase of relevance scoring. Implementations must be pure and stateless.
 */
public interface ScoringRule {

    /**
     * Evaluates the rule for a classified candidate.
     *
     * @param candidate the classified candidate
     * @param frequency occurrences of the candidate's date in the case
     * @param context   case-level inputs
     * @return a signed delta or a veto
     */
    RuleOutcome apply(DateCandidate candidate, int frequency, ScoringContext context);

    /**
     * Name recorded in the score breakdown.
     */
    String name();
}
