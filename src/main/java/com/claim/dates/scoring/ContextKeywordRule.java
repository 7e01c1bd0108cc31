package com.claim.dates.scoring;

import com.claim.dates.core.model.DateCandidate;

/**
 * At most one bonus for positive keywords and at most one penalty for negative
 * keywords, however many of each occur.
 */
public class ContextKeywordRule implements ScoringRule {

    public static final String NAME = "context-keywords";

    @Override
    public RuleOutcome apply(DateCandidate candidate, int frequency, ScoringContext context) {
        String snippet = candidate.getContextSnippet();
        int delta = 0;
        if (KeywordDictionary.containsAny(snippet, context.keywords().positive())) {
            delta += context.weights().getPositiveContextBonus();
        }
        if (KeywordDictionary.containsAny(snippet, context.keywords().negative())) {
            delta += context.weights().getNegativeContextPenalty();
        }
        return RuleOutcome.of(delta);
    }

    @Override
    public String name() {
        return NAME;
    }
}
