package com.claim.dates.scoring;

import com.claim.dates.core.model.DateCandidate;

/**
 * Penalizes dates whose context reads like document issuance or print metadata.
 */
public class DocumentMetadataRule implements ScoringRule {

    public static final String NAME = "document-metadata";

    @Override
    public RuleOutcome apply(DateCandidate candidate, int frequency, ScoringContext context) {
        if (KeywordDictionary.containsAny(candidate.getContextSnippet(), context.keywords().documentMetadata())) {
            return RuleOutcome.of(context.weights().getDocumentMetadataPenalty());
        }
        return RuleOutcome.NEUTRAL;
    }

    @Override
    public String name() {
        return NAME;
    }
}
