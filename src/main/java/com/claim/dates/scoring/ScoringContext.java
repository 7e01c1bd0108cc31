package com.claim.dates.scoring;

import java.time.LocalDate;
import java.util.Objects;
import java.util.Optional;

/**
 * Case-level inputs shared by every rule evaluation of one case.
 *
 * @param processingDate date the case is processed; bounds the year window
 * @param claimDate      claim date when known, preferred as the recency reference
 * @param weights        point values and bounds
 * @param keywords       keyword sets for context matching
 */
public record ScoringContext(
        LocalDate processingDate,
        LocalDate claimDate,
        ScoringWeights weights,
        KeywordDictionary keywords
) {
    public ScoringContext {
        Objects.requireNonNull(processingDate, "processingDate is required");
        weights = weights != null ? weights : ScoringWeights.defaults();
        keywords = keywords != null ? keywords : KeywordDictionary.defaults();
    }

    public static ScoringContext of(LocalDate processingDate) {
        return new ScoringContext(processingDate, null, null, null);
    }

    public Optional<LocalDate> getClaimDate() {
        return Optional.ofNullable(claimDate);
    }

    /**
     * Date recency is measured against: the claim date, else the processing date.
     */
    public LocalDate recencyReference() {
        return claimDate != null ? claimDate : processingDate;
    }
}
