package com.claim.dates.core.model;

import java.time.LocalDate;
import java.util.Comparator;
import java.util.Objects;

/**
 * A deduplicated candidate with its relevance score and acceptance decision.
 *
 * @param candidate the classified candidate
 * @param frequency number of occurrences of this date across all batches and sub-collections
 * @param score     summed rule deltas (may be negative)
 * @param accepted  true when the candidate was not vetoed and reached the threshold
 * @param breakdown per-rule contributions
 */
public record ScoredCandidate(
        DateCandidate candidate,
        int frequency,
        int score,
        boolean accepted,
        ScoreBreakdown breakdown
) {
    /**
     * Display order for accepted candidates: score descending, then chronological.
     */
    public static final Comparator<ScoredCandidate> RANKING =
            Comparator.comparingInt(ScoredCandidate::score).reversed()
                    .thenComparing(ScoredCandidate::date);

    public ScoredCandidate {
        Objects.requireNonNull(candidate, "candidate is required");
        Objects.requireNonNull(breakdown, "breakdown is required");
        if (frequency < 1) {
            throw new IllegalArgumentException("frequency must be >= 1");
        }
    }

    public LocalDate date() {
        return candidate.getNormalizedDate();
    }

    public DateCategory category() {
        return candidate.categoryOrDefault();
    }
}
