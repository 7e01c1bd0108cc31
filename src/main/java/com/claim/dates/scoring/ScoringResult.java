package com.claim.dates.scoring;

import com.claim.dates.core.model.ScoredCandidate;

import java.util.List;

/**
 * Scores for every deduplicated candidate of a case plus the ranked accepted subset.
 *
 * @param scored all candidates in input order, accepted or not
 * @param ranked accepted candidates in {@link ScoredCandidate#RANKING} order
 */
public record ScoringResult(List<ScoredCandidate> scored, List<ScoredCandidate> ranked) {

    public ScoringResult {
        scored = scored != null ? List.copyOf(scored) : List.of();
        ranked = ranked != null ? List.copyOf(ranked) : List.of();
    }

    public int acceptedCount() {
        return ranked.size();
    }

    public int rejectedCount() {
        return scored.size() - ranked.size();
    }

    public long vetoedCount() {
        return scored.stream().filter(s -> s.breakdown().isVetoed()).count();
    }
}
