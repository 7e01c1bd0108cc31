package com.claim.dates.api;

import com.claim.dates.core.model.InvestigationRisk;
import com.claim.dates.core.model.MatchResult;
import com.claim.dates.core.model.ScoredCandidate;
import com.claim.dates.enrollment.ProximityReport;

import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of analyzing one case.
 *
 * @param caseId         the analyzed case
 * @param processingDate date the analysis ran against
 * @param ranked         accepted candidates, best first
 * @param scored         every deduplicated candidate with its score
 * @param matchResult    comparison with the reference document; rates are not applicable
 *                       when no reference text was given
 * @param proximity      pre-enrollment medical events
 * @param risk           aggregated investigation risk
 * @param stats          collection and deduplication counts
 */
public record CaseAnalysisResult(
        String caseId,
        LocalDate processingDate,
        List<ScoredCandidate> ranked,
        List<ScoredCandidate> scored,
        MatchResult matchResult,
        ProximityReport proximity,
        InvestigationRisk risk,
        CollectionStats stats
) {
    public CaseAnalysisResult {
        Objects.requireNonNull(caseId, "caseId is required");
        ranked = ranked != null ? List.copyOf(ranked) : List.of();
        scored = scored != null ? List.copyOf(scored) : List.of();
        Objects.requireNonNull(matchResult, "matchResult is required");
        Objects.requireNonNull(proximity, "proximity is required");
        Objects.requireNonNull(risk, "risk is required");
        Objects.requireNonNull(stats, "stats is required");
    }

    public List<LocalDate> acceptedDates() {
        return ranked.stream().map(ScoredCandidate::date).toList();
    }
}
