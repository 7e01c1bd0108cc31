package com.claim.dates.evaluation;

import com.claim.dates.core.model.MatchResult;

import java.util.Collection;
import java.util.OptionalDouble;

/**
 * Pooled coverage and precision over many cases. Numerators and denominators are
 * summed across cases; per-case rates are never averaged.
 *
 * @param evaluatedCases cases with a reference document
 * @param skippedCases   cases without one
 * @param referenceTotal summed reference set sizes
 * @param extractedTotal summed extracted set sizes
 * @param matchedTotal   summed matched set sizes
 */
public record AggregateEvaluation(
        int evaluatedCases,
        int skippedCases,
        int referenceTotal,
        int extractedTotal,
        int matchedTotal
) {
    public static AggregateEvaluation empty() {
        return new AggregateEvaluation(0, 0, 0, 0, 0);
    }

    public static AggregateEvaluation of(Collection<MatchResult> results) {
        AggregateEvaluation aggregate = empty();
        for (MatchResult result : results) {
            aggregate = aggregate.plus(result);
        }
        return aggregate;
    }

    public AggregateEvaluation plus(MatchResult result) {
        if (!result.referenceAvailable()) {
            return new AggregateEvaluation(evaluatedCases, skippedCases + 1,
                    referenceTotal, extractedTotal, matchedTotal);
        }
        return new AggregateEvaluation(evaluatedCases + 1, skippedCases,
                referenceTotal + result.referenceSet().size(),
                extractedTotal + result.extractedSet().size(),
                matchedTotal + result.matched().size());
    }

    public OptionalDouble coverageRate() {
        if (referenceTotal == 0) {
            return extractedTotal == 0 ? OptionalDouble.empty() : OptionalDouble.of(100.0);
        }
        return OptionalDouble.of(matchedTotal * 100.0 / referenceTotal);
    }

    public OptionalDouble precisionRate() {
        if (extractedTotal == 0) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(matchedTotal * 100.0 / extractedTotal);
    }

    public String formattedCoverage() {
        return MatchResult.formatRate(coverageRate());
    }

    public String formattedPrecision() {
        return MatchResult.formatRate(precisionRate());
    }
}
