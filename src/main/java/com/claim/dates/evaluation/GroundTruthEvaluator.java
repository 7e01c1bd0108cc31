package com.claim.dates.evaluation;

import com.claim.dates.core.model.MatchResult;
import com.claim.dates.core.model.ScoredCandidate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;

/**
 * Compares extracted dates against the dates of a reference document.
 */
public class GroundTruthEvaluator {
    private static final Logger log = LoggerFactory.getLogger(GroundTruthEvaluator.class);

    private final ReferenceDateExtractor extractor;

    public GroundTruthEvaluator() {
        this(new ReferenceDateExtractor());
    }

    public GroundTruthEvaluator(ReferenceDateExtractor extractor) {
        this.extractor = extractor;
    }

    public MatchResult evaluate(Collection<LocalDate> reference, Collection<LocalDate> extracted) {
        MatchResult result = MatchResult.of(reference, extracted);
        log.debug("evaluation.completed matched={} missed={} extra={} coverage={} precision={}",
                result.matched().size(), result.missed().size(), result.extra().size(),
                result.formattedCoverage(), result.formattedPrecision());
        return result;
    }

    /**
     * Evaluates accepted candidates against reference text.
     *
     * @param referenceText plain reference text, or null when the reference is unavailable
     */
    public MatchResult evaluate(String referenceText, List<ScoredCandidate> accepted) {
        List<LocalDate> extracted = accepted.stream().map(ScoredCandidate::date).toList();
        if (referenceText == null) {
            log.debug("evaluation.skipped reason=reference-unavailable");
            return MatchResult.referenceUnavailable(extracted);
        }
        return evaluate(extractor.extract(referenceText), extracted);
    }
}
