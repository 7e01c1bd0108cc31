package com.claim.dates.classify;

import com.claim.dates.core.model.DateCandidate;
import com.claim.dates.core.model.DateCategory;
import com.claim.dates.core.model.Importance;
import com.claim.dates.core.model.RangeBoundary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Finalizes category and importance of deduplicated candidates.
 *
 * <p>Boundaries of an insurance period are overridden regardless of upstream tags:
 * the earlier boundary is the enrollment date (CRITICAL), the later one the expiry
 * date (LOW). Untagged candidates default to OTHER / MEDIUM.</p>
 */
public class RoleClassifier {
    private static final Logger log = LoggerFactory.getLogger(RoleClassifier.class);

    public List<DateCandidate> classify(List<DateCandidate> candidates) {
        return candidates.stream().map(this::classify).toList();
    }

    public DateCandidate classify(DateCandidate candidate) {
        RangeBoundary boundary = candidate.getRangeBoundary();
        if (boundary != null && boundary.insurancePeriod()) {
            boolean earlier = boundary.isEarlierBoundary(candidate.getNormalizedDate());
            DateCandidate overridden = earlier
                    ? candidate.withClassification(DateCategory.INSURANCE_ENROLLMENT, Importance.CRITICAL)
                    : candidate.withClassification(DateCategory.INSURANCE_EXPIRY, Importance.LOW);
            log.debug("classify.insurance-period date={} role={} importance={}",
                    candidate.getIsoDate(), overridden.getCategory(), overridden.getImportance());
            return overridden;
        }
        if (candidate.isTagged()) {
            return candidate;
        }
        return candidate.withClassification(candidate.categoryOrDefault(), candidate.importanceOrDefault());
    }
}
