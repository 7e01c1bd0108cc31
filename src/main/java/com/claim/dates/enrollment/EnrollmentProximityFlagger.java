package com.claim.dates.enrollment;

import com.claim.dates.core.model.EnrollmentFlag;
import com.claim.dates.core.model.ProximityBucket;
import com.claim.dates.core.model.ScoredCandidate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Flags medical events that happened before the insurance enrollment date.
 * Events on or after enrollment are never flagged.
 */
public class EnrollmentProximityFlagger {
    private static final Logger log = LoggerFactory.getLogger(EnrollmentProximityFlagger.class);

    private final ProximityThresholds thresholds;

    public EnrollmentProximityFlagger() {
        this(ProximityThresholds.defaults());
    }

    public EnrollmentProximityFlagger(ProximityThresholds thresholds) {
        this.thresholds = thresholds;
    }

    public ProximityReport flag(List<ScoredCandidate> candidates, EnrollmentResolution resolution) {
        if (!resolution.isResolved()) {
            log.info("proximity.skipped reason=no-enrollment-date");
            return ProximityReport.insufficientData();
        }
        LocalDate enrollment = resolution.enrollmentDate();
        List<EnrollmentFlag> flags = new ArrayList<>();
        Map<ProximityBucket, Integer> counts = new EnumMap<>(ProximityBucket.class);

        for (ScoredCandidate scored : candidates) {
            if (!scored.category().isMedicalEvent()) {
                continue;
            }
            long daysBefore = ChronoUnit.DAYS.between(scored.date(), enrollment);
            if (daysBefore <= 0) {
                continue;
            }
            ProximityBucket bucket = thresholds.bucketFor(daysBefore);
            flags.add(new EnrollmentFlag(scored, daysBefore, bucket));
            counts.merge(bucket, 1, Integer::sum);
        }
        flags.sort(Comparator.comparing((EnrollmentFlag f) -> f.candidate().date()));

        log.debug("proximity.flagged enrollment={} flags={} within3Months={}",
                enrollment, flags.size(), counts.getOrDefault(ProximityBucket.WITHIN_3_MONTHS_BEFORE, 0));
        return new ProximityReport(ProximityReport.Status.FLAGGED, resolution, flags, counts);
    }
}
