package com.claim.dates.enrollment;

import com.claim.dates.core.model.EnrollmentFlag;
import com.claim.dates.core.model.ProximityBucket;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Medical events preceding enrollment, grouped by proximity bucket.
 */
public record ProximityReport(
        Status status,
        EnrollmentResolution resolution,
        List<EnrollmentFlag> flags,
        Map<ProximityBucket, Integer> bucketCounts
) {
    public enum Status {
        FLAGGED,
        INSUFFICIENT_DATA
    }

    public ProximityReport {
        flags = flags != null ? List.copyOf(flags) : List.of();
        Map<ProximityBucket, Integer> counts = new EnumMap<>(ProximityBucket.class);
        for (ProximityBucket bucket : ProximityBucket.values()) {
            counts.put(bucket, bucketCounts != null ? bucketCounts.getOrDefault(bucket, 0) : 0);
        }
        bucketCounts = Collections.unmodifiableMap(counts);
    }

    public static ProximityReport insufficientData() {
        return new ProximityReport(Status.INSUFFICIENT_DATA, EnrollmentResolution.insufficientData(),
                List.of(), Map.of());
    }

    public int countIn(ProximityBucket bucket) {
        return bucketCounts.get(bucket);
    }

    public boolean isInsufficientData() {
        return status == Status.INSUFFICIENT_DATA;
    }
}
