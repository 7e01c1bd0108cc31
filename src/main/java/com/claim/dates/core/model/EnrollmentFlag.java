package com.claim.dates.core.model;

import java.util.Objects;

/**
 * A medical event preceding the enrollment date, with its distance bucket.
 */
public record EnrollmentFlag(ScoredCandidate candidate, long daysBeforeEnrollment, ProximityBucket bucket) {

    public EnrollmentFlag {
        Objects.requireNonNull(candidate, "candidate is required");
        Objects.requireNonNull(bucket, "bucket is required");
        if (daysBeforeEnrollment <= 0) {
            throw new IllegalArgumentException("Only events strictly before enrollment can be flagged");
        }
    }
}
