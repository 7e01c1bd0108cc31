package com.claim.dates.enrollment;

import java.time.LocalDate;
import java.util.Optional;

/**
 * Outcome of enrollment date resolution.
 *
 * @param enrollmentDate resolved date, or null when no strategy answered
 * @param strategy       name of the strategy that answered, or null
 * @param degraded       true when a fallback strategy answered
 */
public record EnrollmentResolution(LocalDate enrollmentDate, String strategy, boolean degraded) {

    private static final EnrollmentResolution INSUFFICIENT = new EnrollmentResolution(null, null, false);

    public static EnrollmentResolution resolved(LocalDate date, String strategy, boolean degraded) {
        if (date == null || strategy == null) {
            throw new IllegalArgumentException("A resolved enrollment needs a date and a strategy");
        }
        return new EnrollmentResolution(date, strategy, degraded);
    }

    public static EnrollmentResolution insufficientData() {
        return INSUFFICIENT;
    }

    public boolean isResolved() {
        return enrollmentDate != null;
    }

    public Optional<LocalDate> getEnrollmentDate() {
        return Optional.ofNullable(enrollmentDate);
    }
}
