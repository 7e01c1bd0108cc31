package com.claim.dates.enrollment;

import java.time.LocalDate;
import java.util.Optional;

/**
 * One way of determining a case's insurance enrollment date.
 */
public interface EnrollmentStrategy {

    /**
     * @return the enrollment date, or empty when this strategy has nothing to offer
     */
    Optional<LocalDate> resolve(EnrollmentEvidence evidence);

    String name();
}
