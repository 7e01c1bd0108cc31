package com.claim.dates.enrollment;

import java.time.LocalDate;
import java.util.Optional;

/**
 * Falls back to the enrollment date supplied with the case.
 */
public class SuppliedEnrollmentStrategy implements EnrollmentStrategy {

    public static final String NAME = "supplied";

    @Override
    public Optional<LocalDate> resolve(EnrollmentEvidence evidence) {
        return evidence.getSuppliedDate();
    }

    @Override
    public String name() {
        return NAME;
    }
}
