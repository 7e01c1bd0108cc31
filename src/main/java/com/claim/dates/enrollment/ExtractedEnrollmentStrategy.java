package com.claim.dates.enrollment;

import com.claim.dates.core.model.DateCategory;
import com.claim.dates.core.model.Importance;
import com.claim.dates.core.model.ScoredCandidate;

import java.time.LocalDate;
import java.util.Optional;

/**
 * Uses the earliest CRITICAL enrollment date found in the documents.
 */
public class ExtractedEnrollmentStrategy implements EnrollmentStrategy {

    public static final String NAME = "extracted";

    @Override
    public Optional<LocalDate> resolve(EnrollmentEvidence evidence) {
        return evidence.candidates().stream()
                .filter(s -> s.category() == DateCategory.INSURANCE_ENROLLMENT)
                .filter(s -> s.candidate().importanceOrDefault() == Importance.CRITICAL)
                .map(ScoredCandidate::date)
                .min(LocalDate::compareTo);
    }

    @Override
    public String name() {
        return NAME;
    }
}
