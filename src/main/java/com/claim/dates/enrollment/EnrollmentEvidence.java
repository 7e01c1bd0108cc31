package com.claim.dates.enrollment;

import com.claim.dates.core.model.ScoredCandidate;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * What enrollment strategies may look at: the case's scored candidates and an
 * optional externally supplied enrollment date.
 */
public record EnrollmentEvidence(List<ScoredCandidate> candidates, LocalDate suppliedDate) {

    public EnrollmentEvidence {
        candidates = candidates != null ? List.copyOf(candidates) : List.of();
    }

    public Optional<LocalDate> getSuppliedDate() {
        return Optional.ofNullable(suppliedDate);
    }
}
