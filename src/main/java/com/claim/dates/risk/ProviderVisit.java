package com.claim.dates.risk;

import java.time.LocalDate;
import java.util.Objects;

/**
 * A visit to a healthcare provider, as input to the reference risk detectors.
 */
public record ProviderVisit(LocalDate date, String provider) {

    public ProviderVisit {
        Objects.requireNonNull(date, "date is required");
        if (provider == null || provider.isBlank()) {
            throw new IllegalArgumentException("provider is required");
        }
        provider = provider.trim();
    }
}
