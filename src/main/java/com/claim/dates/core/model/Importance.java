package com.claim.dates.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Importance tag attached to a date candidate.
 */
public enum Importance {
    CRITICAL,
    HIGH,
    MEDIUM,
    LOW;

    /**
     * Parses an importance label case-insensitively.
     *
     * @return the importance, or empty when the label is blank or unknown
     */
    public static Optional<Importance> fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(label.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
