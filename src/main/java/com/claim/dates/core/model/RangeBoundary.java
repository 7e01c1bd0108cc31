package com.claim.dates.core.model;

import java.time.LocalDate;
import java.util.Objects;
import java.util.Optional;

/**
 * Marks a candidate as one boundary of a date range.
 *
 * @param role            whether this is the start or end boundary
 * @param insurancePeriod true when the range is labeled as an insurance period
 * @param counterpart     the other boundary's date, when it normalized successfully
 */
public record RangeBoundary(Role role, boolean insurancePeriod, LocalDate counterpart) {

    public enum Role { START, END }

    public RangeBoundary {
        Objects.requireNonNull(role, "role is required");
    }

    public Optional<LocalDate> counterpartDate() {
        return Optional.ofNullable(counterpart);
    }

    /**
     * Decides whether the boundary at {@code date} is the earlier end of its range.
     * Compares against the counterpart when known, otherwise falls back to the role.
     */
    public boolean isEarlierBoundary(LocalDate date) {
        if (counterpart != null && !counterpart.equals(date)) {
            return date.isBefore(counterpart);
        }
        return role == Role.START;
    }
}
