package com.claim.dates.core.model;

import java.time.LocalDate;
import java.util.Collection;
import java.util.Collections;
import java.util.Locale;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Result of comparing a case's extracted dates with its reference (ground-truth) dates.
 * {@code matched}, {@code missed} and {@code extra} partition the union of both sets.
 * Rates are percentages and are empty where the comparison is not applicable.
 */
public record MatchResult(
        boolean referenceAvailable,
        SortedSet<LocalDate> referenceSet,
        SortedSet<LocalDate> extractedSet,
        SortedSet<LocalDate> matched,
        SortedSet<LocalDate> missed,
        SortedSet<LocalDate> extra
) {
    public MatchResult {
        referenceSet = frozen(referenceSet);
        extractedSet = frozen(extractedSet);
        matched = frozen(matched);
        missed = frozen(missed);
        extra = frozen(extra);
    }

    /**
     * Compares reference and extracted dates with set semantics.
     */
    public static MatchResult of(Collection<LocalDate> reference, Collection<LocalDate> extracted) {
        Objects.requireNonNull(reference, "reference is required");
        Objects.requireNonNull(extracted, "extracted is required");
        SortedSet<LocalDate> referenceSet = new TreeSet<>(reference);
        SortedSet<LocalDate> extractedSet = new TreeSet<>(extracted);

        SortedSet<LocalDate> matched = new TreeSet<>(referenceSet);
        matched.retainAll(extractedSet);
        SortedSet<LocalDate> missed = new TreeSet<>(referenceSet);
        missed.removeAll(extractedSet);
        SortedSet<LocalDate> extra = new TreeSet<>(extractedSet);
        extra.removeAll(referenceSet);

        return new MatchResult(true, referenceSet, extractedSet, matched, missed, extra);
    }

    /**
     * Creates a result for a case whose reference document is unavailable.
     * Every extracted date is neither matched nor extra; both rates are not applicable.
     */
    public static MatchResult referenceUnavailable(Collection<LocalDate> extracted) {
        return new MatchResult(false, new TreeSet<>(), new TreeSet<>(extracted),
                new TreeSet<>(), new TreeSet<>(), new TreeSet<>());
    }

    /**
     * |matched| / |reference| as a percentage. 100 when the reference is empty but
     * something was extracted; empty when the reference is unavailable or both sets are empty.
     */
    public OptionalDouble coverageRate() {
        if (!referenceAvailable) {
            return OptionalDouble.empty();
        }
        if (referenceSet.isEmpty()) {
            return extractedSet.isEmpty() ? OptionalDouble.empty() : OptionalDouble.of(100.0);
        }
        return OptionalDouble.of(matched.size() * 100.0 / referenceSet.size());
    }

    /**
     * |matched| / |extracted| as a percentage; empty when nothing was extracted
     * or the reference is unavailable.
     */
    public OptionalDouble precisionRate() {
        if (!referenceAvailable || extractedSet.isEmpty()) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(matched.size() * 100.0 / extractedSet.size());
    }

    public String formattedCoverage() {
        return formatRate(coverageRate());
    }

    public String formattedPrecision() {
        return formatRate(precisionRate());
    }

    public static String formatRate(OptionalDouble rate) {
        return rate.isPresent() ? String.format(Locale.ROOT, "%.1f%%", rate.getAsDouble()) : "N/A";
    }

    private static SortedSet<LocalDate> frozen(SortedSet<LocalDate> set) {
        return Collections.unmodifiableSortedSet(set != null ? new TreeSet<>(set) : new TreeSet<>());
    }

    @Override
    public String toString() {
        return "MatchResult{reference=" + referenceSet.size() +
                ", extracted=" + extractedSet.size() +
                ", matched=" + matched.size() +
                ", missed=" + missed.size() +
                ", extra=" + extra.size() +
                ", coverage=" + formattedCoverage() +
                ", precision=" + formattedPrecision() + '}';
    }
}
