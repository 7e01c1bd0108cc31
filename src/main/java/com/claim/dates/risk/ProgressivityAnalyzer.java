package com.claim.dates.risk;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Collection;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Judges whether a condition is long-running from the spread and density of visits.
 * Fewer than two visit dates is inconclusive; a span over {@code chronicSpanDays} or
 * at least {@code chronicVisitsPerMonth} visits per 30 days is progressive/chronic.
 */
public class ProgressivityAnalyzer {

    private final int chronicSpanDays;
    private final double chronicVisitsPerMonth;

    public ProgressivityAnalyzer() {
        this(90, 2.0);
    }

    public ProgressivityAnalyzer(int chronicSpanDays, double chronicVisitsPerMonth) {
        if (chronicSpanDays <= 0 || chronicVisitsPerMonth <= 0) {
            throw new IllegalArgumentException("Progressivity thresholds must be positive");
        }
        this.chronicSpanDays = chronicSpanDays;
        this.chronicVisitsPerMonth = chronicVisitsPerMonth;
    }

    public ProgressivityClassification classify(Collection<LocalDate> visitDates) {
        if (visitDates == null) {
            return ProgressivityClassification.INCONCLUSIVE;
        }
        TreeSet<LocalDate> dates = new TreeSet<>();
        visitDates.stream().filter(Objects::nonNull).forEach(dates::add);
        if (dates.size() < 2) {
            return ProgressivityClassification.INCONCLUSIVE;
        }
        long span = ChronoUnit.DAYS.between(dates.first(), dates.last());
        if (span > chronicSpanDays) {
            return ProgressivityClassification.PROGRESSIVE_CHRONIC;
        }
        // spans under a month count as one month
        double months = Math.max(1.0, span / 30.0);
        return dates.size() / months >= chronicVisitsPerMonth
                ? ProgressivityClassification.PROGRESSIVE_CHRONIC
                : ProgressivityClassification.TEMPORARY;
    }
}
