package com.claim.dates.collect;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Structured output of one reader call over a batch of pages.
 * Any sub-collection may be missing, and null entries inside one are skipped.
 * {@code dates} is the legacy single-collection form, also read from {@code allDates}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record BatchPayload(
        List<DateEntry> allExtractedDates,
        List<RangeEntry> dateRanges,
        List<InsuranceEntry> insuranceDates,
        List<TableRowEntry> tableDates,
        @JsonAlias("allDates") List<DateEntry> dates
) {
    public BatchPayload {
        allExtractedDates = entries(allExtractedDates);
        dateRanges = entries(dateRanges);
        insuranceDates = entries(insuranceDates);
        tableDates = entries(tableDates);
        dates = entries(dates);
    }

    private static <T> List<T> entries(List<T> values) {
        return values != null ? values.stream().filter(Objects::nonNull).toList() : List.of();
    }

    public static BatchPayload empty() {
        return new BatchPayload(null, null, null, null, null);
    }

    /**
     * Number of raw date values in this payload (a range counts twice).
     */
    public int rawValueCount() {
        return allExtractedDates.size() + dateRanges.size() * 2 + insuranceDates.size()
                + tableDates.size() + dates.size();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final ArrayList<DateEntry> allExtractedDates = new ArrayList<>();
        private final ArrayList<RangeEntry> dateRanges = new ArrayList<>();
        private final ArrayList<InsuranceEntry> insuranceDates = new ArrayList<>();
        private final ArrayList<TableRowEntry> tableDates = new ArrayList<>();
        private final ArrayList<DateEntry> dates = new ArrayList<>();

        public Builder date(DateEntry entry) {
            allExtractedDates.add(entry);
            return this;
        }

        public Builder range(RangeEntry entry) {
            dateRanges.add(entry);
            return this;
        }

        public Builder insurance(InsuranceEntry entry) {
            insuranceDates.add(entry);
            return this;
        }

        public Builder tableRow(TableRowEntry entry) {
            tableDates.add(entry);
            return this;
        }

        public Builder legacy(DateEntry entry) {
            dates.add(entry);
            return this;
        }

        public BatchPayload build() {
            return new BatchPayload(allExtractedDates, dateRanges, insuranceDates, tableDates, dates);
        }
    }
}
