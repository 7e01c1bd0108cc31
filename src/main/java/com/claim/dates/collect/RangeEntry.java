package com.claim.dates.collect;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * A start/end date pair, e.g. a hospitalization stay or an insurance period.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RangeEntry(
        String startDate,
        String endDate,
        String context,
        String type,
        String importance,
        String confidence
) {
    public static RangeEntry of(String startDate, String endDate, String context, String type) {
        return new RangeEntry(startDate, endDate, context, type, null, null);
    }
}
