package com.claim.dates.collect;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * A single date from the generic or legacy sub-collection of a reader payload.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DateEntry(
        String date,
        String originalFormat,
        String context,
        String type,
        String importance,
        String confidence
) {
    public static DateEntry of(String date, String context, String type, String importance) {
        return new DateEntry(date, null, context, type, importance, null);
    }
}
