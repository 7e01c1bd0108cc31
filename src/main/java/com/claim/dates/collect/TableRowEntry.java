package com.claim.dates.collect;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * A date read from a table row (e.g. a visit history table).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TableRowEntry(
        String date,
        String rowContent,
        String tableType,
        String importance,
        String confidence
) {
    public static TableRowEntry of(String date, String rowContent, String tableType) {
        return new TableRowEntry(date, rowContent, tableType, null, null);
    }
}
