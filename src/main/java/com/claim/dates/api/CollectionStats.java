package com.claim.dates.api;

/**
 * Counts from the collection and deduplication stages of one case.
 *
 * @param rawValues  date values seen in the payloads (a range counts twice)
 * @param collected  values that normalized to a valid date
 * @param dropped    values discarded as malformed
 * @param unique     distinct dates after deduplication
 * @param collapsed  duplicates merged into an earlier occurrence
 */
public record CollectionStats(int rawValues, int collected, int dropped, int unique, int collapsed) {
}
