package com.claim.dates.dedup;

import com.claim.dates.core.model.DateCandidate;

import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One retained candidate per distinct date, plus how often each date occurred.
 *
 * @param retained    first occurrence of every distinct date, in first-seen order
 * @param frequencies occurrences per date across all sub-collections and batches
 * @param rawCount    number of candidates before deduplication
 */
public record DeduplicatedCandidates(
        List<DateCandidate> retained,
        Map<LocalDate, Integer> frequencies,
        int rawCount
) {
    public DeduplicatedCandidates {
        retained = retained != null ? List.copyOf(retained) : List.of();
        frequencies = frequencies != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(frequencies)) : Map.of();
    }

    public int frequencyOf(LocalDate date) {
        return frequencies.getOrDefault(date, 0);
    }

    public int collapsedCount() {
        return rawCount - retained.size();
    }
}
