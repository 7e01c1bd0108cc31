package com.claim.dates.collect;

import com.claim.dates.core.model.DateCandidate;

import java.util.List;

/**
 * Flat candidate list produced from all batches of a case.
 *
 * @param candidates   every candidate that survived normalization, in batch order
 * @param rawCount     number of raw date values seen (range boundaries counted individually)
 * @param droppedCount number of raw values rejected as malformed or missing
 */
public record CollectionResult(List<DateCandidate> candidates, int rawCount, int droppedCount) {

    public CollectionResult {
        candidates = candidates != null ? List.copyOf(candidates) : List.of();
    }
}
