package com.claim.dates.dedup;

import com.claim.dates.core.model.DateCandidate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collapses candidates sharing a normalized date.
 * The key is the date alone; category plays no part. The first occurrence keeps its
 * metadata, later ones only increment the shared frequency counter.
 */
public class CandidateDeduplicator {
    private static final Logger log = LoggerFactory.getLogger(CandidateDeduplicator.class);

    public DeduplicatedCandidates deduplicate(List<DateCandidate> candidates) {
        Map<LocalDate, DateCandidate> firstSeen = new LinkedHashMap<>();
        Map<LocalDate, Integer> frequencies = new LinkedHashMap<>();

        for (DateCandidate candidate : candidates) {
            LocalDate key = candidate.getNormalizedDate();
            firstSeen.putIfAbsent(key, candidate);
            frequencies.merge(key, 1, Integer::sum);
        }

        DeduplicatedCandidates result = new DeduplicatedCandidates(
                new ArrayList<>(firstSeen.values()), frequencies, candidates.size());
        log.debug("dedup.completed raw={} unique={} collapsed={}",
                result.rawCount(), result.retained().size(), result.collapsedCount());
        return result;
    }
}
