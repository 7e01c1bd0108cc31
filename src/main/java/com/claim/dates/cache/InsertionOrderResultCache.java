package com.claim.dates.cache;

import com.claim.dates.api.CaseAnalysisResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Bounded result cache that evicts the oldest stored entry when full.
 * Expiry is checked lazily when an entry is read.
 */
public class InsertionOrderResultCache implements ResultCache {
    private static final Logger log = LoggerFactory.getLogger(InsertionOrderResultCache.class);

    private final int maxSize;
    private final Duration ttl;
    private final Clock clock;
    private final LinkedHashMap<String, Entry> entries = new LinkedHashMap<>();
    private long hits;
    private long misses;
    private long evictions;

    public InsertionOrderResultCache(CacheConfig config) {
        this(config, Clock.systemUTC());
    }

    public InsertionOrderResultCache(CacheConfig config, Clock clock) {
        this.maxSize = config.maxSize();
        this.ttl = Duration.ofSeconds(config.ttlSeconds());
        this.clock = clock;
        log.info("cache.initialized type=insertion-order maxSize={} ttl={}s", maxSize, config.ttlSeconds());
    }

    @Override
    public synchronized Optional<CaseAnalysisResult> get(String fingerprint) {
        Entry entry = entries.get(fingerprint);
        if (entry == null) {
            misses++;
            return Optional.empty();
        }
        if (!clock.instant().isBefore(entry.expiresAt())) {
            entries.remove(fingerprint);
            evictions++;
            misses++;
            log.debug("cache.expired key={}", fingerprint);
            return Optional.empty();
        }
        hits++;
        return Optional.of(entry.result());
    }

    @Override
    public synchronized void put(String fingerprint, CaseAnalysisResult result) {
        // re-inserting moves the key to the newest position
        entries.remove(fingerprint);
        entries.put(fingerprint, new Entry(result, clock.instant().plus(ttl)));
        Iterator<Map.Entry<String, Entry>> oldest = entries.entrySet().iterator();
        while (entries.size() > maxSize && oldest.hasNext()) {
            String evicted = oldest.next().getKey();
            oldest.remove();
            evictions++;
            log.debug("cache.evicted key={}", evicted);
        }
    }

    @Override
    public synchronized void invalidate(String fingerprint) {
        entries.remove(fingerprint);
    }

    @Override
    public synchronized void invalidateAll() {
        entries.clear();
    }

    @Override
    public synchronized CacheStats getStats() {
        return new CacheStats(hits, misses, evictions, entries.size());
    }

    private record Entry(CaseAnalysisResult result, Instant expiresAt) {}
}
