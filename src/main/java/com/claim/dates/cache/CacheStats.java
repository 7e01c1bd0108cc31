package com.claim.dates.cache;

/**
 * Counters of a result cache.
 *
 * @param hitCount      lookups answered from the cache
 * @param missCount     lookups not answered, expired entries included
 * @param evictionCount entries removed for capacity or expiry
 * @param size          entries currently held
 */
public record CacheStats(long hitCount, long missCount, long evictionCount, long size) {

    /**
     * Hit ratio between 0.0 and 1.0; zero before the first lookup.
     */
    public double hitRate() {
        long lookups = hitCount + missCount;
        return lookups == 0 ? 0.0 : (double) hitCount / lookups;
    }

    public static CacheStats empty() {
        return new CacheStats(0, 0, 0, 0);
    }
}
