package com.claim.dates.cache;

/**
 * Settings for the analysis result cache.
 *
 * @param maxSize    maximum number of cached results
 * @param ttlSeconds seconds a result stays valid after it was stored
 * @param enabled    whether results are cached at all
 */
public record CacheConfig(int maxSize, long ttlSeconds, boolean enabled) {

    public CacheConfig {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }
        if (ttlSeconds <= 0) {
            throw new IllegalArgumentException("ttlSeconds must be > 0");
        }
    }

    /**
     * 1,000 results kept for one hour.
     */
    public static CacheConfig defaults() {
        return new CacheConfig(1_000, 3_600, true);
    }

    public static CacheConfig disabled() {
        return new CacheConfig(1, 1, false);
    }
}
