package com.claim.dates.cache;

import com.claim.dates.api.CaseAnalysisResult;

import java.util.Optional;

/**
 * Cache of analysis results keyed by a case fingerprint (see {@link CaseFingerprint}).
 * Holds at most one result per key. Implementations must be thread-safe.
 */
public interface ResultCache {

    /**
     * @return the cached result, or empty when absent or expired
     */
    Optional<CaseAnalysisResult> get(String fingerprint);

    /**
     * Stores a result, replacing any previous result for the same key.
     */
    void put(String fingerprint, CaseAnalysisResult result);

    void invalidate(String fingerprint);

    void invalidateAll();

    CacheStats getStats();

    /**
     * Cache for the given settings: an {@link InsertionOrderResultCache} when enabled,
     * otherwise a {@link NoOpResultCache}.
     */
    static ResultCache create(CacheConfig config) {
        return config.enabled() ? new InsertionOrderResultCache(config) : new NoOpResultCache();
    }
}
