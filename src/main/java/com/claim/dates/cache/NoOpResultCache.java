package com.claim.dates.cache;

import com.claim.dates.api.CaseAnalysisResult;

import java.util.Optional;

/**
 * Caches nothing.
 */
public class NoOpResultCache implements ResultCache {

    @Override
    public Optional<CaseAnalysisResult> get(String fingerprint) {
        return Optional.empty();
    }

    @Override
    public void put(String fingerprint, CaseAnalysisResult result) {
    }

    @Override
    public void invalidate(String fingerprint) {
    }

    @Override
    public void invalidateAll() {
    }

    @Override
    public CacheStats getStats() {
        return CacheStats.empty();
    }
}
