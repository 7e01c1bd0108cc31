package com.claim.dates.cache;

import com.claim.dates.api.CaseAnalysisResult;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;

/**
 * Caffeine-backed result cache for high-throughput use. Eviction follows Caffeine's
 * frequency-based policy rather than strict insertion order.
 */
public class CaffeineResultCache implements ResultCache {
    private static final Logger log = LoggerFactory.getLogger(CaffeineResultCache.class);

    private final Cache<String, CaseAnalysisResult> cache;

    public CaffeineResultCache(CacheConfig config) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .expireAfterWrite(Duration.ofSeconds(config.ttlSeconds()))
                .recordStats()
                .build();
        log.info("cache.initialized type=caffeine maxSize={} ttl={}s", config.maxSize(), config.ttlSeconds());
    }

    @Override
    public Optional<CaseAnalysisResult> get(String fingerprint) {
        return Optional.ofNullable(cache.getIfPresent(fingerprint));
    }

    @Override
    public void put(String fingerprint, CaseAnalysisResult result) {
        cache.put(fingerprint, result);
    }

    @Override
    public void invalidate(String fingerprint) {
        cache.invalidate(fingerprint);
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
    }

    @Override
    public CacheStats getStats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats stats = cache.stats();
        return new CacheStats(stats.hitCount(), stats.missCount(), stats.evictionCount(), cache.estimatedSize());
    }
}
