package com.claim.dates.cache;

import com.claim.dates.api.CaseAnalysisResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;

import static com.claim.dates.cache.CacheFixtures.result;
import static org.junit.jupiter.api.Assertions.*;

class ResultCacheTest {

    @Nested
    @DisplayName("InsertionOrderResultCache")
    class InsertionOrderTests {

        private CacheFixtures.MutableClock clock;
        private InsertionOrderResultCache cache;

        @BeforeEach
        void setUp() {
            clock = new CacheFixtures.MutableClock();
            cache = new InsertionOrderResultCache(new CacheConfig(2, 60, true), clock);
        }

        @Test
        @DisplayName("Should cache and retrieve results")
        void putAndGet() {
            cache.put("fp-1", result("case-1"));

            Optional<CaseAnalysisResult> cached = cache.get("fp-1");

            assertTrue(cached.isPresent());
            assertEquals("case-1", cached.get().caseId());
            assertEquals(1, cache.getStats().hitCount());
        }

        @Test
        @DisplayName("Should evict the oldest stored entry when full")
        void evictsOldest() {
            cache.put("fp-1", result("case-1"));
            cache.put("fp-2", result("case-2"));
            cache.get("fp-1");
            cache.put("fp-3", result("case-3"));

            assertTrue(cache.get("fp-1").isEmpty());
            assertTrue(cache.get("fp-2").isPresent());
            assertTrue(cache.get("fp-3").isPresent());
            assertEquals(1, cache.getStats().evictionCount());
            assertEquals(2, cache.getStats().size());
        }

        @Test
        @DisplayName("Re-storing a key should make it the newest and keep one entry")
        void reinsertMovesToNewest() {
            cache.put("fp-1", result("case-1"));
            cache.put("fp-2", result("case-2"));
            cache.put("fp-1", result("case-1b"));
            cache.put("fp-3", result("case-3"));

            assertEquals("case-1b", cache.get("fp-1").orElseThrow().caseId());
            assertTrue(cache.get("fp-2").isEmpty());
        }

        @Test
        @DisplayName("Expired entries should be absent and counted as misses")
        void expiry() {
            cache.put("fp-1", result("case-1"));

            clock.advance(Duration.ofSeconds(59));
            assertTrue(cache.get("fp-1").isPresent());

            clock.advance(Duration.ofSeconds(1));
            assertTrue(cache.get("fp-1").isEmpty());

            CacheStats stats = cache.getStats();
            assertEquals(1, stats.hitCount());
            assertEquals(1, stats.missCount());
            assertEquals(1, stats.evictionCount());
            assertEquals(0, stats.size());
            assertEquals(0.5, stats.hitRate(), 0.001);
        }

        @Test
        @DisplayName("Invalidation should remove entries")
        void invalidate() {
            cache.put("fp-1", result("case-1"));
            cache.put("fp-2", result("case-2"));

            cache.invalidate("fp-1");
            assertTrue(cache.get("fp-1").isEmpty());

            cache.invalidateAll();
            assertEquals(0, cache.getStats().size());
        }
    }

    @Nested
    @DisplayName("CaffeineResultCache")
    class CaffeineTests {

        @Test
        @DisplayName("Should cache, retrieve and invalidate results")
        void putGetInvalidate() {
            CaffeineResultCache cache = new CaffeineResultCache(CacheConfig.defaults());

            cache.put("fp-1", result("case-1"));
            assertEquals("case-1", cache.get("fp-1").orElseThrow().caseId());
            assertTrue(cache.get("fp-2").isEmpty());

            CacheStats stats = cache.getStats();
            assertEquals(1, stats.hitCount());
            assertEquals(1, stats.missCount());

            cache.invalidate("fp-1");
            assertTrue(cache.get("fp-1").isEmpty());
        }
    }

    @Nested
    @DisplayName("Factory")
    class FactoryTests {

        @Test
        @DisplayName("Disabled config should give a cache that stores nothing")
        void disabled() {
            ResultCache cache = ResultCache.create(CacheConfig.disabled());

            assertInstanceOf(NoOpResultCache.class, cache);
            cache.put("fp-1", result("case-1"));
            assertTrue(cache.get("fp-1").isEmpty());
            assertEquals(CacheStats.empty(), cache.getStats());
        }

        @Test
        @DisplayName("Enabled config should give an insertion-order cache")
        void enabled() {
            assertInstanceOf(InsertionOrderResultCache.class, ResultCache.create(CacheConfig.defaults()));
        }

        @Test
        @DisplayName("Config should be validated")
        void validation() {
            assertThrows(IllegalArgumentException.class, () -> new CacheConfig(0, 60, true));
            assertThrows(IllegalArgumentException.class, () -> new CacheConfig(10, 0, true));
        }
    }
}
