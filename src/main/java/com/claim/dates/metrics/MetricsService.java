package com.claim.dates.metrics;

import com.claim.dates.core.model.RiskLevel;

import java.time.Duration;

/**
 * Records claim-date analysis metrics.
 * {@link NoOpMetricsService} is the default so the library runs without a
 * metrics backend on the classpath.
 */
public interface MetricsService {

    void recordAnalysisDuration(boolean cached, Duration duration);

    void recordCandidatesCollected(int count);

    void recordCandidatesDropped(int count);

    void recordDuplicatesCollapsed(int count);

    void recordScoringOutcome(int accepted, int rejected);

    void incrementRiskLevel(RiskLevel level);

    void incrementReaderRetry();

    void recordCacheHit();

    void recordCacheMiss();
}
