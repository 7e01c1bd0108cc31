package com.claim.dates.metrics;

import com.claim.dates.core.model.RiskLevel;

import java.time.Duration;

/**
 * Discards every measurement.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordAnalysisDuration(boolean cached, Duration duration) {
    }

    @Override
    public void recordCandidatesCollected(int count) {
    }

    @Override
    public void recordCandidatesDropped(int count) {
    }

    @Override
    public void recordDuplicatesCollapsed(int count) {
    }

    @Override
    public void recordScoringOutcome(int accepted, int rejected) {
    }

    @Override
    public void incrementRiskLevel(RiskLevel level) {
    }

    @Override
    public void incrementReaderRetry() {
    }

    @Override
    public void recordCacheHit() {
    }

    @Override
    public void recordCacheMiss() {
    }
}
