package com.claim.dates.metrics;

import com.claim.dates.core.model.RiskLevel;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Micrometer-backed {@link MetricsService}. Needs {@code micrometer-core} on the classpath.
 *
 * <p>Meters:</p>
 * <ul>
 *   <li>{@code claim.analysis.duration} Timer (tag: cached)</li>
 *   <li>{@code claim.candidates.collected}, {@code claim.candidates.dropped},
 *       {@code claim.candidates.collapsed} Counters</li>
 *   <li>{@code claim.candidates.scored} Counter (tag: outcome=accepted|rejected)</li>
 *   <li>{@code claim.risk.level} Counter (tag: level)</li>
 *   <li>{@code claim.reader.retry}, {@code claim.cache.hit}, {@code claim.cache.miss} Counters</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final Timer freshTimer;
    private final Timer cachedTimer;
    private final Counter collected;
    private final Counter dropped;
    private final Counter collapsed;
    private final Counter accepted;
    private final Counter rejected;
    private final Map<RiskLevel, Counter> riskLevels = new EnumMap<>(RiskLevel.class);
    private final Counter readerRetries;
    private final Counter cacheHits;
    private final Counter cacheMisses;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.freshTimer = analysisTimer(registry, false);
        this.cachedTimer = analysisTimer(registry, true);
        this.collected = Counter.builder("claim.candidates.collected")
                .description("Date candidates that passed normalization")
                .register(registry);
        this.dropped = Counter.builder("claim.candidates.dropped")
                .description("Raw date values dropped as malformed")
                .register(registry);
        this.collapsed = Counter.builder("claim.candidates.collapsed")
                .description("Duplicate candidates collapsed into an earlier occurrence")
                .register(registry);
        this.accepted = scored(registry, "accepted");
        this.rejected = scored(registry, "rejected");
        for (RiskLevel level : RiskLevel.values()) {
            riskLevels.put(level, Counter.builder("claim.risk.level")
                    .description("Cases per investigation risk level")
                    .tag("level", level.name())
                    .register(registry));
        }
        this.readerRetries = Counter.builder("claim.reader.retry")
                .description("Document reader calls retried after a failure")
                .register(registry);
        this.cacheHits = Counter.builder("claim.cache.hit")
                .description("Analysis result cache hits")
                .register(registry);
        this.cacheMisses = Counter.builder("claim.cache.miss")
                .description("Analysis result cache misses")
                .register(registry);
    }

    private static Timer analysisTimer(MeterRegistry registry, boolean cached) {
        return Timer.builder("claim.analysis.duration")
                .description("Duration of single-case analysis")
                .tag("cached", Boolean.toString(cached))
                .register(registry);
    }

    private static Counter scored(MeterRegistry registry, String outcome) {
        return Counter.builder("claim.candidates.scored")
                .description("Scored candidates by acceptance outcome")
                .tag("outcome", outcome)
                .register(registry);
    }

    @Override
    public void recordAnalysisDuration(boolean cached, Duration duration) {
        (cached ? cachedTimer : freshTimer).record(duration);
    }

    @Override
    public void recordCandidatesCollected(int count) {
        collected.increment(count);
    }

    @Override
    public void recordCandidatesDropped(int count) {
        dropped.increment(count);
    }

    @Override
    public void recordDuplicatesCollapsed(int count) {
        collapsed.increment(count);
    }

    @Override
    public void recordScoringOutcome(int acceptedCount, int rejectedCount) {
        accepted.increment(acceptedCount);
        rejected.increment(rejectedCount);
    }

    @Override
    public void incrementRiskLevel(RiskLevel level) {
        riskLevels.get(level).increment();
    }

    @Override
    public void incrementReaderRetry() {
        readerRetries.increment();
    }

    @Override
    public void recordCacheHit() {
        cacheHits.increment();
    }

    @Override
    public void recordCacheMiss() {
        cacheMisses.increment();
    }
}
