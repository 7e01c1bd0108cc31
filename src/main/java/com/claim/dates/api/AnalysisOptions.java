package com.claim.dates.api;

import com.claim.dates.enrollment.ProximityThresholds;
import com.claim.dates.risk.RiskWeights;
import com.claim.dates.scoring.ScoringWeights;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Objects;

/**
 * Options for claim-date analysis: scoring weights and threshold, year window,
 * proximity buckets, risk weights and the source of the processing date.
 */
public class AnalysisOptions {

    private static final long DEFAULT_ASYNC_TIMEOUT_MS = 30_000;

    private final ScoringWeights scoringWeights;
    private final ProximityThresholds proximityThresholds;
    private final RiskWeights riskWeights;
    private final Clock clock;
    private final long asyncTimeoutMs;

    private AnalysisOptions(Builder builder) {
        this.scoringWeights = builder.scoringWeights;
        this.proximityThresholds = builder.proximityThresholds;
        this.riskWeights = builder.riskWeights;
        this.clock = builder.clock;
        this.asyncTimeoutMs = builder.asyncTimeoutMs;
    }

    public ScoringWeights getScoringWeights() {
        return scoringWeights;
    }

    public ProximityThresholds getProximityThresholds() {
        return proximityThresholds;
    }

    public RiskWeights getRiskWeights() {
        return riskWeights;
    }

    public Clock getClock() {
        return clock;
    }

    /**
     * Today's date according to the configured clock.
     */
    public LocalDate processingDate() {
        return LocalDate.now(clock);
    }

    public long getAsyncTimeoutMs() {
        return asyncTimeoutMs;
    }

    public static AnalysisOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private ScoringWeights scoringWeights = ScoringWeights.defaults();
        private ProximityThresholds proximityThresholds = ProximityThresholds.defaults();
        private RiskWeights riskWeights = RiskWeights.defaults();
        private Clock clock = Clock.systemDefaultZone();
        private long asyncTimeoutMs = DEFAULT_ASYNC_TIMEOUT_MS;

        public Builder scoringWeights(ScoringWeights scoringWeights) {
            this.scoringWeights = Objects.requireNonNull(scoringWeights, "scoringWeights");
            return this;
        }

        public Builder acceptanceThreshold(int threshold) {
            this.scoringWeights = ScoringWeights.builder(scoringWeights).acceptanceThreshold(threshold).build();
            return this;
        }

        /**
         * Dates before {@code minYear} or more than {@code maxYearsAhead} years after the
         * processing year are rejected.
         */
        public Builder yearWindow(int minYear, int maxYearsAhead) {
            this.scoringWeights = ScoringWeights.builder(scoringWeights)
                    .minYear(minYear)
                    .maxYearsAhead(maxYearsAhead)
                    .build();
            return this;
        }

        public Builder proximityThresholds(ProximityThresholds proximityThresholds) {
            this.proximityThresholds = Objects.requireNonNull(proximityThresholds, "proximityThresholds");
            return this;
        }

        public Builder riskWeights(RiskWeights riskWeights) {
            this.riskWeights = Objects.requireNonNull(riskWeights, "riskWeights");
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        /**
         * Pins the processing date, making repeated runs reproducible.
         */
        public Builder processingDate(LocalDate date) {
            this.clock = Clock.fixed(date.atStartOfDay(ZoneOffset.UTC).toInstant(), ZoneOffset.UTC);
            return this;
        }

        public Builder asyncTimeoutMs(long asyncTimeoutMs) {
            if (asyncTimeoutMs <= 0) {
                throw new IllegalArgumentException("asyncTimeoutMs must be positive");
            }
            this.asyncTimeoutMs = asyncTimeoutMs;
            return this;
        }

        public AnalysisOptions build() {
            return new AnalysisOptions(this);
        }
    }

    @Override
    public String toString() {
        return "AnalysisOptions{" +
                "acceptanceThreshold=" + scoringWeights.getAcceptanceThreshold() +
                ", minYear=" + scoringWeights.getMinYear() +
                ", maxYearsAhead=" + scoringWeights.getMaxYearsAhead() +
                ", proximityThresholds=" + proximityThresholds +
                ", riskWeights=" + riskWeights +
                ", asyncTimeoutMs=" + asyncTimeoutMs +
                '}';
    }
}
