package com.claim.dates.scoring;

import com.claim.dates.core.model.DateCategory;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Point values and bounds used by the relevance scoring rules.
 * Immutable; use {@link #builder()} or {@link #defaults()}.
 */
public final class ScoringWeights {

    private final int acceptanceThreshold;
    private final int minYear;
    private final int maxYearsAhead;
    private final Map<DateCategory, Integer> typeScores;
    private final int recentDays;
    private final int recentBonus;
    private final int yearDays;
    private final int yearBonus;
    private final int fiveYearDays;
    private final int fiveYearBonus;
    private final int insuranceStartBonus;
    private final int insuranceEndPenalty;
    private final int documentMetadataPenalty;
    private final int positiveContextBonus;
    private final int negativeContextPenalty;
    private final int frequencyStep;
    private final int frequencyCap;

    private ScoringWeights(Builder builder) {
        this.acceptanceThreshold = builder.acceptanceThreshold;
        this.minYear = builder.minYear;
        this.maxYearsAhead = builder.maxYearsAhead;
        this.typeScores = Map.copyOf(builder.typeScores);
        this.recentDays = builder.recentDays;
        this.recentBonus = builder.recentBonus;
        this.yearDays = builder.yearDays;
        this.yearBonus = builder.yearBonus;
        this.fiveYearDays = builder.fiveYearDays;
        this.fiveYearBonus = builder.fiveYearBonus;
        this.insuranceStartBonus = builder.insuranceStartBonus;
        this.insuranceEndPenalty = builder.insuranceEndPenalty;
        this.documentMetadataPenalty = builder.documentMetadataPenalty;
        this.positiveContextBonus = builder.positiveContextBonus;
        this.negativeContextPenalty = builder.negativeContextPenalty;
        this.frequencyStep = builder.frequencyStep;
        this.frequencyCap = builder.frequencyCap;
    }

    public static ScoringWeights defaults() {
        return builder().build();
    }

    public int getAcceptanceThreshold() {
        return acceptanceThreshold;
    }

    public int getMinYear() {
        return minYear;
    }

    public int getMaxYearsAhead() {
        return maxYearsAhead;
    }

    /**
     * Base score for a category; categories without an entry score zero.
     */
    public int typeScore(DateCategory category) {
        return typeScores.getOrDefault(category, 0);
    }

    public int getRecentDays() {
        return recentDays;
    }

    public int getRecentBonus() {
        return recentBonus;
    }

    public int getYearDays() {
        return yearDays;
    }

    public int getYearBonus() {
        return yearBonus;
    }

    public int getFiveYearDays() {
        return fiveYearDays;
    }

    public int getFiveYearBonus() {
        return fiveYearBonus;
    }

    public int getInsuranceStartBonus() {
        return insuranceStartBonus;
    }

    /**
     * Signed delta applied on an insurance end signal (negative by default).
     */
    public int getInsuranceEndPenalty() {
        return insuranceEndPenalty;
    }

    public int getDocumentMetadataPenalty() {
        return documentMetadataPenalty;
    }

    public int getPositiveContextBonus() {
        return positiveContextBonus;
    }

    public int getNegativeContextPenalty() {
        return negativeContextPenalty;
    }

    public int getFrequencyStep() {
        return frequencyStep;
    }

    public int getFrequencyCap() {
        return frequencyCap;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(ScoringWeights weights) {
        Builder b = new Builder();
        b.acceptanceThreshold = weights.acceptanceThreshold;
        b.minYear = weights.minYear;
        b.maxYearsAhead = weights.maxYearsAhead;
        b.typeScores = new EnumMap<>(DateCategory.class);
        b.typeScores.putAll(weights.typeScores);
        b.recentDays = weights.recentDays;
        b.recentBonus = weights.recentBonus;
        b.yearDays = weights.yearDays;
        b.yearBonus = weights.yearBonus;
        b.fiveYearDays = weights.fiveYearDays;
        b.fiveYearBonus = weights.fiveYearBonus;
        b.insuranceStartBonus = weights.insuranceStartBonus;
        b.insuranceEndPenalty = weights.insuranceEndPenalty;
        b.documentMetadataPenalty = weights.documentMetadataPenalty;
        b.positiveContextBonus = weights.positiveContextBonus;
        b.negativeContextPenalty = weights.negativeContextPenalty;
        b.frequencyStep = weights.frequencyStep;
        b.frequencyCap = weights.frequencyCap;
        return b;
    }

    private static Map<DateCategory, Integer> defaultTypeScores() {
        Map<DateCategory, Integer> scores = new EnumMap<>(DateCategory.class);
        scores.put(DateCategory.SURGERY, 40);
        scores.put(DateCategory.DIAGNOSIS, 40);
        scores.put(DateCategory.ADMISSION, 35);
        scores.put(DateCategory.DISCHARGE, 35);
        scores.put(DateCategory.INSURANCE_ENROLLMENT, 30);
        scores.put(DateCategory.EXAM, 25);
        scores.put(DateCategory.OUTPATIENT_VISIT, 20);
        scores.put(DateCategory.OTHER, 10);
        scores.put(DateCategory.INSURANCE_EXPIRY, 5);
        scores.put(DateCategory.DOCUMENT_METADATA, -30);
        return scores;
    }

    public static class Builder {
        private int acceptanceThreshold = 20;
        private int minYear = 1990;
        private int maxYearsAhead = 3;
        private Map<DateCategory, Integer> typeScores = defaultTypeScores();
        private int recentDays = 90;
        private int recentBonus = 15;
        private int yearDays = 365;
        private int yearBonus = 10;
        private int fiveYearDays = 1825;
        private int fiveYearBonus = 5;
        private int insuranceStartBonus = 10;
        private int insuranceEndPenalty = -15;
        private int documentMetadataPenalty = -25;
        private int positiveContextBonus = 10;
        private int negativeContextPenalty = -10;
        private int frequencyStep = 5;
        private int frequencyCap = 15;

        public Builder acceptanceThreshold(int acceptanceThreshold) {
            this.acceptanceThreshold = acceptanceThreshold;
            return this;
        }

        public Builder minYear(int minYear) {
            this.minYear = minYear;
            return this;
        }

        public Builder maxYearsAhead(int maxYearsAhead) {
            this.maxYearsAhead = maxYearsAhead;
            return this;
        }

        public Builder typeScore(DateCategory category, int score) {
            Objects.requireNonNull(category, "category is required");
            this.typeScores.put(category, score);
            return this;
        }

        /**
         * Sets the recency tiers as day distances with their bonuses, nearest tier first.
         */
        public Builder recencyTiers(int recentDays, int recentBonus,
                                    int yearDays, int yearBonus,
                                    int fiveYearDays, int fiveYearBonus) {
            this.recentDays = recentDays;
            this.recentBonus = recentBonus;
            this.yearDays = yearDays;
            this.yearBonus = yearBonus;
            this.fiveYearDays = fiveYearDays;
            this.fiveYearBonus = fiveYearBonus;
            return this;
        }

        public Builder insuranceStartBonus(int insuranceStartBonus) {
            this.insuranceStartBonus = insuranceStartBonus;
            return this;
        }

        public Builder insuranceEndPenalty(int insuranceEndPenalty) {
            this.insuranceEndPenalty = insuranceEndPenalty;
            return this;
        }

        public Builder documentMetadataPenalty(int documentMetadataPenalty) {
            this.documentMetadataPenalty = documentMetadataPenalty;
            return this;
        }

        public Builder positiveContextBonus(int positiveContextBonus) {
            this.positiveContextBonus = positiveContextBonus;
            return this;
        }

        public Builder negativeContextPenalty(int negativeContextPenalty) {
            this.negativeContextPenalty = negativeContextPenalty;
            return this;
        }

        public Builder frequencyBonus(int step, int cap) {
            this.frequencyStep = step;
            this.frequencyCap = cap;
            return this;
        }

        public ScoringWeights build() {
            if (minYear <= 0) {
                throw new IllegalArgumentException("minYear must be positive");
            }
            if (maxYearsAhead < 0) {
                throw new IllegalArgumentException("maxYearsAhead must be >= 0");
            }
            if (recentDays < 0 || recentDays > yearDays || yearDays > fiveYearDays) {
                throw new IllegalArgumentException(
                        "Recency tiers must be non-negative and ascending: "
                                + recentDays + ", " + yearDays + ", " + fiveYearDays);
            }
            if (frequencyStep < 0 || frequencyCap < 0) {
                throw new IllegalArgumentException("Frequency step and cap must be >= 0");
            }
            return new ScoringWeights(this);
        }
    }
}
