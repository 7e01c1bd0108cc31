package com.claim.dates.core.model;

import java.time.LocalDate;
import java.util.Objects;

/**
 * A single date-like value proposed by the document reader, with its metadata.
 * Only dates that passed strict {@code YYYY-MM-DD} normalization can be represented.
 * Category and importance may be absent (untagged) until classification fills defaults.
 */
public final class DateCandidate {
    private final String rawText;
    private final LocalDate normalizedDate;
    private final int sourceBatch;
    private final CandidateSource source;
    private final DateCategory category;
    private final Importance importance;
    private final String contextSnippet;
    private final String confidenceTag;
    private final RangeBoundary rangeBoundary;

    private DateCandidate(Builder builder) {
        this.rawText = builder.rawText;
        this.normalizedDate = builder.normalizedDate;
        this.sourceBatch = builder.sourceBatch;
        this.source = builder.source != null ? builder.source : CandidateSource.GENERIC;
        this.category = builder.category;
        this.importance = builder.importance;
        this.contextSnippet = builder.contextSnippet != null ? builder.contextSnippet : "";
        this.confidenceTag = builder.confidenceTag;
        this.rangeBoundary = builder.rangeBoundary;
    }

    public String getRawText() {
        return rawText;
    }

    public LocalDate getNormalizedDate() {
        return normalizedDate;
    }

    /**
     * Canonical {@code YYYY-MM-DD} form of the date.
     */
    public String getIsoDate() {
        return normalizedDate.toString();
    }

    public int getSourceBatch() {
        return sourceBatch;
    }

    public CandidateSource getSource() {
        return source;
    }

    /**
     * Category as tagged upstream or by classification; null when untagged.
     */
    public DateCategory getCategory() {
        return category;
    }

    /**
     * Importance as tagged upstream or by classification; null when untagged.
     */
    public Importance getImportance() {
        return importance;
    }

    public DateCategory categoryOrDefault() {
        return category != null ? category : DateCategory.OTHER;
    }

    public Importance importanceOrDefault() {
        return importance != null ? importance : Importance.MEDIUM;
    }

    public boolean isTagged() {
        return category != null && importance != null;
    }

    public String getContextSnippet() {
        return contextSnippet;
    }

    public String getConfidenceTag() {
        return confidenceTag;
    }

    public RangeBoundary getRangeBoundary() {
        return rangeBoundary;
    }

    public boolean isInsurancePeriodBoundary() {
        return rangeBoundary != null && rangeBoundary.insurancePeriod();
    }

    /**
     * Returns a copy carrying the given category and importance.
     */
    public DateCandidate withClassification(DateCategory category, Importance importance) {
        return builder(this).category(category).importance(importance).build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DateCandidate that = (DateCandidate) o;
        return sourceBatch == that.sourceBatch
                && Objects.equals(rawText, that.rawText)
                && Objects.equals(normalizedDate, that.normalizedDate)
                && source == that.source
                && category == that.category
                && importance == that.importance
                && Objects.equals(contextSnippet, that.contextSnippet)
                && Objects.equals(confidenceTag, that.confidenceTag)
                && Objects.equals(rangeBoundary, that.rangeBoundary);
    }

    @Override
    public int hashCode() {
        return Objects.hash(rawText, normalizedDate, sourceBatch, source, category, importance,
                contextSnippet, confidenceTag, rangeBoundary);
    }

    @Override
    public String toString() {
        return "DateCandidate{" +
                "date=" + normalizedDate +
                ", batch=" + sourceBatch +
                ", source=" + source +
                ", category=" + category +
                ", importance=" + importance +
                ", context='" + contextSnippet + '\'' +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(DateCandidate candidate) {
        return new Builder()
                .rawText(candidate.rawText)
                .normalizedDate(candidate.normalizedDate)
                .sourceBatch(candidate.sourceBatch)
                .source(candidate.source)
                .category(candidate.category)
                .importance(candidate.importance)
                .contextSnippet(candidate.contextSnippet)
                .confidenceTag(candidate.confidenceTag)
                .rangeBoundary(candidate.rangeBoundary);
    }

    public static class Builder {
        private String rawText;
        private LocalDate normalizedDate;
        private int sourceBatch;
        private CandidateSource source;
        private DateCategory category;
        private Importance importance;
        private String contextSnippet;
        private String confidenceTag;
        private RangeBoundary rangeBoundary;

        public Builder rawText(String rawText) {
            this.rawText = rawText;
            return this;
        }

        public Builder normalizedDate(LocalDate normalizedDate) {
            this.normalizedDate = normalizedDate;
            return this;
        }

        public Builder sourceBatch(int sourceBatch) {
            this.sourceBatch = sourceBatch;
            return this;
        }

        public Builder source(CandidateSource source) {
            this.source = source;
            return this;
        }

        public Builder category(DateCategory category) {
            this.category = category;
            return this;
        }

        public Builder importance(Importance importance) {
            this.importance = importance;
            return this;
        }

        public Builder contextSnippet(String contextSnippet) {
            this.contextSnippet = contextSnippet;
            return this;
        }

        public Builder confidenceTag(String confidenceTag) {
            this.confidenceTag = confidenceTag;
            return this;
        }

        public Builder rangeBoundary(RangeBoundary rangeBoundary) {
            this.rangeBoundary = rangeBoundary;
            return this;
        }

        public DateCandidate build() {
            Objects.requireNonNull(normalizedDate, "normalizedDate is required");
            if (rawText == null) {
                rawText = normalizedDate.toString();
            }
            return new DateCandidate(this);
        }
    }
}
