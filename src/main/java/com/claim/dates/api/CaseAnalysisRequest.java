package com.claim.dates.api;

import com.claim.dates.collect.BatchPayload;
import com.claim.dates.risk.ProviderVisit;
import com.claim.dates.risk.RiskSignals;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Everything known about one claim case before analysis.
 */
public final class CaseAnalysisRequest {

    private final String caseId;
    private final List<BatchPayload> batches;
    private final String referenceText;
    private final LocalDate claimDate;
    private final LocalDate suppliedEnrollmentDate;
    private final RiskSignals riskSignals;
    private final List<ProviderVisit> providerVisits;

    private CaseAnalysisRequest(Builder builder) {
        this.caseId = builder.caseId;
        this.batches = Collections.unmodifiableList(new ArrayList<>(builder.batches));
        this.referenceText = builder.referenceText;
        this.claimDate = builder.claimDate;
        this.suppliedEnrollmentDate = builder.suppliedEnrollmentDate;
        this.riskSignals = builder.riskSignals != null ? builder.riskSignals : RiskSignals.none();
        this.providerVisits = List.copyOf(builder.providerVisits);
    }

    public String getCaseId() {
        return caseId;
    }

    /**
     * Batch payloads in page order; a {@code null} entry is a batch the reader returned nothing for.
     */
    public List<BatchPayload> getBatches() {
        return batches;
    }

    /**
     * Plain text of the reference (ground-truth) document, when one exists.
     */
    public Optional<String> getReferenceText() {
        return Optional.ofNullable(referenceText);
    }

    public Optional<LocalDate> getClaimDate() {
        return Optional.ofNullable(claimDate);
    }

    public Optional<LocalDate> getSuppliedEnrollmentDate() {
        return Optional.ofNullable(suppliedEnrollmentDate);
    }

    public RiskSignals getRiskSignals() {
        return riskSignals;
    }

    /**
     * Visit history used to derive doctor-shopping and progressivity signals the
     * caller did not supply.
     */
    public List<ProviderVisit> getProviderVisits() {
        return providerVisits;
    }

    /**
     * Copy of this request carrying the given batches.
     */
    public CaseAnalysisRequest withBatches(List<BatchPayload> newBatches) {
        return builder(this).batches(newBatches).build();
    }

    @Override
    public String toString() {
        return "CaseAnalysisRequest{caseId='" + caseId + '\'' +
                ", batches=" + batches.size() +
                ", reference=" + (referenceText != null) +
                ", claimDate=" + claimDate +
                ", suppliedEnrollmentDate=" + suppliedEnrollmentDate + '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(CaseAnalysisRequest request) {
        return new Builder()
                .caseId(request.caseId)
                .batches(request.batches)
                .referenceText(request.referenceText)
                .claimDate(request.claimDate)
                .suppliedEnrollmentDate(request.suppliedEnrollmentDate)
                .riskSignals(request.riskSignals)
                .providerVisits(request.providerVisits);
    }

    public static class Builder {
        private String caseId;
        private List<BatchPayload> batches = new ArrayList<>();
        private String referenceText;
        private LocalDate claimDate;
        private LocalDate suppliedEnrollmentDate;
        private RiskSignals riskSignals;
        private List<ProviderVisit> providerVisits = new ArrayList<>();

        public Builder caseId(String caseId) {
            this.caseId = caseId;
            return this;
        }

        public Builder batches(List<BatchPayload> batches) {
            this.batches = new ArrayList<>(batches != null ? batches : List.of());
            return this;
        }

        public Builder batch(BatchPayload batch) {
            this.batches.add(batch);
            return this;
        }

        public Builder referenceText(String referenceText) {
            this.referenceText = referenceText;
            return this;
        }

        public Builder claimDate(LocalDate claimDate) {
            this.claimDate = claimDate;
            return this;
        }

        public Builder suppliedEnrollmentDate(LocalDate suppliedEnrollmentDate) {
            this.suppliedEnrollmentDate = suppliedEnrollmentDate;
            return this;
        }

        public Builder riskSignals(RiskSignals riskSignals) {
            this.riskSignals = riskSignals;
            return this;
        }

        public Builder providerVisits(List<ProviderVisit> providerVisits) {
            this.providerVisits = new ArrayList<>(providerVisits != null ? providerVisits : List.of());
            return this;
        }

        public CaseAnalysisRequest build() {
            if (caseId == null || caseId.isBlank()) {
                throw new IllegalArgumentException("caseId is required");
            }
            return new CaseAnalysisRequest(this);
        }
    }
}
