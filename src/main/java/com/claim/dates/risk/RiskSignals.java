package com.claim.dates.risk;

import java.util.Objects;
import java.util.OptionalInt;

/**
 * Outputs of the risk detectors for one case. The disclosure violation count is
 * optional; when absent the aggregator derives it from the proximity report.
 */
public final class RiskSignals {

    private final Integer disclosureViolations;
    private final DoctorShoppingFinding doctorShopping;
    private final ProgressivityClassification progressivity;

    private RiskSignals(Builder builder) {
        this.disclosureViolations = builder.disclosureViolations;
        this.doctorShopping = builder.doctorShopping != null ? builder.doctorShopping : DoctorShoppingFinding.none();
        this.progressivity = builder.progressivity != null ? builder.progressivity
                : ProgressivityClassification.NOT_ANALYZED;
    }

    public static RiskSignals none() {
        return builder().build();
    }

    public OptionalInt getDisclosureViolations() {
        return disclosureViolations != null ? OptionalInt.of(disclosureViolations) : OptionalInt.empty();
    }

    public DoctorShoppingFinding getDoctorShopping() {
        return doctorShopping;
    }

    public ProgressivityClassification getProgressivity() {
        return progressivity;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RiskSignals that)) return false;
        return Objects.equals(disclosureViolations, that.disclosureViolations)
                && doctorShopping.equals(that.doctorShopping)
                && progressivity == that.progressivity;
    }

    @Override
    public int hashCode() {
        return Objects.hash(disclosureViolations, doctorShopping, progressivity);
    }

    @Override
    public String toString() {
        return "RiskSignals{disclosureViolations=" + disclosureViolations +
                ", doctorShopping=" + doctorShopping +
                ", progressivity=" + progressivity + '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(RiskSignals signals) {
        Builder b = new Builder();
        b.disclosureViolations = signals.disclosureViolations;
        b.doctorShopping = signals.doctorShopping;
        b.progressivity = signals.progressivity;
        return b;
    }

    public static class Builder {
        private Integer disclosureViolations;
        private DoctorShoppingFinding doctorShopping;
        private ProgressivityClassification progressivity;

        public Builder disclosureViolations(int count) {
            if (count < 0) {
                throw new IllegalArgumentException("disclosureViolations must be >= 0");
            }
            this.disclosureViolations = count;
            return this;
        }

        public Builder doctorShopping(DoctorShoppingFinding doctorShopping) {
            this.doctorShopping = doctorShopping;
            return this;
        }

        public Builder progressivity(ProgressivityClassification progressivity) {
            this.progressivity = progressivity;
            return this;
        }

        public RiskSignals build() {
            return new RiskSignals(this);
        }
    }
}
