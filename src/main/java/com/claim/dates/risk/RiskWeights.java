package com.claim.dates.risk;

/**
 * Points per triggered signal and the score cut-offs of each risk level.
 */
public record RiskWeights(
        int perDisclosureViolation,
        int doctorShopping,
        int progressiveChronic,
        int highThreshold,
        int mediumThreshold
) {
    public RiskWeights {
        if (perDisclosureViolation < 0 || doctorShopping < 0 || progressiveChronic < 0) {
            throw new IllegalArgumentException("Risk weights must be non-negative");
        }
        if (mediumThreshold <= 0 || highThreshold < mediumThreshold) {
            throw new IllegalArgumentException("Risk thresholds must satisfy 0 < medium <= high, got medium="
                    + mediumThreshold + ", high=" + highThreshold);
        }
    }

    public static RiskWeights defaults() {
        return new RiskWeights(2, 3, 1, 3, 1);
    }
}
