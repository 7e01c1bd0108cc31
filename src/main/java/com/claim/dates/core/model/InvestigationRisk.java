package com.claim.dates.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Aggregated investigation risk verdict for one case.
 *
 * @param riskScore    weighted sum of triggered signals
 * @param riskLevel    categorical level derived from the score
 * @param evidenceList human-readable bullets, one per triggered signal
 */
public record InvestigationRisk(int riskScore, RiskLevel riskLevel, List<String> evidenceList) {

    public InvestigationRisk {
        Objects.requireNonNull(riskLevel, "riskLevel is required");
        evidenceList = evidenceList != null ? List.copyOf(evidenceList) : List.of();
    }

    public boolean hasFindings() {
        return riskScore > 0;
    }
}
