package com.claim.dates.risk;

import com.claim.dates.core.model.InvestigationRisk;
import com.claim.dates.core.model.ProximityBucket;
import com.claim.dates.core.model.RiskLevel;
import com.claim.dates.enrollment.ProximityReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Folds risk signals into one score, level and evidence list.
 */
public class RiskAggregator {
    private static final Logger log = LoggerFactory.getLogger(RiskAggregator.class);

    static final String NO_FINDINGS = "No findings: no investigation risk signals were triggered";

    private final RiskWeights weights;

    public RiskAggregator() {
        this(RiskWeights.defaults());
    }

    public RiskAggregator(RiskWeights weights) {
        this.weights = weights;
    }

    public InvestigationRisk aggregate(RiskSignals signals) {
        return aggregate(signals, null);
    }

    /**
     * @param proximity supplies the disclosure violation count when the signals carry none;
     *                  may be null
     */
    public InvestigationRisk aggregate(RiskSignals signals, ProximityReport proximity) {
        int violations = signals.getDisclosureViolations().orElseGet(() ->
                proximity != null ? proximity.countIn(ProximityBucket.WITHIN_3_MONTHS_BEFORE) : 0);

        int score = 0;
        List<String> evidence = new ArrayList<>();
        if (violations > 0) {
            score += violations * weights.perDisclosureViolation();
            evidence.add("Disclosure duty: " + violations
                    + " potential violation(s) of pre-enrollment disclosure");
        }
        DoctorShoppingFinding shopping = signals.getDoctorShopping();
        if (shopping.suspicious()) {
            score += weights.doctorShopping();
            evidence.add("Doctor shopping: " + shopping.maxProviders()
                    + " distinct providers within a 30-day window");
        }
        if (signals.getProgressivity() == ProgressivityClassification.PROGRESSIVE_CHRONIC) {
            score += weights.progressiveChronic();
            evidence.add("Progressivity: condition classified as progressive/chronic");
        }
        if (score == 0) {
            evidence.add(NO_FINDINGS);
        }

        RiskLevel level = levelFor(score);
        log.debug("risk.aggregated score={} level={} violations={}", score, level, violations);
        return new InvestigationRisk(score, level, evidence);
    }

    RiskLevel levelFor(int score) {
        if (score >= weights.highThreshold()) {
            return RiskLevel.HIGH;
        }
        if (score >= weights.mediumThreshold()) {
            return RiskLevel.MEDIUM;
        }
        return RiskLevel.LOW;
    }
}
