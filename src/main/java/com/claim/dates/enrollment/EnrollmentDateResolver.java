package com.claim.dates.enrollment;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Tries enrollment strategies in priority order; the first answer wins.
 * Never guesses: when no strategy answers the result is insufficient data.
 */
public class EnrollmentDateResolver {
    private static final Logger log = LoggerFactory.getLogger(EnrollmentDateResolver.class);

    private final List<EnrollmentStrategy> strategies;

    public EnrollmentDateResolver() {
        this(List.of(new ExtractedEnrollmentStrategy(), new SuppliedEnrollmentStrategy()));
    }

    public EnrollmentDateResolver(List<EnrollmentStrategy> strategies) {
        if (strategies == null || strategies.isEmpty()) {
            throw new IllegalArgumentException("At least one enrollment strategy is required");
        }
        this.strategies = List.copyOf(strategies);
    }

    public List<EnrollmentStrategy> getStrategies() {
        return strategies;
    }

    public EnrollmentResolution resolve(EnrollmentEvidence evidence) {
        for (int i = 0; i < strategies.size(); i++) {
            EnrollmentStrategy strategy = strategies.get(i);
            Optional<LocalDate> date = strategy.resolve(evidence);
            if (date.isPresent()) {
                boolean degraded = i > 0;
                if (degraded) {
                    log.info("enrollment.degraded strategy={} date={}", strategy.name(), date.get());
                } else {
                    log.debug("enrollment.resolved strategy={} date={}", strategy.name(), date.get());
                }
                return EnrollmentResolution.resolved(date.get(), strategy.name(), degraded);
            }
        }
        log.info("enrollment.insufficient-data strategies={}", strategies.size());
        return EnrollmentResolution.insufficientData();
    }
}
