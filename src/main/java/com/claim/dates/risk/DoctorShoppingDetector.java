package com.claim.dates.risk;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.temporal.ChronoUnit;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Looks for many distinct providers visited within a short sliding window.
 */
public class DoctorShoppingDetector {
    private static final Logger log = LoggerFactory.getLogger(DoctorShoppingDetector.class);

    public static final int DEFAULT_WINDOW_DAYS = 30;
    public static final int DEFAULT_PROVIDER_THRESHOLD = 3;

    private final int windowDays;
    private final int providerThreshold;

    public DoctorShoppingDetector() {
        this(DEFAULT_WINDOW_DAYS, DEFAULT_PROVIDER_THRESHOLD);
    }

    public DoctorShoppingDetector(int windowDays, int providerThreshold) {
        if (windowDays <= 0 || providerThreshold <= 0) {
            throw new IllegalArgumentException("windowDays and providerThreshold must be positive");
        }
        this.windowDays = windowDays;
        this.providerThreshold = providerThreshold;
    }

    /**
     * Each window starts at a visit and spans the following {@code windowDays} days inclusive.
     */
    public DoctorShoppingFinding detect(List<ProviderVisit> visits) {
        if (visits == null || visits.isEmpty()) {
            return DoctorShoppingFinding.none();
        }
        List<ProviderVisit> sorted = visits.stream()
                .sorted(Comparator.comparing(ProviderVisit::date))
                .toList();

        int maxProviders = 0;
        for (int start = 0; start < sorted.size(); start++) {
            Set<String> providers = new HashSet<>();
            for (int i = start; i < sorted.size(); i++) {
                long offset = ChronoUnit.DAYS.between(sorted.get(start).date(), sorted.get(i).date());
                if (offset > windowDays) {
                    break;
                }
                providers.add(sorted.get(i).provider());
            }
            maxProviders = Math.max(maxProviders, providers.size());
        }

        boolean suspicious = maxProviders >= providerThreshold;
        log.debug("risk.doctor-shopping visits={} maxProviders={} suspicious={}",
                sorted.size(), maxProviders, suspicious);
        return new DoctorShoppingFinding(suspicious, maxProviders);
    }
}
