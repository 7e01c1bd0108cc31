package com.claim.dates.rules;

import java.util.List;

/**
 * Built-in rewrites for reader date strings.
 * The reader emits ISO dates but sometimes appends a time of day.
 */
public final class DefaultDateNormalizationRules {

    private DefaultDateNormalizationRules() {
        // Utility class
    }

    /**
     * Creates a DateNormalizationEngine with all default rules.
     */
    public static DateNormalizationEngine createDefaultEngine() {
        return new DateNormalizationEngine(getRules());
    }

    public static List<DateNormalizationRule> getRules() {
        return List.of(
                DateNormalizationRule.builder()
                        .name("trim")
                        .pattern("^\\s+|\\s+$")
                        .replacement("")
                        .priority(1)
                        .build(),

                // 2024-03-05T10:15:00Z, 2024-03-05T10:15:00+09:00
                DateNormalizationRule.builder()
                        .name("strip-iso-time")
                        .pattern("^(\\d{4}-\\d{2}-\\d{2})T.*$")
                        .replacement("$1")
                        .priority(10)
                        .build(),

                // 2024-03-05 14:30, 2024-03-05 14:30:59.123
                DateNormalizationRule.builder()
                        .name("strip-clock-time")
                        .pattern("^(\\d{4}-\\d{2}-\\d{2})\\s+\\d{1,2}:\\d{2}(:\\d{2}(\\.\\d+)?)?.*$")
                        .replacement("$1")
                        .priority(20)
                        .build()
        );
    }
}
