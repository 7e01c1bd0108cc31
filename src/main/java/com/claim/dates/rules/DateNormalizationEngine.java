package com.claim.dates.rules;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Turns raw reader date strings into calendar dates.
 * Rules are applied in priority order; the result must then match {@code YYYY-MM-DD}
 * exactly and denote a real calendar day. Anything else is rejected without an error.
 */
public class DateNormalizationEngine {
    private static final Logger log = LoggerFactory.getLogger(DateNormalizationEngine.class);

    private static final Pattern STRICT_ISO_DATE = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}$");

    private final List<DateNormalizationRule> rules;

    public DateNormalizationEngine() {
        this.rules = new ArrayList<>();
    }

    public DateNormalizationEngine(List<DateNormalizationRule> rules) {
        this.rules = new ArrayList<>(rules);
        sortRules();
    }

    /**
     * Adds a rule to the engine.
     */
    public void addRule(DateNormalizationRule rule) {
        rules.add(rule);
        sortRules();
    }

    /**
     * Adds multiple rules to the engine.
     */
    public void addRules(List<DateNormalizationRule> newRules) {
        rules.addAll(newRules);
        sortRules();
    }

    /**
     * Removes a rule by name.
     */
    public boolean removeRule(String ruleName) {
        return rules.removeIf(r -> r.getName().equals(ruleName));
    }

    public List<DateNormalizationRule> getRules() {
        return List.copyOf(rules);
    }

    /**
     * Rewrites the raw value with every rule, without validating it.
     */
    public String rewrite(String raw) {
        if (raw == null || raw.isBlank()) {
            return "";
        }
        String result = raw;
        for (DateNormalizationRule rule : rules) {
            String before = result;
            result = rule.apply(result);
            if (!before.equals(result)) {
                log.trace("Rule '{}' transformed '{}' -> '{}'", rule.getName(), before, result);
            }
        }
        return result.trim();
    }

    /**
     * Normalizes a raw date string.
     *
     * @return the calendar date, or empty when the value is not a strict ISO date after rewriting
     */
    public Optional<LocalDate> normalize(String raw) {
        String rewritten = rewrite(raw);
        if (!STRICT_ISO_DATE.matcher(rewritten).matches()) {
            return Optional.empty();
        }
        try {
            return Optional.of(LocalDate.parse(rewritten));
        } catch (DateTimeException e) {
            log.debug("date.rejected raw='{}' reason=invalid-calendar-day", raw);
            return Optional.empty();
        }
    }

    private void sortRules() {
        rules.sort(Comparator.comparingInt(DateNormalizationRule::getPriority));
    }
}
