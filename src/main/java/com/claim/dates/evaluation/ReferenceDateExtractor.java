package com.claim.dates.evaluation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls dates out of a plain-text reference (ground-truth) document.
 * Recognizes {@code YYYY.M.D}, {@code YYYY-M-D}, {@code YYYY/M/D} and {@code YYYY년 M월 D일}.
 */
public class ReferenceDateExtractor {
    private static final Logger log = LoggerFactory.getLogger(ReferenceDateExtractor.class);

    public static final int MIN_YEAR = 1990;
    public static final int MAX_YEAR = 2060;

    private static final List<Pattern> PATTERNS = List.of(
            Pattern.compile("(?<!\\d)(\\d{4})\\s*([./-])\\s*(\\d{1,2})\\s*\\2\\s*(\\d{1,2})(?!\\d)"),
            Pattern.compile("(?<!\\d)(\\d{4})\\s*년\\s*(\\d{1,2})\\s*월\\s*(\\d{1,2})\\s*일")
    );

    /**
     * @param text reference text; null or blank yields an empty set
     * @return calendar-valid dates within [{@value #MIN_YEAR}, {@value #MAX_YEAR}], ascending
     */
    public SortedSet<LocalDate> extract(String text) {
        SortedSet<LocalDate> dates = new TreeSet<>();
        if (text == null || text.isBlank()) {
            return Collections.unmodifiableSortedSet(dates);
        }
        Matcher separated = PATTERNS.get(0).matcher(text);
        while (separated.find()) {
            toDate(separated.group(1), separated.group(3), separated.group(4), dates);
        }
        Matcher korean = PATTERNS.get(1).matcher(text);
        while (korean.find()) {
            toDate(korean.group(1), korean.group(2), korean.group(3), dates);
        }
        log.debug("reference.extracted count={}", dates.size());
        return Collections.unmodifiableSortedSet(dates);
    }

    private static void toDate(String year, String month, String day, SortedSet<LocalDate> into) {
        int y = Integer.parseInt(year);
        if (y < MIN_YEAR || y > MAX_YEAR) {
            return;
        }
        try {
            into.add(LocalDate.of(y, Integer.parseInt(month), Integer.parseInt(day)));
        } catch (DateTimeException e) {
            log.debug("reference.invalid-date value={}-{}-{}", year, month, day);
        }
    }
}
