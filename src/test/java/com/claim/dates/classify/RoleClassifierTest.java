package com.claim.dates.classify;

import com.claim.dates.core.model.DateCandidate;
import com.claim.dates.core.model.DateCategory;
import com.claim.dates.core.model.Importance;
import com.claim.dates.core.model.RangeBoundary;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

class RoleClassifierTest {

    private final RoleClassifier classifier = new RoleClassifier();

    private static DateCandidate boundary(String date, RangeBoundary.Role role, boolean insurance, String counterpart) {
        return DateCandidate.builder()
                .normalizedDate(LocalDate.parse(date))
                .category(DateCategory.SURGERY)
                .importance(Importance.HIGH)
                .rangeBoundary(new RangeBoundary(role, insurance,
                        counterpart != null ? LocalDate.parse(counterpart) : null))
                .build();
    }

    @Test
    @DisplayName("Insurance period 2020-01-01..2030-01-01 should become enrollment CRITICAL and expiry LOW")
    void insurancePeriodOverride() {
        DateCandidate start = classifier.classify(
                boundary("2020-01-01", RangeBoundary.Role.START, true, "2030-01-01"));
        DateCandidate end = classifier.classify(
                boundary("2030-01-01", RangeBoundary.Role.END, true, "2020-01-01"));

        assertEquals(DateCategory.INSURANCE_ENROLLMENT, start.getCategory());
        assertEquals(Importance.CRITICAL, start.getImportance());
        assertEquals(DateCategory.INSURANCE_EXPIRY, end.getCategory());
        assertEquals(Importance.LOW, end.getImportance());
    }

    @Test
    @DisplayName("A reversed insurance range should still treat the earlier date as enrollment")
    void reversedRange() {
        DateCandidate listedFirst = classifier.classify(
                boundary("2030-01-01", RangeBoundary.Role.START, true, "2020-01-01"));
        assertEquals(DateCategory.INSURANCE_EXPIRY, listedFirst.getCategory());
    }

    @Test
    @DisplayName("A boundary without a counterpart should follow its role")
    void missingCounterpart() {
        DateCandidate end = classifier.classify(boundary("2030-01-01", RangeBoundary.Role.END, true, null));
        assertEquals(DateCategory.INSURANCE_EXPIRY, end.getCategory());
    }

    @Test
    @DisplayName("Non-insurance ranges and tagged candidates should keep their tags")
    void keepsTags() {
        DateCandidate admission = classifier.classify(
                boundary("2024-03-01", RangeBoundary.Role.START, false, "2024-03-10"));
        assertEquals(DateCategory.SURGERY, admission.getCategory());
        assertEquals(Importance.HIGH, admission.getImportance());
    }

    @Test
    @DisplayName("Untagged candidates should default to OTHER / MEDIUM")
    void defaults() {
        DateCandidate untagged = DateCandidate.builder().normalizedDate(LocalDate.of(2024, 1, 1)).build();
        DateCandidate partly = DateCandidate.builder()
                .normalizedDate(LocalDate.of(2024, 1, 2))
                .category(DateCategory.EXAM)
                .build();

        DateCandidate classified = classifier.classify(untagged);
        assertEquals(DateCategory.OTHER, classified.getCategory());
        assertEquals(Importance.MEDIUM, classified.getImportance());
        assertEquals(DateCategory.EXAM, classifier.classify(partly).getCategory());
        assertEquals(Importance.MEDIUM, classifier.classify(partly).getImportance());
    }
}
