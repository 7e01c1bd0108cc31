package com.claim.dates.enrollment;

import com.claim.dates.core.model.DateCandidate;
import com.claim.dates.core.model.DateCategory;
import com.claim.dates.core.model.EnrollmentFlag;
import com.claim.dates.core.model.ProximityBucket;
import com.claim.dates.core.model.ScoreBreakdown;
import com.claim.dates.core.model.ScoredCandidate;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EnrollmentProximityFlaggerTest {

    private static final EnrollmentResolution ENROLLMENT =
            EnrollmentResolution.resolved(LocalDate.of(2024, 6, 1), ExtractedEnrollmentStrategy.NAME, false);

    private final EnrollmentProximityFlagger flagger = new EnrollmentProximityFlagger();

    private static ScoredCandidate scored(String date, DateCategory category) {
        DateCandidate candidate = DateCandidate.builder()
                .normalizedDate(LocalDate.parse(date))
                .category(category)
                .build();
        return new ScoredCandidate(candidate, 1, 30, true, new ScoreBreakdown(List.of(), null));
    }

    @Test
    @DisplayName("Should bucket medical events before enrollment, chronologically")
    void buckets() {
        ProximityReport report = flagger.flag(List.of(
                scored("2024-04-15", DateCategory.OUTPATIENT_VISIT),
                scored("2015-01-01", DateCategory.DIAGNOSIS),
                scored("2023-07-01", DateCategory.SURGERY),
                scored("2020-01-01", DateCategory.ADMISSION),
                scored("2024-06-01", DateCategory.SURGERY),
                scored("2024-07-01", DateCategory.EXAM),
                scored("2024-05-20", DateCategory.DOCUMENT_METADATA),
                scored("2024-05-21", DateCategory.INSURANCE_ENROLLMENT)), ENROLLMENT);

        assertEquals(ProximityReport.Status.FLAGGED, report.status());
        List<EnrollmentFlag> flags = report.flags();
        assertEquals(List.of(LocalDate.of(2015, 1, 1), LocalDate.of(2020, 1, 1),
                        LocalDate.of(2023, 7, 1), LocalDate.of(2024, 4, 15)),
                flags.stream().map(f -> f.candidate().date()).toList());
        assertEquals(List.of(ProximityBucket.OUTSIDE, ProximityBucket.WITHIN_5_YEARS_BEFORE,
                        ProximityBucket.WITHIN_1_YEAR_BEFORE, ProximityBucket.WITHIN_3_MONTHS_BEFORE),
                flags.stream().map(EnrollmentFlag::bucket).toList());
        assertEquals(336, flags.get(2).daysBeforeEnrollment());
        assertEquals(47, flags.get(3).daysBeforeEnrollment());
        assertEquals(1, report.countIn(ProximityBucket.WITHIN_3_MONTHS_BEFORE));
        assertEquals(1, report.countIn(ProximityBucket.OUTSIDE));
    }

    @Test
    @DisplayName("Without an enrollment date the report should say insufficient data")
    void insufficientData() {
        ProximityReport report = flagger.flag(
                List.of(scored("2024-04-15", DateCategory.SURGERY)), EnrollmentResolution.insufficientData());

        assertTrue(report.isInsufficientData());
        assertTrue(report.flags().isEmpty());
        assertEquals(0, report.countIn(ProximityBucket.WITHIN_3_MONTHS_BEFORE));
    }

    @ParameterizedTest
    @DisplayName("Bucket limits should be inclusive")
    @CsvSource({
            "1,WITHIN_3_MONTHS_BEFORE",
            "90,WITHIN_3_MONTHS_BEFORE",
            "91,WITHIN_1_YEAR_BEFORE",
            "365,WITHIN_1_YEAR_BEFORE",
            "366,WITHIN_5_YEARS_BEFORE",
            "1825,WITHIN_5_YEARS_BEFORE",
            "1826,OUTSIDE"
    })
    void bucketLimits(long days, ProximityBucket expected) {
        assertEquals(expected, ProximityThresholds.defaults().bucketFor(days));
    }

    @Test
    @DisplayName("Thresholds must ascend")
    void thresholdValidation() {
        assertThrows(IllegalArgumentException.class, () -> new ProximityThresholds(0, 365, 1825));
        assertThrows(IllegalArgumentException.class, () -> new ProximityThresholds(90, 30, 1825));
    }
}
