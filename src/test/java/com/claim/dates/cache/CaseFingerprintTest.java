package com.claim.dates.cache;

import com.claim.dates.api.CaseAnalysisRequest;
import com.claim.dates.collect.BatchPayload;
import com.claim.dates.collect.DateEntry;
import com.claim.dates.risk.ProviderVisit;
import com.claim.dates.risk.RiskSignals;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CaseFingerprintTest {

    private static final LocalDate PROCESSING_DATE = LocalDate.of(2024, 6, 30);

    private static CaseAnalysisRequest.Builder request() {
        return CaseAnalysisRequest.builder()
                .caseId("case-1")
                .batch(BatchPayload.builder().date(DateEntry.of("2024-05-01", "수술 시행", "surgery", null)).build())
                .referenceText("수술일 2024.05.01");
    }

    @Test
    @DisplayName("Equal requests should share a fingerprint")
    void deterministic() {
        String first = CaseFingerprint.of(request().build(), PROCESSING_DATE);
        String second = CaseFingerprint.of(request().build(), PROCESSING_DATE);

        assertEquals(first, second);
        assertTrue(first.matches("[0-9a-f]{64}"), "Should be a SHA-256 hex digest: " + first);
    }

    @Test
    @DisplayName("Any input that changes the result should change the fingerprint")
    void sensitivity() {
        String base = CaseFingerprint.of(request().build(), PROCESSING_DATE);

        assertNotEquals(base, CaseFingerprint.of(request().build(), PROCESSING_DATE.plusDays(1)));
        assertNotEquals(base, CaseFingerprint.of(request().caseId("case-2").build(), PROCESSING_DATE));
        assertNotEquals(base, CaseFingerprint.of(request().referenceText(null).build(), PROCESSING_DATE));
        assertNotEquals(base, CaseFingerprint.of(
                request().claimDate(LocalDate.of(2024, 6, 1)).build(), PROCESSING_DATE));
        assertNotEquals(base, CaseFingerprint.of(
                request().suppliedEnrollmentDate(LocalDate.of(2020, 1, 1)).build(), PROCESSING_DATE));
        assertNotEquals(base, CaseFingerprint.of(
                request().riskSignals(RiskSignals.builder().disclosureViolations(1).build()).build(),
                PROCESSING_DATE));
        assertNotEquals(base, CaseFingerprint.of(
                request().providerVisits(List.of(new ProviderVisit(LocalDate.of(2024, 1, 1), "Clinic A"))).build(),
                PROCESSING_DATE));
        assertNotEquals(base, CaseFingerprint.of(
                request().batch(BatchPayload.builder().date(DateEntry.of("2024-04-15", "", null, null)).build())
                        .build(), PROCESSING_DATE));
    }
}
