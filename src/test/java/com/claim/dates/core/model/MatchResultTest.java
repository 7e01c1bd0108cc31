package com.claim.dates.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MatchResult Tests")
class MatchResultTest {

    private static final LocalDate D1 = LocalDate.of(2024, 3, 1);
    private static final LocalDate D2 = LocalDate.of(2024, 3, 5);
    private static final LocalDate D3 = LocalDate.of(2024, 3, 9);
    private static final LocalDate D4 = LocalDate.of(2024, 4, 2);

    @Nested
    @DisplayName("Set partition")
    class Partition {

        @Test
        @DisplayName("matched, missed and extra should partition reference and extracted sets")
        void setIdentities() {
            MatchResult result = MatchResult.of(List.of(D1, D2, D3), List.of(D2, D3, D4));

            Set<LocalDate> matchedOrMissed = new TreeSet<>(result.matched());
            matchedOrMissed.addAll(result.missed());
            assertEquals(result.referenceSet(), matchedOrMissed);

            Set<LocalDate> matchedOrExtra = new TreeSet<>(result.matched());
            matchedOrExtra.addAll(result.extra());
            assertEquals(result.extractedSet(), matchedOrExtra);

            assertTrue(result.matched().stream().noneMatch(result.missed()::contains));
            assertTrue(result.matched().stream().noneMatch(result.extra()::contains));
            assertTrue(result.missed().stream().noneMatch(result.extra()::contains));
        }

        @Test
        @DisplayName("Duplicates in the inputs should be counted once")
        void setSemantics() {
            MatchResult result = MatchResult.of(List.of(D1, D1, D2), List.of(D1, D1));
            assertEquals(2, result.referenceSet().size());
            assertEquals(1, result.extractedSet().size());
            assertEquals(Set.of(D1), result.matched());
        }

        @Test
        @DisplayName("Sets should be unmodifiable")
        void unmodifiable() {
            MatchResult result = MatchResult.of(List.of(D1), List.of(D1));
            assertThrows(UnsupportedOperationException.class, () -> result.matched().add(D2));
        }
    }

    @Nested
    @DisplayName("Rates")
    class Rates {

        @Test
        @DisplayName("Coverage and precision should be percentages of matched dates")
        void rates() {
            MatchResult result = MatchResult.of(List.of(D1, D2, D3, D4), List.of(D1, D2));
            assertEquals(50.0, result.coverageRate().getAsDouble(), 1e-9);
            assertEquals(100.0, result.precisionRate().getAsDouble(), 1e-9);
            assertEquals("50.0%", result.formattedCoverage());
            assertEquals("100.0%", result.formattedPrecision());
        }

        @Test
        @DisplayName("Empty reference with extracted dates should give 100% coverage")
        void emptyReference() {
            MatchResult result = MatchResult.of(List.of(), List.of(D1));
            assertEquals(100.0, result.coverageRate().getAsDouble(), 1e-9);
            assertEquals(0.0, result.precisionRate().getAsDouble(), 1e-9);
        }

        @Test
        @DisplayName("Both sets empty should make both rates not applicable")
        void bothEmpty() {
            MatchResult result = MatchResult.of(List.of(), List.of());
            assertTrue(result.coverageRate().isEmpty());
            assertTrue(result.precisionRate().isEmpty());
            assertEquals("N/A", result.formattedCoverage());
        }

        @Test
        @DisplayName("Unavailable reference should make both rates not applicable")
        void referenceUnavailable() {
            MatchResult result = MatchResult.referenceUnavailable(List.of(D1, D2));
            assertFalse(result.referenceAvailable());
            assertTrue(result.coverageRate().isEmpty());
            assertTrue(result.precisionRate().isEmpty());
            assertEquals(2, result.extractedSet().size());
        }

        @Test
        @DisplayName("Adding a reference date to the extracted set should not lower coverage")
        void coverageMonotonic() {
            List<LocalDate> reference = List.of(D1, D2, D3);
            double before = MatchResult.of(reference, List.of(D1)).coverageRate().getAsDouble();
            double after = MatchResult.of(reference, List.of(D1, D2)).coverageRate().getAsDouble();
            assertTrue(after >= before);
        }

        @Test
        @DisplayName("Adding a non-reference date to the extracted set should not raise precision")
        void precisionMonotonic() {
            List<LocalDate> reference = List.of(D1, D2);
            double before = MatchResult.of(reference, List.of(D1, D2)).precisionRate().getAsDouble();
            double after = MatchResult.of(reference, List.of(D1, D2, D4)).precisionRate().getAsDouble();
            assertTrue(after <= before);
        }
    }
}
