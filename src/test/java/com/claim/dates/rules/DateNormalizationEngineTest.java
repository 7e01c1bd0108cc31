package com.claim.dates.rules;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

class DateNormalizationEngineTest {

    private DateNormalizationEngine engine;

    @BeforeEach
    void setUp() {
        engine = DefaultDateNormalizationRules.createDefaultEngine();
    }

    @Test
    @DisplayName("Should handle null and blank inputs")
    void nullAndBlank() {
        assertEquals("", engine.rewrite(null));
        assertEquals("", engine.rewrite("   "));
        assertTrue(engine.normalize(null).isEmpty());
        assertTrue(engine.normalize("").isEmpty());
    }

    @ParameterizedTest
    @DisplayName("Should accept canonical dates with surrounding noise stripped")
    @CsvSource({
            "2024-03-05,2024-03-05",
            "'  2024-03-05  ',2024-03-05",
            "2024-03-05T10:15:30Z,2024-03-05",
            "2024-03-05 09:30,2024-03-05",
            "2024-03-05 09:30:12.5,2024-03-05"
    })
    void acceptsCanonical(String raw, LocalDate expected) {
        assertEquals(expected, engine.normalize(raw).orElseThrow());
    }

    @ParameterizedTest
    @DisplayName("Should drop values that are not strict calendar-valid YYYY-MM-DD")
    @ValueSource(strings = {"2024-02-30", "2023-02-29", "2024.03.05", "2024-3-5", "03/05/2024", "unknown", "2024-13-01"})
    void rejectsMalformed(String raw) {
        assertTrue(engine.normalize(raw).isEmpty());
    }

    @Test
    @DisplayName("Leap day should be accepted in a leap year")
    void leapDay() {
        assertEquals(LocalDate.of(2024, 2, 29), engine.normalize("2024-02-29").orElseThrow());
    }

    @Test
    @DisplayName("Custom rules should run in priority order")
    void customRule() {
        engine.addRule(DateNormalizationRule.builder()
                .name("dotted")
                .pattern("^(\\d{4})\\.(\\d{2})\\.(\\d{2})$")
                .replacement("$1-$2-$3")
                .priority(50)
                .build());

        assertEquals(LocalDate.of(2024, 3, 5), engine.normalize("2024.03.05").orElseThrow());
        assertTrue(engine.removeRule("dotted"));
        assertTrue(engine.normalize("2024.03.05").isEmpty());
    }
}
