package com.claim.dates.collect;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.StringReader;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BatchPayloadReaderTest {

    private final BatchPayloadReader reader = new BatchPayloadReader();

    @Test
    @DisplayName("Should parse a single batch with all sub-collections")
    void singleBatch() {
        String json = """
                {
                  "allExtractedDates": [{"date": "2024-03-05", "context": "수술 시행", "type": "surgery",
                                         "importance": "HIGH", "confidence": "0.9"}],
                  "dateRanges": [{"startDate": "2020-01-01", "endDate": "2030-01-01", "type": "보험기간"}],
                  "insuranceDates": [{"date": "2020-01-01", "company": "ACME", "productName": "실손", "type": "가입일"}],
                  "tableDates": [{"date": "2024-02-20", "rowContent": "외래", "tableType": "외래"}],
                  "pageCount": 12
                }
                """;

        BatchPayload payload = reader.readBatch(json);

        assertEquals(1, payload.allExtractedDates().size());
        assertEquals("수술 시행", payload.allExtractedDates().get(0).context());
        assertEquals("2030-01-01", payload.dateRanges().get(0).endDate());
        assertEquals("ACME", payload.insuranceDates().get(0).company());
        assertEquals(1, payload.tableDates().size());
        assertTrue(payload.dates().isEmpty());
        assertEquals(5, payload.rawValueCount());
    }

    @Test
    @DisplayName("Should parse arrays and unwrap generatedJson wrappers")
    void arrayAndWrapper() {
        String json = """
                [
                  {"generatedJson": {"dates": [{"date": "2024-01-01"}]}},
                  {"allExtractedDates": []}
                ]
                """;

        List<BatchPayload> batches = reader.read(new StringReader(json));

        assertEquals(2, batches.size());
        assertEquals("2024-01-01", batches.get(0).dates().get(0).date());
        assertEquals(0, batches.get(1).rawValueCount());
    }

    @Test
    @DisplayName("Should read the legacy allDates collection")
    void legacyAllDates() {
        BatchPayload payload = reader.readBatch("""
                {"allDates": [{"date": "2024-05-01", "type": "surgery"}]}
                """);

        assertEquals(1, payload.dates().size());
        assertEquals("2024-05-01", payload.dates().get(0).date());
        assertEquals(1, new CandidateCollector().collectBatch(payload, 0).size());
    }

    @Test
    @DisplayName("Null entries should be skipped without losing the rest of the batch")
    void nullEntries() {
        BatchPayload payload = reader.readBatch("""
                {
                  "allExtractedDates": [null, {"date": "2024-05-01", "type": "surgery"}],
                  "dateRanges": [null],
                  "tableDates": [null, null]
                }
                """);

        assertEquals(1, payload.allExtractedDates().size());
        assertTrue(payload.dateRanges().isEmpty());
        assertTrue(payload.tableDates().isEmpty());
        assertEquals(1, payload.rawValueCount());
    }

    @Test
    @DisplayName("Should reject empty, invalid and non-object payloads")
    void invalidPayloads() {
        assertThrows(PayloadParseException.class, () -> reader.read(""));
        assertThrows(PayloadParseException.class, () -> reader.read("{not json"));
        assertThrows(PayloadParseException.class, () -> reader.read("42"));
        assertThrows(PayloadParseException.class, () -> reader.read("[1, 2]"));
        assertThrows(PayloadParseException.class, () -> reader.readBatch("[{}, {}]"));
    }
}
