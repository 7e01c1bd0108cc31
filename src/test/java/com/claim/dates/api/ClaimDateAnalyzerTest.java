package com.claim.dates.api;

import com.claim.dates.cache.CacheConfig;
import com.claim.dates.collect.BatchPayload;
import com.claim.dates.collect.DateEntry;
import com.claim.dates.collect.RangeEntry;
import com.claim.dates.core.model.DateCandidate;
import com.claim.dates.core.model.ProximityBucket;
import com.claim.dates.core.model.RiskLevel;
import com.claim.dates.core.model.ScoredCandidate;
import com.claim.dates.enrollment.ExtractedEnrollmentStrategy;
import com.claim.dates.evaluation.AggregateEvaluation;
import com.claim.dates.metrics.MetricsService;
import com.claim.dates.reader.DocumentReader;
import com.claim.dates.risk.ProviderVisit;
import com.claim.dates.scoring.RelevanceScorer;
import com.claim.dates.scoring.RuleOutcome;
import com.claim.dates.scoring.ScoringContext;
import com.claim.dates.scoring.ScoringRule;
import com.claim.dates.tracing.Span;
import com.claim.dates.tracing.TracingService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@DisplayName("ClaimDateAnalyzer Tests")
class ClaimDateAnalyzerTest {

    private static final LocalDate PROCESSING_DATE = LocalDate.of(2024, 6, 30);
    private static final String REFERENCE = "수술일 2024.05.01 외래 2024년 4월 15일 입원 2024-03-01";

    private ClaimDateAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        analyzer = ClaimDateAnalyzer.builder()
                .options(AnalysisOptions.builder().processingDate(PROCESSING_DATE).build())
                .build();
    }

    @AfterEach
    void tearDown() {
        analyzer.close();
    }

    static List<BatchPayload> sampleBatches() {
        BatchPayload first = BatchPayload.builder()
                .date(DateEntry.of("2024-05-01", "수술 시행", "surgery", "HIGH"))
                .range(RangeEntry.of("2024-06-01", "2034-06-01", "보험기간", "보험기간"))
                .date(DateEntry.of("2024-02-30", "", "exam", null))
                .date(DateEntry.of("2024-06-29", "발급일 2024-06-29", "document-metadata", "LOW"))
                .build();
        BatchPayload second = BatchPayload.builder()
                .date(DateEntry.of("2024-05-01", "수술 기록", "surgery", "HIGH"))
                .date(DateEntry.of("2024-04-15", "외래 진료", "outpatient-visit", null))
                .build();
        return List.of(first, second);
    }

    static CaseAnalysisRequest sampleRequest(String caseId) {
        return CaseAnalysisRequest.builder()
                .caseId(caseId)
                .batches(sampleBatches())
                .referenceText(REFERENCE)
                .build();
    }

    @Nested
    @DisplayName("End-to-end")
    class EndToEnd {

        @Test
        @DisplayName("Should rank, evaluate, flag and assess a two-batch case")
        void fullCase() {
            CaseAnalysisResult result = analyzer.analyze(sampleRequest("case-1"));

            assertEquals(PROCESSING_DATE, result.processingDate());
            assertEquals(List.of(LocalDate.of(2024, 5, 1), LocalDate.of(2024, 6, 1), LocalDate.of(2024, 4, 15)),
                    result.acceptedDates());
            assertEquals(List.of(70, 55, 45), result.ranked().stream().map(ScoredCandidate::score).toList());
            assertEquals(2, result.ranked().get(0).frequency());
            assertEquals(5, result.scored().size());

            assertEquals(new CollectionStats(7, 6, 1, 5, 1), result.stats());

            assertEquals("66.7%", result.matchResult().formattedCoverage());
            assertEquals("66.7%", result.matchResult().formattedPrecision());

            assertEquals(LocalDate.of(2024, 6, 1), result.proximity().resolution().enrollmentDate());
            assertEquals(ExtractedEnrollmentStrategy.NAME, result.proximity().resolution().strategy());
            assertFalse(result.proximity().resolution().degraded());
            assertEquals(2, result.proximity().countIn(ProximityBucket.WITHIN_3_MONTHS_BEFORE));

            assertEquals(4, result.risk().riskScore());
            assertEquals(RiskLevel.HIGH, result.risk().riskLevel());
        }

        @Test
        @DisplayName("An out-of-range enrollment date should not anchor proximity flagging")
        void vetoedEnrollmentIgnored() {
            BatchPayload batch = BatchPayload.builder()
                    .range(RangeEntry.of("1985-03-01", "1995-03-01", "구 보험기간", "보험기간"))
                    .range(RangeEntry.of("2024-06-01", "2034-06-01", "보험기간", "보험기간"))
                    .date(DateEntry.of("2024-04-15", "수술 시행", "surgery", "HIGH"))
                    .build();

            CaseAnalysisResult result = analyzer.analyze(CaseAnalysisRequest.builder()
                    .caseId("case-veto")
                    .batch(batch)
                    .build());

            assertTrue(result.scored().stream()
                    .anyMatch(s -> s.date().equals(LocalDate.of(1985, 3, 1)) && s.breakdown().isVetoed()));
            assertEquals(LocalDate.of(2024, 6, 1), result.proximity().resolution().enrollmentDate());
            assertEquals(1, result.proximity().countIn(ProximityBucket.WITHIN_3_MONTHS_BEFORE));
            assertEquals(RiskLevel.MEDIUM, result.risk().riskLevel());
        }

        @Test
        @DisplayName("A batch the reader returned nothing for should be skipped")
        void nullBatchSkipped() {
            List<BatchPayload> batches = new ArrayList<>();
            batches.add(null);
            batches.addAll(sampleBatches());

            CaseAnalysisResult result = analyzer.analyze(CaseAnalysisRequest.builder(sampleRequest("case-1"))
                    .batches(batches)
                    .build());

            assertEquals(new CollectionStats(7, 6, 1, 5, 1), result.stats());
            assertEquals(List.of(LocalDate.of(2024, 5, 1), LocalDate.of(2024, 6, 1), LocalDate.of(2024, 4, 15)),
                    result.acceptedDates());
        }

        @Test
        @DisplayName("Repeated runs on the same inputs should give equal results")
        void idempotent() {
            CaseAnalysisResult first = analyzer.analyze(sampleRequest("case-1"));
            CaseAnalysisResult second = analyzer.analyze(sampleRequest("case-1"));

            assertEquals(first, second);
        }

        @Test
        @DisplayName("Without a reference the match rates should be not applicable")
        void noReference() {
            CaseAnalysisResult result = analyzer.analyze(CaseAnalysisRequest.builder(sampleRequest("case-1"))
                    .referenceText(null)
                    .build());

            assertFalse(result.matchResult().referenceAvailable());
            assertEquals("N/A", result.matchResult().formattedCoverage());
            assertEquals(3, result.ranked().size());
        }

        @Test
        @DisplayName("An empty case should produce an empty, low-risk result")
        void emptyCase() {
            CaseAnalysisResult result = analyzer.analyze(CaseAnalysisRequest.builder().caseId("empty").build());

            assertTrue(result.ranked().isEmpty());
            assertTrue(result.proximity().isInsufficientData());
            assertEquals(RiskLevel.LOW, result.risk().riskLevel());
        }

        @Test
        @DisplayName("Visit history should feed doctor-shopping and progressivity signals")
        void derivedSignals() {
            CaseAnalysisResult result = analyzer.analyze(CaseAnalysisRequest.builder()
                    .caseId("visits")
                    .providerVisits(List.of(
                            new ProviderVisit(LocalDate.of(2024, 1, 1), "Clinic A"),
                            new ProviderVisit(LocalDate.of(2024, 1, 15), "Clinic B"),
                            new ProviderVisit(LocalDate.of(2024, 1, 31), "Clinic C")))
                    .build());

            assertEquals(4, result.risk().riskScore());
            assertEquals(RiskLevel.HIGH, result.risk().riskLevel());
            assertEquals(2, result.risk().evidenceList().size());
        }

        @Test
        @DisplayName("A higher threshold should accept fewer dates")
        void threshold() {
            try (ClaimDateAnalyzer strict = ClaimDateAnalyzer.builder()
                    .options(AnalysisOptions.builder()
                            .processingDate(PROCESSING_DATE)
                            .acceptanceThreshold(50)
                            .build())
                    .build()) {
                CaseAnalysisResult result = strict.analyze(sampleRequest("case-1"));
                assertEquals(List.of(LocalDate.of(2024, 5, 1), LocalDate.of(2024, 6, 1)), result.acceptedDates());
            }
        }
    }

    @Test
    @DisplayName("evaluateAll should pool rates and skip cases without a reference")
    void evaluateAll() {
        AggregateEvaluation aggregate = analyzer.evaluateAll(List.of(
                sampleRequest("case-1"),
                sampleRequest("case-2"),
                CaseAnalysisRequest.builder(sampleRequest("case-3")).referenceText(null).build()));

        assertEquals(2, aggregate.evaluatedCases());
        assertEquals(1, aggregate.skippedCases());
        assertEquals(6, aggregate.referenceTotal());
        assertEquals(4, aggregate.matchedTotal());
        assertEquals("66.7%", aggregate.formattedCoverage());
    }

    @Nested
    @DisplayName("Caching")
    class Caching {

        @Test
        @DisplayName("Second analysis of the same case should come from the cache")
        void cacheHit() {
            MetricsService metrics = mock(MetricsService.class);
            try (ClaimDateAnalyzer cached = ClaimDateAnalyzer.builder()
                    .options(AnalysisOptions.builder().processingDate(PROCESSING_DATE).build())
                    .cacheConfig(CacheConfig.defaults())
                    .metricsService(metrics)
                    .build()) {
                CaseAnalysisResult first = cached.analyze(sampleRequest("case-1"));
                CaseAnalysisResult second = cached.analyze(sampleRequest("case-1"));

                assertSame(first, second);
                verify(metrics).recordCacheMiss();
                verify(metrics).recordCacheHit();
                verify(metrics).recordAnalysisDuration(eq(true), any());
                verify(metrics).recordScoringOutcome(3, 2);
                assertEquals(1, cached.getCache().getStats().size());
            }
        }

        @Test
        @DisplayName("A different processing date should miss the cache")
        void processingDateInKey() {
            try (ClaimDateAnalyzer cached = ClaimDateAnalyzer.builder()
                    .options(AnalysisOptions.builder().processingDate(PROCESSING_DATE).build())
                    .cacheConfig(CacheConfig.defaults())
                    .build()) {
                cached.analyze(sampleRequest("case-1"));
                try (ClaimDateAnalyzer later = ClaimDateAnalyzer.builder()
                        .options(AnalysisOptions.builder().processingDate(PROCESSING_DATE.plusDays(1)).build())
                        .cache(cached.getCache())
                        .build()) {
                    later.analyze(sampleRequest("case-1"));
                }
                assertEquals(2, cached.getCache().getStats().size());
            }
        }
    }

    @Nested
    @DisplayName("Reader and failures")
    class ReaderAndFailures {

        @Test
        @DisplayName("readAndAnalyze should fetch batches through the reader")
        void readAndAnalyze() {
            DocumentReader reader = mock(DocumentReader.class);
            List<BatchPayload> batches = sampleBatches();
            when(reader.read(eq("case-r"), anyInt())).thenAnswer(inv -> batches.get(inv.getArgument(1)));

            try (ClaimDateAnalyzer withReader = ClaimDateAnalyzer.builder()
                    .options(AnalysisOptions.builder().processingDate(PROCESSING_DATE).build())
                    .documentReader(reader)
                    .build()) {
                CaseAnalysisResult result = withReader.readAndAnalyze(
                        CaseAnalysisRequest.builder().caseId("case-r").referenceText(REFERENCE).build(), 2);

                assertEquals(3, result.ranked().size());
                verify(reader).read("case-r", 0);
                verify(reader).read("case-r", 1);
            }
        }

        @Test
        @DisplayName("readAndAnalyze without a reader should fail")
        void noReader() {
            assertThrows(IllegalStateException.class,
                    () -> analyzer.readAndAnalyze(CaseAnalysisRequest.builder().caseId("x").build(), 1));
        }

        @Test
        @DisplayName("A failing stage should mark the span as failed and propagate")
        void failureRecordedOnSpan() {
            TracingService tracing = mock(TracingService.class);
            Span span = mock(Span.class);
            when(tracing.startCaseSpan("case-1")).thenReturn(span);
            IllegalStateException failure = new IllegalStateException("rule failed");
            ScoringRule broken = new ScoringRule() {
                @Override
                public RuleOutcome apply(DateCandidate candidate, int frequency, ScoringContext context) {
                    throw failure;
                }

                @Override
                public String name() {
                    return "broken";
                }
            };

            try (ClaimDateAnalyzer failing = ClaimDateAnalyzer.builder()
                    .options(AnalysisOptions.builder().processingDate(PROCESSING_DATE).build())
                    .scorer(new RelevanceScorer(List.of(broken)))
                    .tracingService(tracing)
                    .build()) {
                assertSame(failure, assertThrows(IllegalStateException.class,
                        () -> failing.analyze(sampleRequest("case-1"))));
            }
            verify(span).fail(failure);
            verify(span).close();
        }
    }
}
