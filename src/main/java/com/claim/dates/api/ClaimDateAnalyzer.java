package com.claim.dates.api;

import com.claim.dates.cache.CacheConfig;
import com.claim.dates.cache.CaseFingerprint;
import com.claim.dates.cache.NoOpResultCache;
import com.claim.dates.cache.ResultCache;
import com.claim.dates.classify.RoleClassifier;
import com.claim.dates.collect.CandidateCollector;
import com.claim.dates.collect.CollectionResult;
import com.claim.dates.core.model.DateCandidate;
import com.claim.dates.core.model.InvestigationRisk;
import com.claim.dates.core.model.MatchResult;
import com.claim.dates.core.model.ScoredCandidate;
import com.claim.dates.dedup.CandidateDeduplicator;
import com.claim.dates.dedup.DeduplicatedCandidates;
import com.claim.dates.enrollment.EnrollmentDateResolver;
import com.claim.dates.enrollment.EnrollmentEvidence;
import com.claim.dates.enrollment.EnrollmentProximityFlagger;
import com.claim.dates.enrollment.EnrollmentResolution;
import com.claim.dates.enrollment.ProximityReport;
import com.claim.dates.evaluation.AggregateEvaluation;
import com.claim.dates.evaluation.GroundTruthEvaluator;
import com.claim.dates.logging.LogContext;
import com.claim.dates.metrics.MetricsService;
import com.claim.dates.metrics.NoOpMetricsService;
import com.claim.dates.reader.BatchFetcher;
import com.claim.dates.reader.DocumentReader;
import com.claim.dates.reader.ReaderConfig;
import com.claim.dates.risk.DoctorShoppingDetector;
import com.claim.dates.risk.DoctorShoppingFinding;
import com.claim.dates.risk.ProgressivityAnalyzer;
import com.claim.dates.risk.ProgressivityClassification;
import com.claim.dates.risk.ProviderVisit;
import com.claim.dates.risk.RiskAggregator;
import com.claim.dates.risk.RiskSignals;
import com.claim.dates.rules.DateNormalizationEngine;
import com.claim.dates.rules.DefaultDateNormalizationRules;
import com.claim.dates.scoring.KeywordDictionary;
import com.claim.dates.scoring.RelevanceScorer;
import com.claim.dates.scoring.ScoringContext;
import com.claim.dates.scoring.ScoringResult;
import com.claim.dates.tracing.NoOpTracingService;
import com.claim.dates.tracing.Span;
import com.claim.dates.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Main entry point: turns the date payloads of one claim case into ranked relevant
 * dates, an optional ground-truth comparison, pre-enrollment proximity flags and an
 * investigation risk verdict.
 *
 * <p>Usage:</p>
 * <pre>
 * try (ClaimDateAnalyzer analyzer = ClaimDateAnalyzer.builder()
 *         .options(AnalysisOptions.builder().acceptanceThreshold(25).build())
 *         .build()) {
 *     CaseAnalysisResult result = analyzer.analyze(request);
 * }
 * </pre>
 *
 * <p>Stages run sequentially per case: collect, deduplicate, classify, score, evaluate,
 * resolve enrollment, flag proximity, aggregate risk. Instances are thread-safe.</p>
 */
public class ClaimDateAnalyzer implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ClaimDateAnalyzer.class);

    private final AnalysisOptions options;
    private final CandidateCollector collector;
    private final CandidateDeduplicator deduplicator;
    private final RoleClassifier classifier;
    private final RelevanceScorer scorer;
    private final KeywordDictionary keywords;
    private final GroundTruthEvaluator evaluator;
    private final EnrollmentDateResolver enrollmentResolver;
    private final EnrollmentProximityFlagger proximityFlagger;
    private final DoctorShoppingDetector doctorShoppingDetector;
    private final ProgressivityAnalyzer progressivityAnalyzer;
    private final RiskAggregator riskAggregator;
    private final ResultCache cache;
    private final MetricsService metricsService;
    private final TracingService tracingService;
    private final BatchFetcher batchFetcher;

    private ClaimDateAnalyzer(Builder builder) {
        this.options = builder.options;
        this.collector = new CandidateCollector(builder.normalizationEngine != null
                ? builder.normalizationEngine : DefaultDateNormalizationRules.createDefaultEngine());
        this.deduplicator = new CandidateDeduplicator();
        this.classifier = new RoleClassifier();
        this.scorer = builder.scorer != null ? builder.scorer : new RelevanceScorer();
        this.keywords = builder.keywords != null ? builder.keywords : KeywordDictionary.defaults();
        this.evaluator = new GroundTruthEvaluator();
        this.enrollmentResolver = builder.enrollmentResolver != null
                ? builder.enrollmentResolver : new EnrollmentDateResolver();
        this.proximityFlagger = new EnrollmentProximityFlagger(options.getProximityThresholds());
        this.doctorShoppingDetector = new DoctorShoppingDetector();
        this.progressivityAnalyzer = new ProgressivityAnalyzer();
        this.riskAggregator = new RiskAggregator(options.getRiskWeights());
        this.cache = builder.cache != null ? builder.cache : new NoOpResultCache();
        this.metricsService = builder.metricsService != null ? builder.metricsService : new NoOpMetricsService();
        this.tracingService = builder.tracingService != null ? builder.tracingService : new NoOpTracingService();
        this.batchFetcher = builder.documentReader != null
                ? new BatchFetcher(builder.documentReader, builder.readerConfig, metricsService)
                : null;
        log.debug("ClaimDateAnalyzer initialized options={}", options);
    }

    /**
     * Analyzes a case whose batch payloads are already in the request.
     */
    public CaseAnalysisResult analyze(CaseAnalysisRequest request) {
        LocalDate processingDate = options.processingDate();
        long start = System.nanoTime();

        try (LogContext ctx = LogContext.forCase(request.getCaseId());
             Span span = tracingService.startCaseSpan(request.getCaseId())) {
            String fingerprint = null;
            if (!(cache instanceof NoOpResultCache)) {
                fingerprint = CaseFingerprint.of(request, processingDate);
                Optional<CaseAnalysisResult> cached = cache.get(fingerprint);
                if (cached.isPresent()) {
                    metricsService.recordCacheHit();
                    metricsService.recordAnalysisDuration(true, Duration.ofNanos(System.nanoTime() - start));
                    span.setAttribute("cached", "true");
                    span.succeed();
                    log.debug("case.cache-hit caseId={}", request.getCaseId());
                    return cached.get();
                }
                metricsService.recordCacheMiss();
            }

            try {
                CaseAnalysisResult result = compute(request, processingDate);
                if (fingerprint != null) {
                    cache.put(fingerprint, result);
                }
                metricsService.recordAnalysisDuration(false, Duration.ofNanos(System.nanoTime() - start));
                span.setAttribute("accepted", result.ranked().size());
                span.setAttribute("riskLevel", result.risk().riskLevel().name());
                span.succeed();
                log.info("case.analyzed caseId={} accepted={} scored={} riskLevel={} coverage={}",
                        request.getCaseId(), result.ranked().size(), result.scored().size(),
                        result.risk().riskLevel(), result.matchResult().formattedCoverage());
                return result;
            } catch (RuntimeException e) {
                span.fail(e);
                log.error("case.failed caseId={} error={}", request.getCaseId(), e.getMessage());
                throw e;
            }
        }
    }

    /**
     * Reads {@code batchCount} batches through the configured {@link DocumentReader},
     * then analyzes them together with the rest of the request.
     *
     * @throws IllegalStateException                          if no reader was configured
     * @throws com.claim.dates.reader.CaseProcessingException if reading fails after retries
     */
    public CaseAnalysisResult readAndAnalyze(CaseAnalysisRequest request, int batchCount) {
        if (batchFetcher == null) {
            throw new IllegalStateException("No DocumentReader configured");
        }
        return analyze(request.withBatches(batchFetcher.fetchAll(request.getCaseId(), batchCount)));
    }

    /**
     * Analyzes every request and pools coverage and precision across them.
     * Cases without reference text are counted as skipped.
     */
    public AggregateEvaluation evaluateAll(List<CaseAnalysisRequest> requests) {
        String runId = LogContext.generateCaseId();
        try (LogContext ctx = LogContext.forEvaluation(runId)) {
            AggregateEvaluation aggregate = AggregateEvaluation.empty();
            for (CaseAnalysisRequest request : requests) {
                aggregate = aggregate.plus(analyze(request).matchResult());
            }
            log.info("evaluation.completed runId={} evaluated={} skipped={} coverage={} precision={}",
                    runId, aggregate.evaluatedCases(), aggregate.skippedCases(),
                    aggregate.formattedCoverage(), aggregate.formattedPrecision());
            return aggregate;
        }
    }

    private CaseAnalysisResult compute(CaseAnalysisRequest request, LocalDate processingDate) {
        CollectionResult collected = collector.collect(request.getBatches());
        metricsService.recordCandidatesCollected(collected.candidates().size());
        metricsService.recordCandidatesDropped(collected.droppedCount());

        DeduplicatedCandidates unique = deduplicator.deduplicate(collected.candidates());
        metricsService.recordDuplicatesCollapsed(unique.collapsedCount());

        List<DateCandidate> classified = classifier.classify(unique.retained());
        ScoringContext context = new ScoringContext(processingDate, request.getClaimDate().orElse(null),
                options.getScoringWeights(), keywords);
        ScoringResult scoring = scorer.scoreAll(classified, unique, context);
        metricsService.recordScoringOutcome(scoring.acceptedCount(), scoring.rejectedCount());

        MatchResult match = evaluator.evaluate(request.getReferenceText().orElse(null), scoring.ranked());

        // vetoed dates are out of range and must not anchor enrollment or be flagged
        List<ScoredCandidate> plausible = scoring.scored().stream()
                .filter(s -> !s.breakdown().isVetoed())
                .toList();
        EnrollmentResolution enrollment = enrollmentResolver.resolve(
                new EnrollmentEvidence(plausible, request.getSuppliedEnrollmentDate().orElse(null)));
        ProximityReport proximity = proximityFlagger.flag(plausible, enrollment);

        InvestigationRisk risk = riskAggregator.aggregate(deriveSignals(request), proximity);
        metricsService.incrementRiskLevel(risk.riskLevel());

        CollectionStats stats = new CollectionStats(collected.rawCount(), collected.candidates().size(),
                collected.droppedCount(), unique.retained().size(), unique.collapsedCount());
        return new CaseAnalysisResult(request.getCaseId(), processingDate, scoring.ranked(), scoring.scored(),
                match, proximity, risk, stats);
    }

    /**
     * Fills doctor-shopping and progressivity signals from the visit history when the
     * caller supplied visits but not the signals themselves.
     */
    private RiskSignals deriveSignals(CaseAnalysisRequest request) {
        RiskSignals signals = request.getRiskSignals();
        List<ProviderVisit> visits = request.getProviderVisits();
        if (visits.isEmpty()) {
            return signals;
        }
        RiskSignals.Builder derived = RiskSignals.builder(signals);
        if (signals.getDoctorShopping().equals(DoctorShoppingFinding.none())) {
            derived.doctorShopping(doctorShoppingDetector.detect(visits));
        }
        if (signals.getProgressivity() == ProgressivityClassification.NOT_ANALYZED) {
            derived.progressivity(progressivityAnalyzer.classify(visits.stream().map(ProviderVisit::date).toList()));
        }
        return derived.build();
    }

    public AnalysisOptions getOptions() {
        return options;
    }

    public ResultCache getCache() {
        return cache;
    }

    /**
     * Asynchronous view of this analyzer. The caller owns the returned instance and must close it.
     */
    public AsyncClaimDateAnalyzer async() {
        return new AsyncClaimDateAnalyzer(this, options.getAsyncTimeoutMs());
    }

    @Override
    public void close() {
        if (batchFetcher != null) {
            batchFetcher.close();
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private AnalysisOptions options = AnalysisOptions.defaults();
        private DateNormalizationEngine normalizationEngine;
        private RelevanceScorer scorer;
        private KeywordDictionary keywords;
        private EnrollmentDateResolver enrollmentResolver;
        private ResultCache cache;
        private MetricsService metricsService;
        private TracingService tracingService;
        private DocumentReader documentReader;
        private ReaderConfig readerConfig = ReaderConfig.defaults();

        public Builder options(AnalysisOptions options) {
            this.options = options;
            return this;
        }

        /**
         * Sets a custom date normalization engine for raw payload values.
         */
        public Builder normalizationEngine(DateNormalizationEngine engine) {
            this.normalizationEngine = engine;
            return this;
        }

        /**
         * Replaces the scorer, e.g. one built with {@link RelevanceScorer#withRules}.
         */
        public Builder scorer(RelevanceScorer scorer) {
            this.scorer = scorer;
            return this;
        }

        public Builder keywords(KeywordDictionary keywords) {
            this.keywords = keywords;
            return this;
        }

        public Builder enrollmentResolver(EnrollmentDateResolver resolver) {
            this.enrollmentResolver = resolver;
            return this;
        }

        public Builder cache(ResultCache cache) {
            this.cache = cache;
            return this;
        }

        public Builder cacheConfig(CacheConfig config) {
            this.cache = ResultCache.create(config);
            return this;
        }

        /**
         * Defaults to {@link NoOpMetricsService} if not set.
         */
        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        /**
         * Defaults to {@link NoOpTracingService} if not set.
         */
        public Builder tracingService(TracingService tracingService) {
            this.tracingService = tracingService;
            return this;
        }

        public Builder documentReader(DocumentReader reader) {
            this.documentReader = reader;
            return this;
        }

        public Builder readerConfig(ReaderConfig readerConfig) {
            this.readerConfig = readerConfig;
            return this;
        }

        public ClaimDateAnalyzer build() {
            if (options == null) {
                throw new IllegalStateException("AnalysisOptions are required");
            }
            return new ClaimDateAnalyzer(this);
        }
    }
}
