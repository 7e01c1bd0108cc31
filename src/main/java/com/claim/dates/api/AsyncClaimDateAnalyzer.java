package com.claim.dates.api;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Runs independent cases concurrently on a fixed thread pool. Each case is still
 * processed sequentially; futures fail with a {@link java.util.concurrent.TimeoutException}
 * after the configured timeout.
 */
public class AsyncClaimDateAnalyzer implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(AsyncClaimDateAnalyzer.class);

    private final ClaimDateAnalyzer analyzer;
    private final ExecutorService executor;
    private final long timeoutMs;

    public AsyncClaimDateAnalyzer(ClaimDateAnalyzer analyzer, long timeoutMs) {
        this(analyzer, timeoutMs, Runtime.getRuntime().availableProcessors());
    }

    public AsyncClaimDateAnalyzer(ClaimDateAnalyzer analyzer, long timeoutMs, int poolSize) {
        if (poolSize <= 0) {
            throw new IllegalArgumentException("poolSize must be > 0");
        }
        this.analyzer = analyzer;
        this.timeoutMs = timeoutMs;
        this.executor = Executors.newFixedThreadPool(poolSize);
    }

    public CompletableFuture<CaseAnalysisResult> analyzeAsync(CaseAnalysisRequest request) {
        return CompletableFuture.supplyAsync(() -> analyzer.analyze(request), executor)
                .orTimeout(timeoutMs, TimeUnit.MILLISECONDS);
    }

    /**
     * Analyzes all requests; results keep request order.
     */
    public CompletableFuture<List<CaseAnalysisResult>> analyzeBatchAsync(List<CaseAnalysisRequest> requests) {
        List<CompletableFuture<CaseAnalysisResult>> futures = requests.stream()
                .map(this::analyzeAsync)
                .toList();
        return joinAll(futures);
    }

    /**
     * Like {@link #analyzeBatchAsync(List)} with at most {@code maxConcurrency} cases in flight.
     */
    public CompletableFuture<List<CaseAnalysisResult>> analyzeBatchAsync(List<CaseAnalysisRequest> requests,
                                                                         int maxConcurrency) {
        if (maxConcurrency <= 0) {
            throw new IllegalArgumentException("maxConcurrency must be > 0");
        }
        Semaphore permits = new Semaphore(maxConcurrency);

        List<CompletableFuture<CaseAnalysisResult>> futures = requests.stream()
                .map(request -> CompletableFuture.supplyAsync(() -> {
                    try {
                        permits.acquire();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        throw new CompletionException(e);
                    }
                    try {
                        return analyzer.analyze(request);
                    } finally {
                        permits.release();
                    }
                }, executor).orTimeout(timeoutMs, TimeUnit.MILLISECONDS))
                .toList();
        log.debug("async.batch-submitted cases={} maxConcurrency={}", requests.size(), maxConcurrency);
        return joinAll(futures);
    }

    private static CompletableFuture<List<CaseAnalysisResult>> joinAll(
            List<CompletableFuture<CaseAnalysisResult>> futures) {
        return CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                .thenApply(v -> futures.stream().map(CompletableFuture::join).toList());
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
