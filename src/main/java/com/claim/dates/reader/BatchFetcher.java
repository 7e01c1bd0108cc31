package com.claim.dates.reader;

import com.claim.dates.collect.BatchPayload;
import com.claim.dates.logging.LogContext;
import com.claim.dates.metrics.MetricsService;
import com.claim.dates.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Reads all batches of a case through a {@link DocumentReader}, at most
 * {@link ReaderConfig#maxConcurrency()} at a time, retrying failed batches with
 * exponential backoff. Results keep batch order.
 */
public class BatchFetcher implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(BatchFetcher.class);

    private final DocumentReader reader;
    private final ReaderConfig config;
    private final MetricsService metrics;
    private final ExecutorService executor;

    public BatchFetcher(DocumentReader reader) {
        this(reader, ReaderConfig.defaults(), new NoOpMetricsService());
    }

    public BatchFetcher(DocumentReader reader, ReaderConfig config, MetricsService metrics) {
        this.reader = reader;
        this.config = config;
        this.metrics = metrics != null ? metrics : new NoOpMetricsService();
        this.executor = Executors.newFixedThreadPool(config.maxConcurrency());
    }

    /**
     * @throws CaseProcessingException when any batch fails after all attempts, or on interruption
     */
    public List<BatchPayload> fetchAll(String caseId, int batchCount) {
        if (batchCount < 0) {
            throw new IllegalArgumentException("batchCount must be >= 0");
        }
        List<Future<BatchPayload>> futures = new ArrayList<>(batchCount);
        for (int i = 0; i < batchCount; i++) {
            int batchIndex = i;
            futures.add(executor.submit(() -> fetch(caseId, batchIndex)));
        }

        List<BatchPayload> payloads = new ArrayList<>(batchCount);
        try {
            for (Future<BatchPayload> future : futures) {
                payloads.add(future.get());
            }
        } catch (InterruptedException e) {
            futures.forEach(f -> f.cancel(true));
            Thread.currentThread().interrupt();
            throw new CaseProcessingException("Interrupted while reading case " + caseId, e);
        } catch (ExecutionException e) {
            futures.forEach(f -> f.cancel(true));
            if (e.getCause() instanceof CaseProcessingException cpe) {
                throw cpe;
            }
            throw new CaseProcessingException("Failed to read case " + caseId, e.getCause());
        }
        log.debug("reader.completed caseId={} batches={}", caseId, payloads.size());
        return payloads;
    }

    /**
     * Reads one batch with retries on the calling thread.
     *
     * @throws CaseProcessingException after {@link ReaderConfig#maxAttempts()} failed calls
     */
    public BatchPayload fetch(String caseId, int batchIndex) {
        try (LogContext ctx = LogContext.forBatch(caseId, batchIndex)) {
            RuntimeException lastFailure = null;
            for (int attempt = 1; attempt <= config.maxAttempts(); attempt++) {
                try {
                    BatchPayload payload = reader.read(caseId, batchIndex);
                    if (payload == null) {
                        throw new DocumentReaderException("Reader returned no payload");
                    }
                    return payload;
                } catch (RuntimeException e) {
                    lastFailure = e;
                    log.warn("reader.failed caseId={} batch={} attempt={} error={}",
                            caseId, batchIndex, attempt, e.getMessage());
                }

                if (attempt < config.maxAttempts()) {
                    metrics.incrementReaderRetry();
                    sleep(config.backoffForRetry(attempt), caseId, batchIndex);
                }
            }
            throw new CaseProcessingException("Failed to read batch " + batchIndex + " of case " + caseId
                    + " after " + config.maxAttempts() + " attempts", lastFailure);
        }
    }

    private static void sleep(long millis, String caseId, int batchIndex) {
        if (millis <= 0) {
            return;
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CaseProcessingException("Interrupted while retrying batch " + batchIndex
                    + " of case " + caseId, e);
        }
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
