package com.claim.dates.reader;

/**
 * Concurrency and retry settings for document reading.
 *
 * @param maxConcurrency   maximum batches read at the same time
 * @param maxAttempts      total attempts per batch, first call included
 * @param initialBackoffMs delay before the first retry; doubled on each further retry
 * @param maxBackoffMs     upper bound of the retry delay
 */
public record ReaderConfig(int maxConcurrency, int maxAttempts, long initialBackoffMs, long maxBackoffMs) {

    public ReaderConfig {
        if (maxConcurrency <= 0) {
            throw new IllegalArgumentException("maxConcurrency must be > 0");
        }
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be > 0");
        }
        if (initialBackoffMs < 0) {
            throw new IllegalArgumentException("initialBackoffMs must be >= 0");
        }
        if (maxBackoffMs < initialBackoffMs) {
            throw new IllegalArgumentException("maxBackoffMs must be >= initialBackoffMs");
        }
    }

    /**
     * 4 concurrent reads, 3 attempts, 200ms initial backoff capped at 2s.
     */
    public static ReaderConfig defaults() {
        return new ReaderConfig(4, 3, 200, 2_000);
    }

    /**
     * Delay before the given retry (1-based).
     */
    public long backoffForRetry(int retry) {
        long delay = initialBackoffMs;
        for (int i = 1; i < retry && delay < maxBackoffMs; i++) {
            delay *= 2;
        }
        return Math.min(delay, maxBackoffMs);
    }
}
