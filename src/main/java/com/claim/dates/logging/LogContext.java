package com.claim.dates.logging;

import org.slf4j.MDC;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Scoped SLF4J MDC entries, reverted on {@link #close()}.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forCase(caseId)) {
 *     log.info("case.analyzed caseId={} accepted={}", caseId, accepted);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    // previous value per key, null when the key was absent
    private final Map<String, String> previous = new LinkedHashMap<>();

    private LogContext() {
    }

    public static LogContext forCase(String caseId) {
        return new LogContext()
                .with("caseId", caseId)
                .with("operation", "analyze");
    }

    /**
     * Context for reading one document batch of a case.
     */
    public static LogContext forBatch(String caseId, int batchIndex) {
        return new LogContext()
                .with("caseId", caseId)
                .with("batchIndex", Integer.toString(batchIndex))
                .with("operation", "read");
    }

    public static LogContext forEvaluation(String runId) {
        return new LogContext()
                .with("evaluationRunId", runId)
                .with("operation", "evaluate");
    }

    public static String generateCaseId() {
        return UUID.randomUUID().toString();
    }

    public LogContext with(String key, String value) {
        if (!previous.containsKey(key)) {
            previous.put(key, MDC.get(key));
        }
        MDC.put(key, value);
        return this;
    }

    /**
     * Restores every key to the value it had before this context set it.
     */
    @Override
    public void close() {
        previous.forEach((key, value) -> {
            if (value == null) {
                MDC.remove(key);
            } else {
                MDC.put(key, value);
            }
        });
        previous.clear();
    }
}
