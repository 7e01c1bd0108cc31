package com.claim.dates.tracing;

import java.util.Map;

/**
 * Used when the analyzer is built without tracing; every case shares one inert span.
 */
public class NoOpTracingService implements TracingService {

    static final Span INERT_CASE_SPAN = new Span() {
        @Override
        public void setAttribute(String key, String value) {
        }

        @Override
        public void setAttribute(String key, long value) {
        }

        @Override
        public void succeed() {
        }

        @Override
        public void fail(Throwable cause) {
        }

        @Override
        public void close() {
        }
    };

    @Override
    public Span startSpan(String operationName, Map<String, String> attributes) {
        return INERT_CASE_SPAN;
    }
}
