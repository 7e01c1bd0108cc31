package com.claim.dates.tracing;

import java.util.Map;

/**
 * Starts trace spans around case analysis. {@link NoOpTracingService} is the default.
 */
public interface TracingService {

    String CASE_SPAN = "claim.analyze";
    String CASE_ID_ATTRIBUTE = "caseId";

    Span startSpan(String operationName, Map<String, String> attributes);

    /**
     * Span for one {@code analyze} call, tagged with the case id.
     */
    default Span startCaseSpan(String caseId) {
        return startSpan(CASE_SPAN, Map.of(CASE_ID_ATTRIBUTE, caseId));
    }
}
