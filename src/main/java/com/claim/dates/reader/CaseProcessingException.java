package com.claim.dates.reader;

/**
 * A case could not be processed, typically because reading its documents kept failing.
 * The triggering failure is attached as the cause.
 */
public class CaseProcessingException extends RuntimeException {

    public CaseProcessingException(String message) {
        super(message);
    }

    public CaseProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
