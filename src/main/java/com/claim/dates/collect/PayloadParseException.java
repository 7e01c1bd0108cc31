package com.claim.dates.collect;

/**
 * Runtime exception thrown when a reader payload is not valid JSON
 * or does not have the expected batch structure.
 */
public class PayloadParseException extends RuntimeException {

    public PayloadParseException(String message) {
        super(message);
    }

    public PayloadParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
