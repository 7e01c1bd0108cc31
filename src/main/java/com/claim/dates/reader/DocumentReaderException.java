package com.claim.dates.reader;

/**
 * Thrown by a {@link DocumentReader} when a batch could not be read.
 */
public class DocumentReaderException extends RuntimeException {

    public DocumentReaderException(String message) {
        super(message);
    }

    public DocumentReaderException(String message, Throwable cause) {
        super(message, cause);
    }
}
