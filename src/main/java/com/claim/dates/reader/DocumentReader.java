package com.claim.dates.reader;

import com.claim.dates.collect.BatchPayload;

/**
 * Service provider interface for the external document-reading service that turns
 * one batch of a case's pages into a date payload.
 * Implementations may fail transiently; callers retry.
 */
public interface DocumentReader {

    /**
     * Reads one batch.
     *
     * @param caseId     identifier of the case
     * @param batchIndex 0-based batch index
     * @return the batch payload, never null
     * @throws DocumentReaderException when the batch cannot be read
     */
    BatchPayload read(String caseId, int batchIndex);
}
