package com.koni.vitals.domain.exception;

/**
 * Exception thrown when an ingestion call is aborted before its commit began.
 * Nothing of the reading was written, so the caller may deliver it again.
 */
public class IngestionCancelledException extends RuntimeException {

    public IngestionCancelledException(String message) {
        super(message);
    }
}
