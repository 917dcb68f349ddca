package com.koni.vitals.domain.exception;

/**
 * Exception thrown when a read accessor or the alert resolution targets an unknown record.
 */
public class RecordNotFoundException extends RuntimeException {

    public RecordNotFoundException(String message) {
        super(message);
    }
}
