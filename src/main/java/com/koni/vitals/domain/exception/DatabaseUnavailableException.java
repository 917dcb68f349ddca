package com.koni.vitals.domain.exception;

/**
 * Exception thrown when a reading cannot be committed because the store is unreachable
 * or kept failing after retries. Nothing of the failed commit is visible afterwards.
 */
public class DatabaseUnavailableException extends RuntimeException {

    public DatabaseUnavailableException(String message) {
        super(message);
    }

    public DatabaseUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
