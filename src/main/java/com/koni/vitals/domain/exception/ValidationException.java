package com.koni.vitals.domain.exception;

/**
 * Exception thrown when an inbound payload carries a value of the wrong type, or a query
 * carries an invalid argument. Missing reading fields are not a validation failure;
 * they are classified as MISSING_FIELDS.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
