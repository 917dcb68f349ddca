package com.koni.vitals.infrastructure.web.exception;

import com.koni.vitals.domain.exception.DatabaseUnavailableException;
import com.koni.vitals.domain.exception.IngestionCancelledException;
import com.koni.vitals.domain.exception.KafkaUnavailableException;
import com.koni.vitals.domain.exception.RecordNotFoundException;
import com.koni.vitals.domain.exception.ValidationException;
import com.koni.vitals.infrastructure.web.dto.ErrorResponse;
import jakarta.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Global exception handler for REST API endpoints.
 * Provides consistent error responses and appropriate HTTP status codes.
 *
 * Rejected readings are not exceptions; the ingestion controller answers them itself.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    /**
     * Returns 400 Bad Request when a query argument is invalid.
     */
    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(ValidationException ex) {
        log.warn("Validation error: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    /**
     * Returns 400 Bad Request when the body is not a decodable JSON object.
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
        log.warn("Undecodable request body: {}", ex.getMostSpecificCause().getMessage());
        return error(HttpStatus.BAD_REQUEST, "Request body must be a JSON object");
    }

    /**
     * Returns 400 Bad Request when a request parameter violates its constraints.
     */
    @ExceptionHandler({HandlerMethodValidationException.class, ConstraintViolationException.class})
    public ResponseEntity<ErrorResponse> handleConstraintViolation(Exception ex) {
        log.warn("Constraint violation: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, "Invalid request parameter");
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        log.warn("Invalid request parameter: name={}, value={}", ex.getName(), ex.getValue());
        return error(HttpStatus.BAD_REQUEST, "Invalid value for parameter " + ex.getName());
    }

    @ExceptionHandler(RecordNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleRecordNotFoundException(RecordNotFoundException ex) {
        log.info("Not found: {}", ex.getMessage());
        return error(HttpStatus.NOT_FOUND, ex.getMessage());
    }

    /**
     * Returns 503 Service Unavailable when a reading could not be made durable.
     */
    @ExceptionHandler(DatabaseUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleDatabaseUnavailableException(DatabaseUnavailableException ex) {
        log.error("Database unavailable: {}", ex.getMessage(), ex);
        return error(HttpStatus.SERVICE_UNAVAILABLE, "Service temporarily unavailable");
    }

    /**
     * Returns 503 Service Unavailable when ingestion was aborted before commit; the client may resend.
     */
    @ExceptionHandler(IngestionCancelledException.class)
    public ResponseEntity<ErrorResponse> handleIngestionCancelledException(IngestionCancelledException ex) {
        log.warn("Ingestion cancelled: {}", ex.getMessage());
        return error(HttpStatus.SERVICE_UNAVAILABLE, "Ingestion cancelled, retry the request");
    }

    @ExceptionHandler(KafkaUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleKafkaUnavailableException(KafkaUnavailableException ex) {
        log.error("Kafka unavailable: {}", ex.getMessage(), ex);
        return error(HttpStatus.SERVICE_UNAVAILABLE, "Service temporarily unavailable");
    }

    /**
     * Returns 500 Internal Server Error for unhandled exceptions.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex) {
        log.error("Unexpected error occurred: {}", ex.getMessage(), ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error");
    }

    private ResponseEntity<ErrorResponse> error(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(new ErrorResponse(status.value(), message));
    }
}
