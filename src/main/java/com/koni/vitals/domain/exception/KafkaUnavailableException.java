package com.koni.vitals.domain.exception;

/**
 * Exception thrown when the message broker cannot be reached, for example while
 * inspecting or replaying the dead letter topic.
 */
public class KafkaUnavailableException extends RuntimeException {

    public KafkaUnavailableException(String message) {
        super(message);
    }

    public KafkaUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
