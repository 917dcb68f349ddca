package com.koni.vitals.domain.service;

import com.koni.vitals.domain.exception.ValidationException;
import com.koni.vitals.domain.model.Reading;

import java.time.Instant;
import java.util.Map;

/**
 * Turns a decoded payload into a typed {@link Reading}.
 *
 * Absent numeric fields are tolerated and produce an incomplete reading. A numeric field
 * that is present with a non-numeric value fails the whole ingestion call.
 */
public class ReadingValidator {

    static final String DEVICE_ID = "device_id";
    static final String HEART_RATE = "heart_rate";
    static final String BODY_TEMP = "body_temp";
    static final String SIGNAL_STRENGTH = "signal_strength";
    static final String BATTERY_LEVEL = "battery_level";

    /** Width of the device_id columns. */
    static final int MAX_DEVICE_ID_LENGTH = 255;

    /**
     * Validates the payload and builds the reading.
     *
     * @param payload the decoded key/value payload
     * @param arrivalTime when the transport received the payload; becomes the reading timestamp
     * @return the reading, possibly incomplete
     * @throws ValidationException if the payload is null, the device id is too long or a numeric field has the wrong type
     */
    public Reading validate(Map<String, Object> payload, Instant arrivalTime) {
        if (payload == null) {
            throw new ValidationException("payload is required");
        }
        if (arrivalTime == null) {
            throw new IllegalArgumentException("Arrival time cannot be null");
        }

        return new Reading(
                deviceId(payload.get(DEVICE_ID)),
                arrivalTime,
                numeric(payload, HEART_RATE),
                numeric(payload, BODY_TEMP),
                numeric(payload, SIGNAL_STRENGTH),
                numeric(payload, BATTERY_LEVEL),
                payload
        );
    }

    private String deviceId(Object value) {
        if (value == null) {
            return Reading.UNKNOWN_DEVICE;
        }
        String deviceId = String.valueOf(value).trim();
        if (deviceId.length() > MAX_DEVICE_ID_LENGTH) {
            throw new ValidationException(DEVICE_ID + " must be at most " + MAX_DEVICE_ID_LENGTH + " characters");
        }
        return deviceId.isEmpty() ? Reading.UNKNOWN_DEVICE : deviceId;
    }

    // null means absent; JSON null is treated the same way as a missing key
    private Double numeric(Map<String, Object> payload, String field) {
        Object value = payload.get(field);
        if (value == null) {
            return null;
        }
        if (!(value instanceof Number)) {
            throw new ValidationException(field + " must be numeric but was: " + value);
        }
        double number = ((Number) value).doubleValue();
        if (Double.isNaN(number) || Double.isInfinite(number)) {
            throw new ValidationException(field + " must be a finite number but was: " + value);
        }
        return number;
    }
}
