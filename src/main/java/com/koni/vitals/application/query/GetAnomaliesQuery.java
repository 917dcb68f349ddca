package com.koni.vitals.application.query;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Optional;

/**
 * Query for anomalous readings of the last hours, optionally for a single device.
 */
@Getter
@AllArgsConstructor
public class GetAnomaliesQuery {

    private final int hours;
    private final String deviceId;

    public Optional<String> deviceIdFilter() {
        return deviceId == null || deviceId.isBlank() ? Optional.empty() : Optional.of(deviceId);
    }
}
