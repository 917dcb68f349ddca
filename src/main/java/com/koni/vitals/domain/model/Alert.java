package com.koni.vitals.domain.model;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.time.Instant;

/**
 * Escalation raised for an anomalous reading whose severity warrants attention.
 * The only mutation after creation is resolution.
 */
@Getter
@AllArgsConstructor
public class Alert {

    private final Long id;
    private final Instant timestamp;
    private final String deviceId;
    private final AnomalyType alertType;
    private final AlertSeverity severity;
    private final String message;
    private final boolean resolved;

    /**
     * Creates an unsaved, unresolved alert.
     */
    public Alert(Instant timestamp, String deviceId, AnomalyType alertType, AlertSeverity severity, String message) {
        this(null, timestamp, deviceId, alertType, severity, message, false);
    }
}
