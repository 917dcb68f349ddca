package com.koni.vitals.domain.service;

import com.koni.vitals.domain.model.Alert;
import com.koni.vitals.domain.model.AlertSeverity;
import com.koni.vitals.domain.model.Reading;
import com.koni.vitals.domain.model.Verdict;

import java.util.Optional;

/**
 * Decides whether a verdict escalates to an alert.
 * Anomaly types map to a severity; only severities at or above the configured minimum escalate.
 */
public class AlertPolicy {

    private final AlertSeverity minimumSeverity;

    public AlertPolicy(AlertSeverity minimumSeverity) {
        if (minimumSeverity == null) {
            throw new IllegalArgumentException("Minimum severity cannot be null");
        }
        this.minimumSeverity = minimumSeverity;
    }

    /**
     * @param reading the classified reading
     * @param verdict its verdict
     * @return an unsaved alert, or empty when the verdict does not warrant one
     */
    public Optional<Alert> escalate(Reading reading, Verdict verdict) {
        if (!verdict.isAnomaly()) {
            return Optional.empty();
        }
        AlertSeverity severity = verdict.severity();
        if (severity == AlertSeverity.INFO || !severity.isAtLeast(minimumSeverity)) {
            return Optional.empty();
        }
        return Optional.of(new Alert(
                reading.getObservedAt(),
                reading.getDeviceId(),
                verdict.getAnomalyType(),
                severity,
                message(reading, verdict)
        ));
    }

    private String message(Reading reading, Verdict verdict) {
        return String.format("%s detected for device %s (heart_rate=%s, body_temp=%s, signal_strength=%s, battery_level=%s)",
                verdict.getAnomalyType(),
                reading.getDeviceId(),
                reading.getHeartRate(),
                reading.getBodyTemp(),
                reading.getSignalStrength(),
                reading.getBatteryLevel());
    }

    public AlertSeverity getMinimumSeverity() {
        return minimumSeverity;
    }
}
