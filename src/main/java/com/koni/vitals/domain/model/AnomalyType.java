package com.koni.vitals.domain.model;

/**
 * Closed set of anomaly codes a verdict can carry.
 *
 * The declaration order of the four rule codes is their reporting precedence:
 * when several medical-range rules fire for the same reading, the one declared
 * first is reported. {@link java.util.EnumSet} iteration follows this order.
 */
public enum AnomalyType {
    OUT_OF_RANGE_HR(AlertSeverity.CRITICAL),
    OUT_OF_RANGE_TEMP(AlertSeverity.CRITICAL),
    LOW_BATTERY(AlertSeverity.WARNING),
    WEAK_SIGNAL(AlertSeverity.WARNING),
    ML_ANOMALY(AlertSeverity.CRITICAL),
    MISSING_FIELDS(AlertSeverity.INFO);

    private final AlertSeverity severity;

    AnomalyType(AlertSeverity severity) {
        this.severity = severity;
    }

    public AlertSeverity getSeverity() {
        return severity;
    }
}
