package com.koni.vitals.domain.model;

/**
 * Severity of an alert raised on top of an anomalous reading.
 * Constants are declared from least to most severe so that ordinal comparison
 * reflects escalation order.
 */
public enum AlertSeverity {
    INFO,
    WARNING,
    CRITICAL;

    /**
     * @param other the severity to compare against
     * @return true if this severity is the same as or more severe than {@code other}
     */
    public boolean isAtLeast(AlertSeverity other) {
        return compareTo(other) >= 0;
    }
}
