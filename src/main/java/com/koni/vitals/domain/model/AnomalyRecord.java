package com.koni.vitals.domain.model;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.time.Instant;
import java.util.Set;

/**
 * Persisted audit fact: one accepted reading together with its verdict.
 * Written once and never modified; non-anomalous readings are recorded too.
 */
@Getter
@AllArgsConstructor
public class AnomalyRecord {

    private final Long id;
    private final Instant timestamp;
    private final String deviceId;
    private final Double heartRate;
    private final Double bodyTemp;
    private final Double signalStrength;
    private final Double batteryLevel;
    private final boolean anomaly;
    private final AnomalyType anomalyType;
    private final DetectionSource source;
    private final Set<AnomalyType> ruleViolations;
    private final String rawData;
}
