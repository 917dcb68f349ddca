package com.koni.vitals.application.query;

import com.koni.vitals.domain.model.AnomalyType;
import com.koni.vitals.domain.model.DetectionSource;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Set;

/**
 * Data Transfer Object for one anomalous audit row.
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class AnomalyResponse {

    private Long id;
    private Instant timestamp;
    private String deviceId;
    private Double heartRate;
    private Double bodyTemp;
    private Double signalStrength;
    private Double batteryLevel;
    private AnomalyType anomalyType;
    private DetectionSource source;
    private Set<AnomalyType> ruleViolations;
    private String rawData;
}
