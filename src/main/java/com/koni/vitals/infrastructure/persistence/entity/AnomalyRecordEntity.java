package com.koni.vitals.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

/**
 * JPA entity for the append-only audit log.
 * One row per accepted reading, anomalous or not; is_anomaly is stored as 0/1.
 */
@Entity
@Table(
    name = "anomalies",
    indexes = {
        @Index(name = "idx_anomalies_device_timestamp", columnList = "device_id, `timestamp`"),
        @Index(name = "idx_anomalies_flag_timestamp", columnList = "is_anomaly, `timestamp`")
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class AnomalyRecordEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long id;

    @Column(name = "`timestamp`", nullable = false, updatable = false)
    private Instant timestamp;

    @Column(name = "device_id", nullable = false, updatable = false)
    private String deviceId;

    @Column(name = "heart_rate", updatable = false)
    private Double heartRate;

    @Column(name = "body_temp", updatable = false)
    private Double bodyTemp;

    @Column(name = "signal_strength", updatable = false)
    private Double signalStrength;

    @Column(name = "battery_level", updatable = false)
    private Double batteryLevel;

    @Column(name = "is_anomaly", nullable = false, updatable = false)
    private Integer isAnomaly;

    @Column(name = "anomaly_type", updatable = false)
    private String anomalyType;

    @Column(name = "detection_source", nullable = false, updatable = false)
    private String detectionSource;

    @Column(name = "rule_violations", updatable = false)
    private String ruleViolations;

    @Column(name = "raw_data", length = 65535, updatable = false)
    private String rawData;
}
