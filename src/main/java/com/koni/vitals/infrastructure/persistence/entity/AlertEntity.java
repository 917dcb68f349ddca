package com.koni.vitals.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

/**
 * JPA entity for escalation alerts. is_resolved is stored as 0/1.
 */
@Entity
@Table(
    name = "alerts",
    indexes = {
        @Index(name = "idx_alerts_resolved_timestamp", columnList = "is_resolved, `timestamp`")
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class AlertEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long id;

    @Column(name = "`timestamp`", nullable = false, updatable = false)
    private Instant timestamp;

    @Column(name = "device_id", nullable = false, updatable = false)
    private String deviceId;

    @Column(name = "alert_type", updatable = false)
    private String alertType;

    @Column(name = "severity", updatable = false)
    private String severity;

    @Column(name = "message", length = 1024, updatable = false)
    private String message;

    @Column(name = "is_resolved", nullable = false)
    private Integer isResolved;
}
