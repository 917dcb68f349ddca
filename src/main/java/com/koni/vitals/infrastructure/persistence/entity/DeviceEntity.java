package com.koni.vitals.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

/**
 * JPA entity for the device registry.
 * Rows are created and updated through bulk statements in the registry adapter,
 * never through entity state, so concurrent readings cannot lose updates.
 */
@Entity
@Table(
    name = "devices",
    indexes = {
        @Index(name = "idx_devices_last_seen", columnList = "last_seen DESC")
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class DeviceEntity {

    @Id
    @Column(name = "device_id")
    private String deviceId;

    @Column(name = "first_seen", nullable = false)
    private Instant firstSeen;

    @Column(name = "last_seen", nullable = false)
    private Instant lastSeen;

    @Column(name = "total_readings", nullable = false)
    private Long totalReadings;

    @Column(name = "status", nullable = false)
    private String status;
}
