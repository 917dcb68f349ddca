package com.koni.vitals.application.query;

import com.koni.vitals.domain.model.DeviceStatus;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Data Transfer Object representing a device registry entry.
 *
 * Contains:
 * - deviceId: identifier reported by the device
 * - firstSeen / lastSeen: earliest and latest accepted reading
 * - totalReadings: accepted readings, anomalous or not
 * - status: ACTIVE when the device reported within the liveness window
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class DeviceResponse {

    private String deviceId;
    private Instant firstSeen;
    private Instant lastSeen;
    private long totalReadings;
    private DeviceStatus status;
}
