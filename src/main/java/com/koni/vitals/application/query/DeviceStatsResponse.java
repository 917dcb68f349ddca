package com.koni.vitals.application.query;

import com.koni.vitals.domain.model.DeviceStatus;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Statistics of one device. anomalyRate is a percentage of totalReadings, 0 when there are none.
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class DeviceStatsResponse {

    private String deviceId;
    private long totalReadings;
    private long anomalies;
    private double anomalyRate;
    private Instant firstSeen;
    private Instant lastSeen;
    private DeviceStatus status;
}
