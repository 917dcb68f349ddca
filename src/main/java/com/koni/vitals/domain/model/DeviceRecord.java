package com.koni.vitals.domain.model;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.time.Duration;
import java.time.Instant;

/**
 * DeviceRecord representing the aggregate state the registry keeps per device.
 * The stored status is always ACTIVE; liveness is derived with {@link #statusAt(Instant, Duration)}.
 */
@Getter
@AllArgsConstructor
public class DeviceRecord {

    private final String deviceId;
    private final Instant firstSeen;
    private final Instant lastSeen;
    private final long totalReadings;
    private final DeviceStatus status;

    /**
     * Derives the liveness of the device at the given instant.
     *
     * @param now the reference instant
     * @param livenessWindow how long after its last reading a device still counts as active
     * @return ACTIVE when the device reported within the window, INACTIVE otherwise
     */
    public DeviceStatus statusAt(Instant now, Duration livenessWindow) {
        if (lastSeen == null || lastSeen.plus(livenessWindow).isBefore(now)) {
            return DeviceStatus.INACTIVE;
        }
        return DeviceStatus.ACTIVE;
    }

    @Override
    public String toString() {
        return "DeviceRecord{" +
                "deviceId='" + deviceId + '\'' +
                ", firstSeen=" + firstSeen +
                ", lastSeen=" + lastSeen +
                ", totalReadings=" + totalReadings +
                ", status=" + status +
                '}';
    }
}
