package com.koni.vitals.domain.model;

import lombok.Getter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reading value object representing one telemetry sample received from a device.
 * Immutable once built by the validator; numeric fields are null when the payload
 * did not carry them.
 */
@Getter
public final class Reading {

    public static final String UNKNOWN_DEVICE = "UNKNOWN";

    private final String deviceId;
    private final Instant observedAt;
    private final Double heartRate;
    private final Double bodyTemp;
    private final Double signalStrength;
    private final Double batteryLevel;
    private final Map<String, Object> rawPayload;

    /**
     * Creates a new Reading.
     *
     * @param deviceId the device identifier, never blank
     * @param observedAt the time the pipeline accepted the reading
     * @param heartRate heart rate in bpm, or null if absent
     * @param bodyTemp body temperature in °C, or null if absent
     * @param signalStrength signal strength in dBm, or null if absent
     * @param batteryLevel battery level in percent, or null if absent
     * @param rawPayload the decoded payload exactly as received
     */
    public Reading(String deviceId,
                   Instant observedAt,
                   Double heartRate,
                   Double bodyTemp,
                   Double signalStrength,
                   Double batteryLevel,
                   Map<String, Object> rawPayload) {
        this.deviceId = deviceId;
        this.observedAt = observedAt;
        this.heartRate = heartRate;
        this.bodyTemp = bodyTemp;
        this.signalStrength = signalStrength;
        this.batteryLevel = batteryLevel;
        this.rawPayload = Collections.unmodifiableMap(new LinkedHashMap<>(rawPayload));
    }

    /**
     * Returns the complete vital signs, or empty when at least one field is missing.
     * An empty result means the reading must be classified as MISSING_FIELDS.
     */
    public Optional<VitalSigns> vitals() {
        if (!isComplete()) {
            return Optional.empty();
        }
        return Optional.of(new VitalSigns(heartRate, bodyTemp, signalStrength, batteryLevel));
    }

    public boolean isComplete() {
        return heartRate != null && bodyTemp != null && signalStrength != null && batteryLevel != null;
    }

    /**
     * @return payload keys of the numeric fields that were absent, in feature order
     */
    public List<String> missingFields() {
        List<String> missing = new ArrayList<>();
        if (heartRate == null) {
            missing.add("heart_rate");
        }
        if (bodyTemp == null) {
            missing.add("body_temp");
        }
        if (signalStrength == null) {
            missing.add("signal_strength");
        }
        if (batteryLevel == null) {
            missing.add("battery_level");
        }
        return missing;
    }

    @Override
    public String toString() {
        return "Reading{" +
                "deviceId='" + deviceId + '\'' +
                ", observedAt=" + observedAt +
                ", heartRate=" + heartRate +
                ", bodyTemp=" + bodyTemp +
                ", signalStrength=" + signalStrength +
                ", batteryLevel=" + batteryLevel +
                '}';
    }
}
