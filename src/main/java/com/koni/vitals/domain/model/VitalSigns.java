package com.koni.vitals.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Complete set of the four vital-sign measurements carried by a reading.
 * Only exists when every field was present in the payload.
 */
@Getter
@EqualsAndHashCode
@ToString
public final class VitalSigns {

    private final double heartRate;
    private final double bodyTemp;
    private final double signalStrength;
    private final double batteryLevel;

    public VitalSigns(double heartRate, double bodyTemp, double signalStrength, double batteryLevel) {
        this.heartRate = heartRate;
        this.bodyTemp = bodyTemp;
        this.signalStrength = signalStrength;
        this.batteryLevel = batteryLevel;
    }

    /**
     * Feature vector in the order the statistical model was trained with:
     * heart rate, body temperature, signal strength, battery level.
     *
     * @return a fresh array, safe for the caller to modify
     */
    public double[] toFeatureVector() {
        return new double[] {heartRate, bodyTemp, signalStrength, batteryLevel};
    }
}
