package com.koni.vitals.domain.service;

import com.koni.vitals.domain.model.AnomalyType;
import com.koni.vitals.domain.model.VitalSigns;

import java.util.EnumSet;
import java.util.Set;

/**
 * Stateless check of vital signs against fixed medical reference ranges.
 * Returns every violation; picking the one to report is left to the classification engine.
 */
public class RuleClassifier {

    static final double HEART_RATE_MIN = 60;
    static final double HEART_RATE_MAX = 100;
    static final double BODY_TEMP_MIN = 36.0;
    static final double BODY_TEMP_MAX = 37.5;
    static final double BATTERY_LEVEL_MIN = 10;
    static final double SIGNAL_STRENGTH_MIN = -100;

    /**
     * @param vitals a complete set of measurements
     * @return the violated rules, iterating in precedence order; empty when all values are in range
     */
    public Set<AnomalyType> evaluate(VitalSigns vitals) {
        if (vitals == null) {
            throw new IllegalArgumentException("VitalSigns cannot be null");
        }

        EnumSet<AnomalyType> violations = EnumSet.noneOf(AnomalyType.class);
        if (vitals.getHeartRate() < HEART_RATE_MIN || vitals.getHeartRate() > HEART_RATE_MAX) {
            violations.add(AnomalyType.OUT_OF_RANGE_HR);
        }
        if (vitals.getBodyTemp() < BODY_TEMP_MIN || vitals.getBodyTemp() > BODY_TEMP_MAX) {
            violations.add(AnomalyType.OUT_OF_RANGE_TEMP);
        }
        if (vitals.getBatteryLevel() < BATTERY_LEVEL_MIN) {
            violations.add(AnomalyType.LOW_BATTERY);
        }
        // no upper bound on signal strength
        if (vitals.getSignalStrength() < SIGNAL_STRENGTH_MIN) {
            violations.add(AnomalyType.WEAK_SIGNAL);
        }
        return violations;
    }
}
