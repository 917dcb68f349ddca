package com.koni.vitals.application.service;

import com.koni.vitals.application.port.StatisticalClassifier;
import com.koni.vitals.domain.model.AnomalyType;
import com.koni.vitals.domain.model.ClassifierOpinion;
import com.koni.vitals.domain.model.Reading;
import com.koni.vitals.domain.model.Verdict;
import com.koni.vitals.domain.model.VitalSigns;
import com.koni.vitals.domain.service.RuleClassifier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.Set;

/**
 * Combines the rule classifier and the statistical classifier into one verdict.
 *
 * Precedence, highest first:
 * - incomplete reading: MISSING_FIELDS, no further stage runs
 * - any rule violation: the first violation in rule order, source RULE
 * - statistical model says anomalous: ML_ANOMALY, source ML
 * - otherwise normal
 *
 * A statistical NO_OPINION is treated as NORMAL; rule results still apply. A classifier
 * that throws despite its contract is treated as NO_OPINION.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ClassificationEngine {

    private final RuleClassifier ruleClassifier;
    private final StatisticalClassifier statisticalClassifier;

    /**
     * @param reading the validated reading
     * @return the verdict, never null
     */
    public Verdict classify(Reading reading) {
        if (reading == null) {
            throw new IllegalArgumentException("Reading cannot be null");
        }

        Optional<VitalSigns> vitals = reading.vitals();
        if (vitals.isEmpty()) {
            log.debug("Reading incomplete, classified as MISSING_FIELDS: deviceId={}, missing={}",
                    reading.getDeviceId(), reading.missingFields());
            return Verdict.missingFields();
        }

        Set<AnomalyType> violations = ruleClassifier.evaluate(vitals.get());
        ClassifierOpinion opinion = consultStatisticalClassifier(reading, vitals.get());

        if (!violations.isEmpty()) {
            if (violations.size() > 1) {
                log.debug("Multiple rule violations for deviceId={}: {}", reading.getDeviceId(), violations);
            }
            return Verdict.ruleViolations(violations);
        }
        if (opinion == ClassifierOpinion.ANOMALOUS) {
            return Verdict.mlAnomaly();
        }
        return Verdict.normal();
    }

    private ClassifierOpinion consultStatisticalClassifier(Reading reading, VitalSigns vitals) {
        try {
            return statisticalClassifier.classify(vitals.toFeatureVector());
        } catch (RuntimeException e) {
            log.warn("Statistical classifier failed, continuing with rules only: deviceId={}, error={}",
                    reading.getDeviceId(), e.getMessage());
            return ClassifierOpinion.NO_OPINION;
        }
    }
}
