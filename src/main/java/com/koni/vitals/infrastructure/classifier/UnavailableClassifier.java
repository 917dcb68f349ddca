package com.koni.vitals.infrastructure.classifier;

import com.koni.vitals.application.port.StatisticalClassifier;
import com.koni.vitals.domain.model.ClassifierOpinion;
import lombok.Getter;

/**
 * Stands in for the model when no artifact could be loaded. Always answers NO_OPINION.
 */
public class UnavailableClassifier implements StatisticalClassifier {

    @Getter
    private final String reason;

    public UnavailableClassifier(String reason) {
        this.reason = reason;
    }

    @Override
    public ClassifierOpinion classify(double[] features) {
        IsolationForestClassifier.requireFeatureVector(features);
        return ClassifierOpinion.NO_OPINION;
    }

    @Override
    public boolean isAvailable() {
        return false;
    }
}
