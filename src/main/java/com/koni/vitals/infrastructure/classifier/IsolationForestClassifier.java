package com.koni.vitals.infrastructure.classifier;

import com.koni.vitals.application.port.StatisticalClassifier;
import com.koni.vitals.domain.model.ClassifierOpinion;

/**
 * StatisticalClassifier backed by a loaded Isolation Forest.
 */
public class IsolationForestClassifier implements StatisticalClassifier {

    private final IsolationForestModel model;

    public IsolationForestClassifier(IsolationForestModel model) {
        if (model == null) {
            throw new IllegalArgumentException("Model cannot be null");
        }
        this.model = model;
    }

    @Override
    public ClassifierOpinion classify(double[] features) {
        requireFeatureVector(features);
        return model.decisionFunction(features) < 0.0 ? ClassifierOpinion.ANOMALOUS : ClassifierOpinion.NORMAL;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    static void requireFeatureVector(double[] features) {
        if (features == null || features.length != IsolationForestModel.FEATURE_COUNT) {
            throw new IllegalArgumentException("Feature vector must hold exactly "
                + IsolationForestModel.FEATURE_COUNT + " values");
        }
    }
}
