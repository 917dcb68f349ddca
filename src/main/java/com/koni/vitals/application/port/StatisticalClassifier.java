package com.koni.vitals.application.port;

import com.koni.vitals.domain.model.ClassifierOpinion;

/**
 * Port interface over an externally trained anomaly model.
 * This interface follows the Hexagonal Architecture pattern, defining an output port
 * implemented by infrastructure adapters (e.g. an Isolation Forest loaded from disk).
 *
 * Implementations must not throw for model problems: an unavailable or failing model
 * answers {@link ClassifierOpinion#NO_OPINION}.
 */
public interface StatisticalClassifier {

    /**
     * Classifies one feature vector.
     *
     * @param features heart rate, body temperature, signal strength and battery level, in that order
     * @return the model's opinion, NO_OPINION when it cannot give one
     * @throws IllegalArgumentException if features is null or not of length 4
     */
    ClassifierOpinion classify(double[] features);

    /**
     * @return true if a model is loaded and able to answer
     */
    boolean isAvailable();
}
