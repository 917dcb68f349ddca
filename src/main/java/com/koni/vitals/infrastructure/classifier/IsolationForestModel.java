package com.koni.vitals.infrastructure.classifier;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Pre-trained Isolation Forest together with the scaler it was trained behind.
 *
 * Scoring follows scikit-learn:
 * score(x) = -2^(-E[h(x)] / c(maxSamples)), decision(x) = score(x) - offset.
 * A negative decision marks an anomaly.
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class IsolationForestModel {

    static final int FEATURE_COUNT = 4;

    private static final double EULER_GAMMA = 0.5772156649015329;

    @JsonProperty("max_samples")
    private int maxSamples;

    private double offset;

    private FeatureScaler scaler;

    private List<IsolationTree> trees;

    /**
     * @param features raw heart rate, body temperature, signal strength and battery level
     * @return the decision value, negative for anomalies
     */
    public double decisionFunction(double[] features) {
        double[] scaled = scaler.transform(features);
        double totalPathLength = 0.0;
        for (IsolationTree tree : trees) {
            totalPathLength += tree.pathLength(scaled);
        }
        double meanPathLength = totalPathLength / trees.size();
        double score = -Math.pow(2.0, -meanPathLength / averagePathLength(maxSamples));
        return score - offset;
    }

    /**
     * Checks that the artifact is complete and consistent.
     *
     * @throws IllegalStateException describing the first problem found
     */
    public void validate() {
        if (maxSamples < 2) {
            throw new IllegalStateException("max_samples must be at least 2 but was " + maxSamples);
        }
        if (scaler == null) {
            throw new IllegalStateException("Model has no scaler");
        }
        scaler.validate(FEATURE_COUNT);
        if (trees == null || trees.isEmpty()) {
            throw new IllegalStateException("Model has no trees");
        }
        trees.forEach(tree -> tree.validate(FEATURE_COUNT));
    }

    /**
     * Average path length of an unsuccessful search in a binary search tree of n nodes.
     */
    static double averagePathLength(int n) {
        if (n <= 1) {
            return 0.0;
        }
        if (n == 2) {
            return 1.0;
        }
        return 2.0 * (Math.log(n - 1.0) + EULER_GAMMA) - 2.0 * (n - 1.0) / n;
    }
}
