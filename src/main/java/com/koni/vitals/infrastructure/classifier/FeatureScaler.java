package com.koni.vitals.infrastructure.classifier;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Standardisation parameters the model was trained with: (x - mean) / scale per feature.
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class FeatureScaler {

    private double[] mean;
    private double[] scale;

    double[] transform(double[] features) {
        double[] scaled = new double[features.length];
        for (int i = 0; i < features.length; i++) {
            scaled[i] = (features[i] - mean[i]) / scale[i];
        }
        return scaled;
    }

    void validate(int featureCount) {
        if (mean == null || scale == null || mean.length != featureCount || scale.length != featureCount) {
            throw new IllegalStateException("Scaler must define mean and scale for " + featureCount + " features");
        }
        for (double s : scale) {
            if (s == 0.0 || !Double.isFinite(s)) {
                throw new IllegalStateException("Scaler scale must be finite and non-zero");
            }
        }
    }
}
