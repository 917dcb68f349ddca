package com.koni.vitals.domain.model;

/**
 * Answer of the statistical classifier for one feature vector.
 * NO_OPINION is returned whenever the model is unavailable, failed or timed out.
 */
public enum ClassifierOpinion {
    NORMAL,
    ANOMALOUS,
    NO_OPINION
}
