package com.koni.vitals.domain.model;

/**
 * Stage of the classification pipeline that produced a verdict.
 */
public enum DetectionSource {
    RULE,
    ML,
    NONE
}
