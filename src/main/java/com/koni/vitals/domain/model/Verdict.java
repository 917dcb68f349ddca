package com.koni.vitals.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Classification outcome for a single reading.
 * The full set of rule violations is kept next to the reported type for auditing.
 */
@Getter
@EqualsAndHashCode
@ToString
public final class Verdict {

    private final boolean anomaly;
    private final AnomalyType anomalyType;
    private final DetectionSource source;
    private final Set<AnomalyType> ruleViolations;

    private Verdict(boolean anomaly, AnomalyType anomalyType, DetectionSource source, Set<AnomalyType> ruleViolations) {
        this.anomaly = anomaly;
        this.anomalyType = anomalyType;
        this.source = source;
        this.ruleViolations = ruleViolations.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(ruleViolations));
    }

    public static Verdict normal() {
        return new Verdict(false, null, DetectionSource.NONE, Collections.emptySet());
    }

    public static Verdict missingFields() {
        return new Verdict(true, AnomalyType.MISSING_FIELDS, DetectionSource.NONE, Collections.emptySet());
    }

    public static Verdict mlAnomaly() {
        return new Verdict(true, AnomalyType.ML_ANOMALY, DetectionSource.ML, Collections.emptySet());
    }

    /**
     * Builds a rule verdict reporting the highest-precedence violation.
     *
     * @param violations every rule that fired, must not be empty
     */
    public static Verdict ruleViolations(Set<AnomalyType> violations) {
        if (violations == null || violations.isEmpty()) {
            throw new IllegalArgumentException("Rule verdict requires at least one violation");
        }
        EnumSet<AnomalyType> ordered = EnumSet.copyOf(violations);
        return new Verdict(true, ordered.iterator().next(), DetectionSource.RULE, ordered);
    }

    /**
     * @return the alert severity implied by this verdict, INFO when it is not an anomaly
     */
    public AlertSeverity severity() {
        return anomalyType == null ? AlertSeverity.INFO : anomalyType.getSeverity();
    }
}
