package com.koni.vitals.infrastructure.observability;

import com.koni.vitals.infrastructure.classifier.ResilientStatisticalClassifier;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.actuate.health.Status;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the statistical classifier.
 *
 * The model is optional, so its absence never takes the service DOWN:
 * - model loaded, circuit closed: UP
 * - no model, or circuit open: DEGRADED (rule-only classification)
 */
@Component
@RequiredArgsConstructor
public class ClassifierHealthIndicator implements HealthIndicator {

    static final Status DEGRADED = new Status("DEGRADED", "Classification runs on rules only");

    private final ResilientStatisticalClassifier classifier;

    @Override
    public Health health() {
        boolean modelLoaded = classifier.isModelLoaded();
        CircuitBreaker.State circuitState = classifier.getCircuitState();

        Health.Builder builder = modelLoaded && circuitState != CircuitBreaker.State.OPEN
                ? Health.up()
                : Health.status(DEGRADED);

        return builder
                .withDetail("modelLoaded", modelLoaded)
                .withDetail("circuitBreaker", circuitState.name())
                .build();
    }
}
