package com.koni.vitals.infrastructure.resilience;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.TransientDataAccessException;

import java.time.Duration;

/**
 * Configuration for the resilience policies of the pipeline.
 *
 * - "classifier" circuit breaker and time limiter: statistical inference is optional,
 *   so a slow or failing model is cut off and the reading continues with rules only.
 * - "commit" retry: transient storage conflicts (first-insert races, lock timeouts,
 *   deadlocks) re-run the whole commit transaction.
 *
 * Circuit Breaker States:
 * - CLOSED: Normal operation, requests pass through
 * - OPEN: Failure threshold exceeded, requests fail fast
 * - HALF_OPEN: Testing if the model recovered, limited requests allowed
 */
@Configuration
public class ResilienceConfiguration {

    /**
     * Circuit breaker settings for the statistical classifier.
     *
     * Configuration:
     * - Sliding window: 20 calls (COUNT_BASED)
     * - Failure threshold: 50%
     * - Wait duration in OPEN state: 30 seconds
     * - Permitted calls in HALF_OPEN: 3
     *
     * @return CircuitBreakerConfig for the classifier
     */
    @Bean
    public CircuitBreakerConfig classifierCircuitBreakerConfig() {
        return CircuitBreakerConfig.custom()
            .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
            .slidingWindowSize(20)
            .minimumNumberOfCalls(10)
            .failureRateThreshold(50.0f)
            .waitDurationInOpenState(Duration.ofSeconds(30))
            .permittedNumberOfCallsInHalfOpenState(3)
            .automaticTransitionFromOpenToHalfOpenEnabled(true)
            .build();
    }

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry(CircuitBreakerConfig config) {
        return CircuitBreakerRegistry.of(config);
    }

    @Bean
    public CircuitBreaker classifierCircuitBreaker(CircuitBreakerRegistry registry) {
        return registry.circuitBreaker("classifier");
    }

    /**
     * Upper bound on a single inference. The running task is cancelled on timeout.
     *
     * @param timeout the configured time limit
     * @return TimeLimiter for the classifier
     */
    @Bean
    public TimeLimiter classifierTimeLimiter(@Value("${vitals.classifier.timeout:200ms}") Duration timeout) {
        return TimeLimiter.of("classifier", TimeLimiterConfig.custom()
            .timeoutDuration(timeout)
            .cancelRunningFuture(true)
            .build());
    }

    /**
     * Retry policy for the commit transaction. Waits grow exponentially with jitter
     * so that writers racing on the same device do not collide again in lockstep.
     *
     * @param maxAttempts total attempts including the first one
     * @return RetryRegistry holding the "commit" configuration
     */
    @Bean
    public RetryRegistry retryRegistry(@Value("${vitals.persistence.commit-max-attempts:3}") int maxAttempts) {
        RetryConfig config = RetryConfig.custom()
            .maxAttempts(maxAttempts)
            .intervalFunction(IntervalFunction.ofExponentialRandomBackoff(Duration.ofMillis(20), 2.0, 0.5))
            .retryOnException(ResilienceConfiguration::isTransientStorageFailure)
            .build();
        return RetryRegistry.of(config);
    }

    @Bean
    public Retry commitRetry(RetryRegistry registry) {
        return registry.retry("commit");
    }

    /**
     * @return true for failures that a fresh transaction can be expected to overcome
     */
    static boolean isTransientStorageFailure(Throwable throwable) {
        return throwable instanceof DataIntegrityViolationException
            || throwable instanceof ConcurrencyFailureException
            || throwable instanceof TransientDataAccessException;
    }
}
