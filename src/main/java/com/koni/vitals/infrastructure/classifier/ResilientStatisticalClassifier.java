package com.koni.vitals.infrastructure.classifier;

import com.koni.vitals.application.port.StatisticalClassifier;
import com.koni.vitals.domain.model.ClassifierOpinion;
import com.koni.vitals.infrastructure.observability.VitalsMetrics;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.timelimiter.TimeLimiter;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Decorator that keeps the statistical classifier from ever failing or stalling ingestion.
 *
 * Inference runs on a bounded executor under a time limit, inside the "classifier" circuit breaker.
 * Timeouts, errors, saturation and open-circuit rejections all degrade to NO_OPINION.
 */
@Slf4j
public class ResilientStatisticalClassifier implements StatisticalClassifier {

    static final String TIMEOUT = "timeout";
    static final String CIRCUIT_OPEN = "circuit-open";
    static final String REJECTED = "rejected";
    static final String ERROR = "error";

    private final StatisticalClassifier delegate;
    private final TimeLimiter timeLimiter;
    private final CircuitBreaker circuitBreaker;
    private final ExecutorService executor;
    private final VitalsMetrics metrics;

    public ResilientStatisticalClassifier(StatisticalClassifier delegate,
                                          TimeLimiter timeLimiter,
                                          CircuitBreaker circuitBreaker,
                                          ExecutorService executor,
                                          VitalsMetrics metrics) {
        this.delegate = delegate;
        this.timeLimiter = timeLimiter;
        this.circuitBreaker = circuitBreaker;
        this.executor = executor;
        this.metrics = metrics;
    }

    @Override
    public ClassifierOpinion classify(double[] features) {
        IsolationForestClassifier.requireFeatureVector(features);
        if (!delegate.isAvailable()) {
            return ClassifierOpinion.NO_OPINION;
        }

        double[] copy = features.clone();
        Callable<ClassifierOpinion> limited = TimeLimiter.decorateFutureSupplier(
            timeLimiter, () -> executor.submit(() -> delegate.classify(copy)));
        Callable<ClassifierOpinion> guarded = CircuitBreaker.decorateCallable(circuitBreaker, limited);

        try {
            return guarded.call();
        } catch (CallNotPermittedException e) {
            return degrade(CIRCUIT_OPEN, e);
        } catch (TimeoutException e) {
            return degrade(TIMEOUT, e);
        } catch (RejectedExecutionException e) {
            return degrade(REJECTED, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return degrade(ERROR, e);
        } catch (Exception e) {
            return degrade(ERROR, e);
        }
    }

    @Override
    public boolean isAvailable() {
        return delegate.isAvailable() && circuitBreaker.getState() != CircuitBreaker.State.OPEN;
    }

    /**
     * @return true when a model artifact is loaded, regardless of the circuit state
     */
    public boolean isModelLoaded() {
        return delegate.isAvailable();
    }

    public CircuitBreaker.State getCircuitState() {
        return circuitBreaker.getState();
    }

    private ClassifierOpinion degrade(String reason, Exception cause) {
        metrics.recordClassifierDegraded(reason);
        log.warn("Statistical classifier degraded to NO_OPINION: reason={}, error={}", reason, cause.getMessage());
        return ClassifierOpinion.NO_OPINION;
    }
}
