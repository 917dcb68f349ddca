package com.koni.vitals.infrastructure.classifier;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.koni.vitals.application.port.StatisticalClassifier;
import com.koni.vitals.infrastructure.observability.VitalsMetrics;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.timelimiter.TimeLimiter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Wires the statistical classifier: the Isolation Forest when its artifact loads,
 * an always-NO_OPINION stand-in otherwise, both behind the resilient decorator.
 */
@Configuration
public class ClassifierConfiguration {

    @Value("${vitals.classifier.model-path:file:./model/isolation-forest.json}")
    private String modelPath;

    @Value("${vitals.classifier.threads:2}")
    private int threads;

    @Value("${vitals.classifier.queue-capacity:256}")
    private int queueCapacity;

    /**
     * Bounded pool for inference. When the queue is full the call is rejected
     * and the reading is classified without the model.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService classifierExecutor() {
        return new ThreadPoolExecutor(
            threads,
            threads,
            0L,
            TimeUnit.MILLISECONDS,
            new ArrayBlockingQueue<>(queueCapacity),
            new CustomizableThreadFactory("classifier-"),
            new ThreadPoolExecutor.AbortPolicy());
    }

    @Bean
    public IsolationForestModelLoader isolationForestModelLoader(ObjectMapper objectMapper) {
        return new IsolationForestModelLoader(objectMapper);
    }

    @Bean
    public ResilientStatisticalClassifier statisticalClassifier(ResourceLoader resourceLoader,
                                                               IsolationForestModelLoader loader,
                                                               TimeLimiter classifierTimeLimiter,
                                                               CircuitBreaker classifierCircuitBreaker,
                                                               ExecutorService classifierExecutor,
                                                               VitalsMetrics metrics) {
        StatisticalClassifier model = loader.load(resourceLoader.getResource(modelPath))
            .<StatisticalClassifier>map(IsolationForestClassifier::new)
            .orElseGet(() -> new UnavailableClassifier("model artifact unavailable at " + modelPath));

        return new ResilientStatisticalClassifier(
            model, classifierTimeLimiter, classifierCircuitBreaker, classifierExecutor, metrics);
    }
}
