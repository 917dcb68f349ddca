package com.koni.vitals.infrastructure.observability;

import com.koni.vitals.domain.model.AnomalyType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Component for tracking ingestion and classification metrics.
 * Provides counters and timers for monitoring system behavior.
 */
@Slf4j
@Component
public class VitalsMetrics {

    private final MeterRegistry registry;
    private final Counter readingsReceived;
    private final Counter readingsRejected;
    private final Map<AnomalyType, Counter> anomalies = new EnumMap<>(AnomalyType.class);
    private final Counter alertsCreated;
    private final Counter dlqMessagesSent;
    private final Counter dlqMessagesReprocessed;
    private final Timer processingTime;

    public VitalsMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.readingsReceived = Counter.builder("vitals.readings.received.total")
                .description("Total readings received from either transport")
                .register(registry);

        this.readingsRejected = Counter.builder("vitals.readings.rejected.total")
                .description("Total readings rejected before commit")
                .register(registry);

        for (AnomalyType type : AnomalyType.values()) {
            anomalies.put(type, Counter.builder("vitals.anomalies.total")
                    .description("Total anomalous readings by anomaly type")
                    .tag("type", type.name())
                    .register(registry));
        }

        this.alertsCreated = Counter.builder("vitals.alerts.created.total")
                .description("Total alerts raised")
                .register(registry);

        this.dlqMessagesSent = Counter.builder("vitals.dlq.sent.total")
                .description("Total messages sent to Dead Letter Queue")
                .register(registry);

        this.dlqMessagesReprocessed = Counter.builder("vitals.dlq.reprocessed.total")
                .description("Total messages reprocessed from Dead Letter Queue")
                .register(registry);

        this.processingTime = Timer.builder("vitals.processing.time")
                .description("Time to ingest one reading")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
    }

    public void recordReadingReceived() {
        readingsReceived.increment();
    }

    public void recordRejected() {
        readingsRejected.increment();
        log.debug("Rejected reading counter incremented");
    }

    /**
     * Increment the anomaly counter for the given type.
     *
     * @param type the reported anomaly type
     */
    public void recordAnomaly(AnomalyType type) {
        anomalies.get(type).increment();
    }

    public void recordAlertCreated() {
        alertsCreated.increment();
    }

    /**
     * Increment the counter for classifier calls that degraded to no opinion.
     *
     * @param reason short cause such as "timeout", "error" or "circuit-open"
     */
    public void recordClassifierDegraded(String reason) {
        registry.counter("vitals.classifier.degraded.total", "reason", reason).increment();
        log.debug("Classifier degraded counter incremented: reason={}", reason);
    }

    /**
     * Record the processing time for an ingestion call.
     *
     * @param operation The operation to time
     * @param <T> The return type of the operation
     * @return The result of the operation
     */
    public <T> T recordProcessingTime(Supplier<T> operation) {
        return processingTime.record(operation);
    }

    public void recordDlqMessageSent() {
        dlqMessagesSent.increment();
        log.debug("DLQ message sent counter incremented");
    }

    public void recordDlqMessageReprocessed() {
        dlqMessagesReprocessed.increment();
        log.debug("DLQ message reprocessed counter incremented");
    }
}
