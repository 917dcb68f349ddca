package com.koni.vitals.application.command;

import com.koni.vitals.application.port.PersistenceGateway;
import com.koni.vitals.application.service.ClassificationEngine;
import com.koni.vitals.domain.exception.IngestionCancelledException;
import com.koni.vitals.domain.exception.ValidationException;
import com.koni.vitals.domain.model.Reading;
import com.koni.vitals.domain.model.Verdict;
import com.koni.vitals.domain.service.ReadingValidator;
import com.koni.vitals.infrastructure.observability.VitalsMetrics;
import io.micrometer.observation.annotation.Observed;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Map;

/**
 * Entry point shared by both transports.
 *
 * Responsibilities:
 * - Validate the decoded payload into a Reading
 * - Classify it (rules first, then the statistical model)
 * - Commit reading, registry update and alert as one unit
 * - Report the outcome
 *
 * Bad data and classifier trouble end up in the outcome. An unavailable store surfaces as
 * {@link com.koni.vitals.domain.exception.DatabaseUnavailableException} and an abort before
 * commit as {@link IngestionCancelledException}; neither is the sender's fault.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IngestionCoordinator {

    private final ReadingValidator readingValidator;
    private final ClassificationEngine classificationEngine;
    private final PersistenceGateway persistenceGateway;
    private final VitalsMetrics metrics;

    /**
     * Ingests one decoded payload.
     *
     * @param payload the decoded key/value payload
     * @param arrivalTime when the transport received it
     * @return accepted with the audit row id and verdict, or rejected with a reason
     * @throws com.koni.vitals.domain.exception.DatabaseUnavailableException if the commit fails
     * @throws IngestionCancelledException if the calling thread was interrupted before commit
     */
    @Observed(name = "ingestion.coordinator", contextualName = "ingest-reading")
    public IngestionOutcome ingest(Map<String, Object> payload, Instant arrivalTime) {
        return metrics.recordProcessingTime(() -> doIngest(payload, arrivalTime));
    }

    private IngestionOutcome doIngest(Map<String, Object> payload, Instant arrivalTime) {
        metrics.recordReadingReceived();

        Reading reading;
        try {
            reading = readingValidator.validate(payload, arrivalTime);
        } catch (ValidationException e) {
            log.warn("Reading rejected: reason={}, payload={}", e.getMessage(), payload);
            metrics.recordRejected();
            return IngestionOutcome.rejected(e.getMessage());
        }

        Verdict verdict = classificationEngine.classify(reading);

        // nothing has been written yet, so an interrupted call can still back out cleanly
        if (Thread.currentThread().isInterrupted()) {
            log.warn("Ingestion cancelled before commit: deviceId={}, payload={}", reading.getDeviceId(), payload);
            throw new IngestionCancelledException("Ingestion cancelled before commit for device " + reading.getDeviceId());
        }

        Long recordId = persistenceGateway.commit(reading, verdict);

        if (verdict.isAnomaly()) {
            metrics.recordAnomaly(verdict.getAnomalyType());
            log.warn("Anomaly detected: deviceId={}, type={}, source={}, violations={}, reading={}",
                    reading.getDeviceId(), verdict.getAnomalyType(), verdict.getSource(),
                    verdict.getRuleViolations(), reading);
        } else {
            log.info("Reading accepted: deviceId={}, recordId={}", reading.getDeviceId(), recordId);
        }

        return IngestionOutcome.accepted(recordId, verdict);
    }
}
