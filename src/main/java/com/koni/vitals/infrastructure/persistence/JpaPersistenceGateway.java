package com.koni.vitals.infrastructure.persistence;

import com.koni.vitals.application.port.PersistenceGateway;
import com.koni.vitals.domain.exception.DatabaseUnavailableException;
import com.koni.vitals.domain.model.Alert;
import com.koni.vitals.domain.model.Reading;
import com.koni.vitals.domain.model.Verdict;
import com.koni.vitals.domain.repository.AlertRepository;
import com.koni.vitals.domain.repository.AnomalyRecordRepository;
import com.koni.vitals.domain.repository.DeviceRegistry;
import com.koni.vitals.domain.service.AlertPolicy;
import com.koni.vitals.infrastructure.observability.VitalsMetrics;
import io.github.resilience4j.retry.Retry;
import io.micrometer.observation.annotation.Observed;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.Optional;

/**
 * Commits a classified reading in a single database transaction:
 * audit append, device registry upsert and, when the alert policy asks for it, an alert.
 *
 * Transient conflicts re-run the whole transaction through the "commit" retry.
 * Any storage failure that survives the retries surfaces as DatabaseUnavailableException,
 * with nothing of the reading written.
 */
@Slf4j
@Component
public class JpaPersistenceGateway implements PersistenceGateway {

    private final AnomalyRecordRepository anomalyRecordRepository;
    private final DeviceRegistry deviceRegistry;
    private final AlertRepository alertRepository;
    private final AlertPolicy alertPolicy;
    private final Retry commitRetry;
    private final VitalsMetrics metrics;
    private final TransactionTemplate transactionTemplate;

    public JpaPersistenceGateway(AnomalyRecordRepository anomalyRecordRepository,
                                 DeviceRegistry deviceRegistry,
                                 AlertRepository alertRepository,
                                 AlertPolicy alertPolicy,
                                 Retry commitRetry,
                                 VitalsMetrics metrics,
                                 PlatformTransactionManager transactionManager) {
        this.anomalyRecordRepository = anomalyRecordRepository;
        this.deviceRegistry = deviceRegistry;
        this.alertRepository = alertRepository;
        this.alertPolicy = alertPolicy;
        this.commitRetry = commitRetry;
        this.metrics = metrics;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    /**
     * Commits the reading and its verdict.
     *
     * @param reading the accepted reading
     * @param verdict the verdict computed for it
     * @return the identifier of the audit row
     * @throws IllegalArgumentException if reading or verdict is null
     * @throws DatabaseUnavailableException if the store cannot commit after retries
     */
    @Override
    @Observed(name = "persistence.commit", contextualName = "commit-reading")
    public Long commit(Reading reading, Verdict verdict) {
        if (reading == null) {
            throw new IllegalArgumentException("Reading cannot be null");
        }
        if (verdict == null) {
            throw new IllegalArgumentException("Verdict cannot be null");
        }

        Optional<Alert> alert = alertPolicy.escalate(reading, verdict);

        Long recordId;
        try {
            recordId = commitRetry.executeSupplier(() -> transactionTemplate.execute(status -> {
                Long id = anomalyRecordRepository.append(reading, verdict);
                deviceRegistry.recordReading(reading.getDeviceId(), reading.getObservedAt());
                alert.ifPresent(alertRepository::save);
                return id;
            }));
        } catch (DataAccessException | TransactionException e) {
            log.error("Commit failed: deviceId={}, rawPayload={}, error={}",
                reading.getDeviceId(), reading.getRawPayload(), e.getMessage(), e);
            throw new DatabaseUnavailableException(
                "Failed to commit reading for device " + reading.getDeviceId(), e);
        }

        alert.ifPresent(a -> {
            metrics.recordAlertCreated();
            log.warn("Alert raised: deviceId={}, type={}, severity={}",
                a.getDeviceId(), a.getAlertType(), a.getSeverity());
        });

        return recordId;
    }
}
