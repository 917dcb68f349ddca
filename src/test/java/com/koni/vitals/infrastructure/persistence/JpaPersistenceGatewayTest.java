package com.koni.vitals.infrastructure.persistence;

import com.koni.vitals.domain.exception.DatabaseUnavailableException;
import com.koni.vitals.domain.model.Alert;
import com.koni.vitals.domain.model.AnomalyType;
import com.koni.vitals.domain.model.DeviceRecord;
import com.koni.vitals.domain.model.Reading;
import com.koni.vitals.domain.model.Verdict;
import com.koni.vitals.domain.repository.AlertRepository;
import com.koni.vitals.domain.repository.AnomalyRecordRepository;
import com.koni.vitals.domain.repository.DeviceRegistry;
import com.koni.vitals.domain.service.AlertPolicy;
import com.koni.vitals.infrastructure.observability.VitalsMetrics;
import com.koni.vitals.infrastructure.persistence.repository.AlertJpaRepository;
import com.koni.vitals.infrastructure.persistence.repository.AnomalyRecordJpaRepository;
import com.koni.vitals.infrastructure.persistence.repository.DeviceJpaRepository;
import com.koni.vitals.tags.IntegrationTest;
import io.github.resilience4j.retry.Retry;
import io.micrometer.core.instrument.MeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Tests for the all-or-nothing commit of reading, registry update and alert.
 * Runs outside the test-managed transaction so that real commits and rollbacks are observed.
 */
@IntegrationTest
@DataJpaTest
@Import({PersistenceTestConfiguration.class, JpaPersistenceGateway.class})
@ActiveProfiles("test")
@Transactional(propagation = Propagation.NOT_SUPPORTED)
class JpaPersistenceGatewayTest {

    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

    @Autowired
    private JpaPersistenceGateway gateway;

    @Autowired
    private AnomalyRecordRepository anomalyRecordRepository;

    @Autowired
    private DeviceRegistry deviceRegistry;

    @Autowired
    private AlertRepository alertRepository;

    @Autowired
    private AlertPolicy alertPolicy;

    @Autowired
    private Retry commitRetry;

    @Autowired
    private VitalsMetrics metrics;

    @Autowired
    private MeterRegistry meterRegistry;

    @Autowired
    private PlatformTransactionManager transactionManager;

    @Autowired
    private AnomalyRecordJpaRepository anomalyJpaRepository;

    @Autowired
    private DeviceJpaRepository deviceJpaRepository;

    @Autowired
    private AlertJpaRepository alertJpaRepository;

    @BeforeEach
    @AfterEach
    void cleanUp() {
        alertJpaRepository.deleteAll();
        anomalyJpaRepository.deleteAll();
        deviceJpaRepository.deleteAll();
    }

    @Test
    void shouldCommitReadingRegistryAndAlertTogether() {
        // Given
        double alertsBefore = alertsCreated();
        Reading reading = reading("monitor-1", 150.0, 75.0);
        Verdict verdict = Verdict.ruleViolations(EnumSet.of(AnomalyType.OUT_OF_RANGE_HR));

        // When
        Long id = gateway.commit(reading, verdict);

        // Then
        assertThat(anomalyRecordRepository.findById(id)).isPresent();
        assertThat(deviceRegistry.findByDeviceId("monitor-1"))
                .map(DeviceRecord::getTotalReadings)
                .contains(1L);
        List<Alert> alerts = alertRepository.findUnresolvedSince(T0.minusSeconds(1));
        assertThat(alerts).hasSize(1);
        assertThat(alerts.get(0).getAlertType()).isEqualTo(AnomalyType.OUT_OF_RANGE_HR);
        assertThat(alertsCreated()).isEqualTo(alertsBefore + 1);
    }

    @Test
    void shouldNotRaiseAlertForNormalOrIncompleteReadings() {
        // When
        gateway.commit(reading("monitor-2", 72.0, 75.0), Verdict.normal());
        gateway.commit(reading("monitor-2", null, 75.0), Verdict.missingFields());

        // Then
        assertThat(alertRepository.findUnresolvedSince(T0.minusSeconds(1))).isEmpty();
        assertThat(anomalyRecordRepository.countByDeviceId("monitor-2")).isEqualTo(2L);
        assertThat(deviceRegistry.findByDeviceId("monitor-2"))
                .map(DeviceRecord::getTotalReadings)
                .contains(2L);
    }

    @Test
    void shouldRaiseWarningAlertForLowBattery() {
        // When
        gateway.commit(reading("monitor-3", 72.0, 5.0), Verdict.ruleViolations(EnumSet.of(AnomalyType.LOW_BATTERY)));

        // Then
        assertThat(alertRepository.findUnresolvedSince(T0.minusSeconds(1)))
                .extracting(Alert::getAlertType)
                .containsExactly(AnomalyType.LOW_BATTERY);
    }

    @Test
    void shouldLeaveNothingBehindWhenCommitFails() {
        // Given
        AlertRepository failingAlerts = mock(AlertRepository.class);
        when(failingAlerts.save(any(Alert.class))).thenThrow(new DataAccessResourceFailureException("disk full"));
        JpaPersistenceGateway failingGateway = new JpaPersistenceGateway(anomalyRecordRepository, deviceRegistry,
                failingAlerts, alertPolicy, commitRetry, metrics, transactionManager);
        double alertsBefore = alertsCreated();

        // When / Then
        assertThatThrownBy(() -> failingGateway.commit(reading("monitor-4", 150.0, 75.0),
                Verdict.ruleViolations(EnumSet.of(AnomalyType.OUT_OF_RANGE_HR))))
                .isInstanceOf(DatabaseUnavailableException.class)
                .hasMessageContaining("monitor-4");

        assertThat(anomalyRecordRepository.countByDeviceId("monitor-4")).isZero();
        assertThat(deviceRegistry.findByDeviceId("monitor-4")).isEmpty();
        assertThat(alertsCreated()).isEqualTo(alertsBefore);
    }

    @Test
    void shouldRetryWholeTransactionOnTransientConflict() {
        // Given
        AtomicInteger attempts = new AtomicInteger();
        DeviceRegistry conflictingOnce = new DeviceRegistry() {
            @Override
            public void recordReading(String deviceId, Instant timestamp) {
                if (attempts.incrementAndGet() == 1) {
                    throw new DuplicateKeyException("devices_pkey");
                }
                deviceRegistry.recordReading(deviceId, timestamp);
            }

            @Override
            public Optional<DeviceRecord> findByDeviceId(String deviceId) {
                return deviceRegistry.findByDeviceId(deviceId);
            }

            @Override
            public List<DeviceRecord> findAll() {
                return deviceRegistry.findAll();
            }
        };
        JpaPersistenceGateway retryingGateway = new JpaPersistenceGateway(anomalyRecordRepository, conflictingOnce,
                alertRepository, alertPolicy, commitRetry, metrics, transactionManager);

        // When
        Long id = retryingGateway.commit(reading("monitor-5", 72.0, 75.0), Verdict.normal());

        // Then
        assertThat(attempts.get()).isEqualTo(2);
        assertThat(anomalyRecordRepository.findById(id)).isPresent();
        assertThat(anomalyRecordRepository.countByDeviceId("monitor-5")).isEqualTo(1L);
        assertThat(deviceRegistry.findByDeviceId("monitor-5"))
                .map(DeviceRecord::getTotalReadings)
                .contains(1L);
    }

    @Test
    void shouldRejectNullArguments() {
        assertThatThrownBy(() -> gateway.commit(null, Verdict.normal()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> gateway.commit(reading("monitor-6", 72.0, 75.0), null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private double alertsCreated() {
        return meterRegistry.find("vitals.alerts.created.total").counter().count();
    }

    private static Reading reading(String deviceId, Double heartRate, Double batteryLevel) {
        return new Reading(deviceId, T0, heartRate, 36.8, -60.0, batteryLevel, Map.of("device_id", deviceId));
    }
}
