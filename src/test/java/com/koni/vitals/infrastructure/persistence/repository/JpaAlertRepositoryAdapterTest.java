package com.koni.vitals.infrastructure.persistence.repository;

import com.koni.vitals.domain.model.Alert;
import com.koni.vitals.domain.model.AlertSeverity;
import com.koni.vitals.domain.model.AnomalyType;
import com.koni.vitals.domain.repository.AlertRepository;
import com.koni.vitals.infrastructure.persistence.PersistenceTestConfiguration;
import com.koni.vitals.tags.IntegrationTest;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@IntegrationTest
@DataJpaTest
@Import(PersistenceTestConfiguration.class)
@ActiveProfiles("test")
class JpaAlertRepositoryAdapterTest {

    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

    @Autowired
    private AlertRepository alertRepository;

    @Test
    void shouldListUnresolvedAlertsNewestFirst() {
        // Given
        Long older = alertRepository.save(alert("monitor-1", T0.plusSeconds(10), AnomalyType.LOW_BATTERY, AlertSeverity.WARNING));
        Long newer = alertRepository.save(alert("monitor-2", T0.plusSeconds(20), AnomalyType.OUT_OF_RANGE_HR, AlertSeverity.CRITICAL));
        alertRepository.save(alert("monitor-3", T0.minusSeconds(3600), AnomalyType.WEAK_SIGNAL, AlertSeverity.WARNING));

        // When
        List<Alert> alerts = alertRepository.findUnresolvedSince(T0);

        // Then
        assertThat(alerts).extracting(Alert::getId).containsExactly(newer, older);
        assertThat(alerts.get(0).getSeverity()).isEqualTo(AlertSeverity.CRITICAL);
        assertThat(alerts.get(0).getAlertType()).isEqualTo(AnomalyType.OUT_OF_RANGE_HR);
        assertThat(alerts.get(0).isResolved()).isFalse();
    }

    @Test
    void shouldHideResolvedAlerts() {
        // Given
        Long id = alertRepository.save(alert("monitor-4", T0.plusSeconds(10), AnomalyType.ML_ANOMALY, AlertSeverity.CRITICAL));

        // When
        boolean resolved = alertRepository.resolve(id);

        // Then
        assertThat(resolved).isTrue();
        assertThat(alertRepository.findUnresolvedSince(T0)).extracting(Alert::getId).doesNotContain(id);
    }

    @Test
    void shouldTreatRepeatedResolutionAsNoOp() {
        // Given
        Long id = alertRepository.save(alert("monitor-5", T0, AnomalyType.LOW_BATTERY, AlertSeverity.WARNING));
        alertRepository.resolve(id);

        // When / Then
        assertThat(alertRepository.resolve(id)).isTrue();
    }

    @Test
    void shouldReportUnknownAlert() {
        assertThat(alertRepository.resolve(424242L)).isFalse();
    }

    private static Alert alert(String deviceId, Instant timestamp, AnomalyType type, AlertSeverity severity) {
        return new Alert(timestamp, deviceId, type, severity, type + " detected for device " + deviceId);
    }
}
