package com.koni.vitals.infrastructure.persistence.repository;

import com.koni.vitals.domain.model.DeviceRecord;
import com.koni.vitals.domain.model.DeviceStatus;
import com.koni.vitals.domain.repository.DeviceRegistry;
import com.koni.vitals.infrastructure.persistence.PersistenceTestConfiguration;
import com.koni.vitals.tags.IntegrationTest;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for the database-side upsert of the device registry.
 */
@IntegrationTest
@DataJpaTest
@Import(PersistenceTestConfiguration.class)
@ActiveProfiles("test")
class JpaDeviceRegistryAdapterTest {

    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

    @Autowired
    private DeviceRegistry deviceRegistry;

    @Test
    void shouldCreateRecordOnFirstReading() {
        // When
        deviceRegistry.recordReading("monitor-1", T0);

        // Then
        Optional<DeviceRecord> device = deviceRegistry.findByDeviceId("monitor-1");
        assertThat(device).isPresent();
        assertThat(device.get().getTotalReadings()).isEqualTo(1L);
        assertThat(device.get().getFirstSeen()).isEqualTo(T0);
        assertThat(device.get().getLastSeen()).isEqualTo(T0);
        assertThat(device.get().getStatus()).isEqualTo(DeviceStatus.ACTIVE);
    }

    @Test
    void shouldIncrementCounterAndMoveLastSeenForward() {
        // Given
        deviceRegistry.recordReading("monitor-2", T0);

        // When
        deviceRegistry.recordReading("monitor-2", T0.plusSeconds(30));
        deviceRegistry.recordReading("monitor-2", T0.plusSeconds(60));

        // Then
        DeviceRecord device = deviceRegistry.findByDeviceId("monitor-2").orElseThrow();
        assertThat(device.getTotalReadings()).isEqualTo(3L);
        assertThat(device.getFirstSeen()).isEqualTo(T0);
        assertThat(device.getLastSeen()).isEqualTo(T0.plusSeconds(60));
    }

    @Test
    void shouldNeverMoveLastSeenBackward() {
        // Given
        deviceRegistry.recordReading("monitor-3", T0.plusSeconds(60));

        // When
        deviceRegistry.recordReading("monitor-3", T0);

        // Then
        DeviceRecord device = deviceRegistry.findByDeviceId("monitor-3").orElseThrow();
        assertThat(device.getTotalReadings()).isEqualTo(2L);
        assertThat(device.getLastSeen()).isEqualTo(T0.plusSeconds(60));
        assertThat(device.getFirstSeen()).isEqualTo(T0);
    }

    @Test
    void shouldListDevicesMostRecentlySeenFirst() {
        // Given
        deviceRegistry.recordReading("quiet", T0);
        deviceRegistry.recordReading("chatty", T0.plusSeconds(120));

        // When
        List<DeviceRecord> devices = deviceRegistry.findAll();

        // Then
        assertThat(devices).extracting(DeviceRecord::getDeviceId).containsExactly("chatty", "quiet");
    }

    @Test
    void shouldReturnEmptyForUnknownDevice() {
        assertThat(deviceRegistry.findByDeviceId("ghost")).isEmpty();
    }

    @Test
    void shouldRejectNullArguments() {
        assertThatThrownBy(() -> deviceRegistry.recordReading(null, T0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> deviceRegistry.recordReading("monitor-4", null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
