package com.koni.vitals.infrastructure.persistence.repository;

import com.koni.vitals.domain.model.DeviceRecord;
import com.koni.vitals.domain.model.DeviceStatus;
import com.koni.vitals.domain.repository.DeviceRegistry;
import com.koni.vitals.infrastructure.persistence.entity.DeviceEntity;
import io.micrometer.observation.annotation.Observed;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * JPA adapter for DeviceRegistry.
 *
 * recordReading is an update-then-insert performed by the database: the counter increment
 * runs under the row lock, and two transactions racing to insert the same unseen device
 * make the loser fail with a unique-key violation instead of overwriting the winner.
 * The caller is expected to retry the whole transaction in that case.
 */
@Component
@RequiredArgsConstructor
public class JpaDeviceRegistryAdapter implements DeviceRegistry {

    private final DeviceJpaRepository jpaRepository;

    @Override
    @Transactional
    @Observed(name = "repository.save", contextualName = "device-record-reading")
    public void recordReading(String deviceId, Instant timestamp) {
        if (deviceId == null) {
            throw new IllegalArgumentException("DeviceId cannot be null");
        }
        if (timestamp == null) {
            throw new IllegalArgumentException("Timestamp cannot be null");
        }

        int updated = jpaRepository.incrementReadings(deviceId, timestamp);
        if (updated == 0) {
            jpaRepository.insertFirstReading(deviceId, timestamp, DeviceStatus.ACTIVE.name());
        }
    }

    @Override
    public Optional<DeviceRecord> findByDeviceId(String deviceId) {
        if (deviceId == null) {
            throw new IllegalArgumentException("DeviceId cannot be null");
        }
        return jpaRepository.findById(deviceId).map(this::toDomain);
    }

    @Override
    public List<DeviceRecord> findAll() {
        return jpaRepository.findAllByOrderByLastSeenDesc().stream()
            .map(this::toDomain)
            .collect(Collectors.toList());
    }

    private DeviceRecord toDomain(DeviceEntity entity) {
        return new DeviceRecord(
            entity.getDeviceId(),
            entity.getFirstSeen(),
            entity.getLastSeen(),
            entity.getTotalReadings() == null ? 0L : entity.getTotalReadings(),
            DeviceStatus.valueOf(entity.getStatus())
        );
    }
}
