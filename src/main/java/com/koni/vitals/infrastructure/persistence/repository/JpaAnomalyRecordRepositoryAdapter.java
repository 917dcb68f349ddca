package com.koni.vitals.infrastructure.persistence.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.koni.vitals.domain.model.AnomalyRecord;
import com.koni.vitals.domain.model.AnomalyType;
import com.koni.vitals.domain.model.DetectionSource;
import com.koni.vitals.domain.model.Reading;
import com.koni.vitals.domain.model.Verdict;
import com.koni.vitals.domain.repository.AnomalyRecordRepository;
import com.koni.vitals.infrastructure.persistence.entity.AnomalyRecordEntity;
import io.micrometer.observation.annotation.Observed;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * JPA adapter for AnomalyRecordRepository that adapts the domain interface
 * to the JPA infrastructure layer.
 *
 * It handles mapping between the (Reading, Verdict) pair and AnomalyRecordEntity.
 * The raw payload is stored as its JSON text; rule violations as a comma-separated list of codes.
 */
@Component
@RequiredArgsConstructor
public class JpaAnomalyRecordRepositoryAdapter implements AnomalyRecordRepository {

    private static final int ANOMALY = 1;
    private static final int NORMAL = 0;

    private final AnomalyRecordJpaRepository jpaRepository;
    private final ObjectMapper objectMapper;

    /**
     * Appends a reading and its verdict to the audit log.
     * The row is only visible to others once the surrounding transaction commits.
     *
     * @param reading the accepted reading
     * @param verdict the verdict computed for it
     * @return the generated row identifier
     * @throws IllegalArgumentException if reading or verdict is null
     */
    @Override
    @Observed(name = "repository.save", contextualName = "anomaly-record-append")
    public Long append(Reading reading, Verdict verdict) {
        if (reading == null) {
            throw new IllegalArgumentException("Reading cannot be null");
        }
        if (verdict == null) {
            throw new IllegalArgumentException("Verdict cannot be null");
        }

        return jpaRepository.save(toEntity(reading, verdict)).getId();
    }

    @Override
    public Optional<AnomalyRecord> findById(Long id) {
        if (id == null) {
            throw new IllegalArgumentException("Id cannot be null");
        }
        return jpaRepository.findById(id).map(this::toDomain);
    }

    @Override
    public List<AnomalyRecord> findAnomaliesSince(Instant since, Optional<String> deviceId) {
        if (since == null) {
            throw new IllegalArgumentException("Since cannot be null");
        }

        List<AnomalyRecordEntity> entities = deviceId
            .map(id -> jpaRepository.findByIsAnomalyAndDeviceIdAndTimestampAfterOrderByTimestampDesc(ANOMALY, id, since))
            .orElseGet(() -> jpaRepository.findByIsAnomalyAndTimestampAfterOrderByTimestampDesc(ANOMALY, since));

        return entities.stream()
            .map(this::toDomain)
            .collect(Collectors.toList());
    }

    @Override
    public List<AnomalyRecord> findRecordsSince(Instant since) {
        if (since == null) {
            throw new IllegalArgumentException("Since cannot be null");
        }
        return jpaRepository.findByTimestampAfterOrderByTimestampDesc(since).stream()
            .map(this::toDomain)
            .collect(Collectors.toList());
    }

    @Override
    public long countByDeviceId(String deviceId) {
        return jpaRepository.countByDeviceId(deviceId);
    }

    @Override
    public long countAnomaliesByDeviceId(String deviceId) {
        return jpaRepository.countByDeviceIdAndIsAnomaly(deviceId, ANOMALY);
    }

    private AnomalyRecordEntity toEntity(Reading reading, Verdict verdict) {
        return new AnomalyRecordEntity(
            null,
            reading.getObservedAt(),
            reading.getDeviceId(),
            reading.getHeartRate(),
            reading.getBodyTemp(),
            reading.getSignalStrength(),
            reading.getBatteryLevel(),
            verdict.isAnomaly() ? ANOMALY : NORMAL,
            verdict.getAnomalyType() == null ? null : verdict.getAnomalyType().name(),
            verdict.getSource().name(),
            joinViolations(verdict.getRuleViolations()),
            serialize(reading)
        );
    }

    private AnomalyRecord toDomain(AnomalyRecordEntity entity) {
        return new AnomalyRecord(
            entity.getId(),
            entity.getTimestamp(),
            entity.getDeviceId(),
            entity.getHeartRate(),
            entity.getBodyTemp(),
            entity.getSignalStrength(),
            entity.getBatteryLevel(),
            entity.getIsAnomaly() != null && entity.getIsAnomaly() == ANOMALY,
            entity.getAnomalyType() == null ? null : AnomalyType.valueOf(entity.getAnomalyType()),
            DetectionSource.valueOf(entity.getDetectionSource()),
            splitViolations(entity.getRuleViolations()),
            entity.getRawData()
        );
    }

    private String serialize(Reading reading) {
        try {
            return objectMapper.writeValueAsString(reading.getRawPayload());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Raw payload of device " + reading.getDeviceId() + " is not serializable", e);
        }
    }

    private static String joinViolations(Set<AnomalyType> violations) {
        if (violations.isEmpty()) {
            return null;
        }
        return violations.stream()
            .map(Enum::name)
            .collect(Collectors.joining(","));
    }

    private static Set<AnomalyType> splitViolations(String violations) {
        if (violations == null || violations.isBlank()) {
            return Collections.emptySet();
        }
        return Arrays.stream(violations.split(","))
            .map(String::trim)
            .map(AnomalyType::valueOf)
            .collect(Collectors.toCollection(() -> EnumSet.noneOf(AnomalyType.class)));
    }
}
