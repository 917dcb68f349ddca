package com.koni.vitals.infrastructure.persistence.repository;

import com.koni.vitals.domain.model.Alert;
import com.koni.vitals.domain.model.AlertSeverity;
import com.koni.vitals.domain.model.AnomalyType;
import com.koni.vitals.domain.repository.AlertRepository;
import com.koni.vitals.infrastructure.persistence.entity.AlertEntity;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * JPA adapter for AlertRepository.
 */
@Component
@RequiredArgsConstructor
public class JpaAlertRepositoryAdapter implements AlertRepository {

    private static final int RESOLVED = 1;
    private static final int UNRESOLVED = 0;

    private final AlertJpaRepository jpaRepository;

    @Override
    public Long save(Alert alert) {
        if (alert == null) {
            throw new IllegalArgumentException("Alert cannot be null");
        }
        return jpaRepository.save(toEntity(alert)).getId();
    }

    @Override
    public List<Alert> findUnresolvedSince(Instant since) {
        if (since == null) {
            throw new IllegalArgumentException("Since cannot be null");
        }
        return jpaRepository.findByIsResolvedAndTimestampAfterOrderByTimestampDesc(UNRESOLVED, since).stream()
            .map(this::toDomain)
            .collect(Collectors.toList());
    }

    @Override
    @Transactional
    public boolean resolve(Long id) {
        if (id == null) {
            throw new IllegalArgumentException("Id cannot be null");
        }
        return jpaRepository.markResolved(id) > 0;
    }

    private AlertEntity toEntity(Alert alert) {
        return new AlertEntity(
            alert.getId(),
            alert.getTimestamp(),
            alert.getDeviceId(),
            alert.getAlertType().name(),
            alert.getSeverity().name(),
            alert.getMessage(),
            alert.isResolved() ? RESOLVED : UNRESOLVED
        );
    }

    private Alert toDomain(AlertEntity entity) {
        return new Alert(
            entity.getId(),
            entity.getTimestamp(),
            entity.getDeviceId(),
            AnomalyType.valueOf(entity.getAlertType()),
            AlertSeverity.valueOf(entity.getSeverity()),
            entity.getMessage(),
            entity.getIsResolved() != null && entity.getIsResolved() == RESOLVED
        );
    }
}
