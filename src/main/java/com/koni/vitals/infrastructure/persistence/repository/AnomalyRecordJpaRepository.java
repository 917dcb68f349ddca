package com.koni.vitals.infrastructure.persistence.repository;

import com.koni.vitals.infrastructure.persistence.entity.AnomalyRecordEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

/**
 * JPA repository for AnomalyRecordEntity persistence operations.
 *
 * Spring Data JPA will automatically implement this interface at runtime,
 * providing standard CRUD operations and the derived queries below.
 */
@Repository
public interface AnomalyRecordJpaRepository extends JpaRepository<AnomalyRecordEntity, Long> {

    List<AnomalyRecordEntity> findByIsAnomalyAndTimestampAfterOrderByTimestampDesc(Integer isAnomaly, Instant since);

    List<AnomalyRecordEntity> findByIsAnomalyAndDeviceIdAndTimestampAfterOrderByTimestampDesc(
            Integer isAnomaly, String deviceId, Instant since);

    List<AnomalyRecordEntity> findByTimestampAfterOrderByTimestampDesc(Instant since);

    long countByDeviceId(String deviceId);

    long countByDeviceIdAndIsAnomaly(String deviceId, Integer isAnomaly);
}
