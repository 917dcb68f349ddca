package com.koni.vitals.infrastructure.persistence.repository;

import com.koni.vitals.infrastructure.persistence.entity.AlertEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

/**
 * JPA repository for AlertEntity persistence operations.
 */
@Repository
public interface AlertJpaRepository extends JpaRepository<AlertEntity, Long> {

    List<AlertEntity> findByIsResolvedAndTimestampAfterOrderByTimestampDesc(Integer isResolved, Instant since);

    @Modifying(clearAutomatically = true)
    @Query("update AlertEntity a set a.isResolved = 1 where a.id = :id")
    int markResolved(@Param("id") Long id);
}
