package com.koni.vitals.infrastructure.persistence.repository;

import com.koni.vitals.infrastructure.persistence.entity.DeviceEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

/**
 * JPA repository for DeviceEntity persistence operations.
 *
 * Registry writes are single statements executed by the database so that the
 * read-modify-write of the counter happens under the row lock, not in memory.
 */
@Repository
public interface DeviceJpaRepository extends JpaRepository<DeviceEntity, String> {

    /**
     * Counts one more reading for an existing device. last_seen only moves forward
     * and first_seen only moves backward.
     *
     * @return the number of updated rows, 0 when the device does not exist yet
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update DeviceEntity d set d.totalReadings = d.totalReadings + 1, "
            + "d.lastSeen = case when d.lastSeen < :timestamp then :timestamp else d.lastSeen end, "
            + "d.firstSeen = case when d.firstSeen > :timestamp then :timestamp else d.firstSeen end "
            + "where d.deviceId = :deviceId")
    int incrementReadings(@Param("deviceId") String deviceId, @Param("timestamp") Instant timestamp);

    /**
     * Inserts the record of a device seen for the first time.
     * Fails with a unique-key violation when another transaction inserted it first.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query(value = "insert into devices (device_id, first_seen, last_seen, total_readings, status) "
            + "values (:deviceId, :timestamp, :timestamp, 1, :status)", nativeQuery = true)
    int insertFirstReading(@Param("deviceId") String deviceId,
                           @Param("timestamp") Instant timestamp,
                           @Param("status") String status);

    List<DeviceEntity> findAllByOrderByLastSeenDesc();
}
