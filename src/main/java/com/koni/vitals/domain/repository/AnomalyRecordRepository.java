package com.koni.vitals.domain.repository;

import com.koni.vitals.domain.model.AnomalyRecord;
import com.koni.vitals.domain.model.Reading;
import com.koni.vitals.domain.model.Verdict;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for the append-only audit log of classified readings.
 * Every accepted reading is appended exactly once, anomalous or not.
 */
public interface AnomalyRecordRepository {

    /**
     * Appends a reading and its verdict to the audit log.
     *
     * @param reading the accepted reading
     * @param verdict the verdict computed for it
     * @return the identifier of the new audit row
     * @throws IllegalArgumentException if reading or verdict is null
     */
    Long append(Reading reading, Verdict verdict);

    Optional<AnomalyRecord> findById(Long id);

    /**
     * Retrieves anomalous records newer than the given instant, newest first.
     *
     * @param since lower bound (exclusive) on the record timestamp
     * @param deviceId restricts the result to one device when present
     */
    List<AnomalyRecord> findAnomaliesSince(Instant since, Optional<String> deviceId);

    /**
     * Retrieves every audit row newer than the given instant, anomalous or not, newest first.
     *
     * @param since lower bound (exclusive) on the record timestamp
     */
    List<AnomalyRecord> findRecordsSince(Instant since);

    long countByDeviceId(String deviceId);

    long countAnomaliesByDeviceId(String deviceId);
}
