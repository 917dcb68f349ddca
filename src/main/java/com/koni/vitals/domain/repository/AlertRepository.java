package com.koni.vitals.domain.repository;

import com.koni.vitals.domain.model.Alert;

import java.time.Instant;
import java.util.List;

/**
 * Repository interface for escalation alerts.
 */
public interface AlertRepository {

    /**
     * Persists a new alert.
     *
     * @param alert the alert to save, unresolved
     * @return the identifier of the saved alert
     * @throws IllegalArgumentException if alert is null
     */
    Long save(Alert alert);

    /**
     * Retrieves unresolved alerts newer than the given instant, newest first.
     */
    List<Alert> findUnresolvedSince(Instant since);

    /**
     * Marks an alert as resolved. Resolving an already resolved alert is a no-op.
     *
     * @param id the alert identifier
     * @return false if no alert with this identifier exists
     */
    boolean resolve(Long id);
}
