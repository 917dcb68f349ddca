package com.koni.vitals.domain.repository;

import com.koni.vitals.domain.model.DeviceRecord;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for the per-device registry.
 * This interface is part of the domain layer and defines the contract
 * for device liveness and reading counts without coupling to a specific store.
 *
 * Following Hexagonal Architecture principles, this interface is implemented
 * by an infrastructure adapter backed by JPA.
 */
public interface DeviceRegistry {

    /**
     * Counts one accepted reading for the device.
     * Creates the record on the first reading of an unseen device; afterwards increments
     * the counter and moves last-seen forward, never backward.
     *
     * Implementations must be atomic with respect to concurrent calls for the same device
     * and must take part in the caller's transaction.
     *
     * @param deviceId the device identifier
     * @param timestamp when the reading was accepted
     * @throws IllegalArgumentException if deviceId or timestamp is null
     */
    void recordReading(String deviceId, Instant timestamp);

    /**
     * @param deviceId the device identifier
     * @return the device record, or empty when the device has never reported
     */
    Optional<DeviceRecord> findByDeviceId(String deviceId);

    /**
     * @return all device records, most recently seen first; empty when none exist
     */
    List<DeviceRecord> findAll();
}
