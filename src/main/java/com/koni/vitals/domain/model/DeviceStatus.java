package com.koni.vitals.domain.model;

/**
 * Liveness of a device. Only ACTIVE is ever stored; INACTIVE is derived at read time
 * from the last time the device was seen.
 */
public enum DeviceStatus {
    ACTIVE,
    INACTIVE
}
