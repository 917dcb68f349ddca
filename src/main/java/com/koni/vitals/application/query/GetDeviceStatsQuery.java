package com.koni.vitals.application.query;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Query for the reading and anomaly statistics of one device.
 */
@Getter
@AllArgsConstructor
public class GetDeviceStatsQuery {

    private final String deviceId;
}
