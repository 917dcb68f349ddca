package com.koni.vitals.infrastructure.web.controller;

import com.koni.vitals.application.query.DeviceResponse;
import com.koni.vitals.application.query.DeviceStatsResponse;
import com.koni.vitals.application.query.GetDeviceStatsQuery;
import com.koni.vitals.application.query.GetDeviceStatsQueryHandler;
import com.koni.vitals.application.query.GetDevicesQuery;
import com.koni.vitals.application.query.GetDevicesQueryHandler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for device queries.
 *
 * Endpoints:
 * - GET /api/v1/devices: every device with its derived status
 * - GET /api/v1/devices/{deviceId}/stats: reading and anomaly statistics of one device
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class DeviceController {

    private final GetDevicesQueryHandler devicesQueryHandler;
    private final GetDeviceStatsQueryHandler deviceStatsQueryHandler;

    /**
     * Example response:
     * [
     *   {
     *     "deviceId": "monitor-7",
     *     "firstSeen": "2025-01-31T13:00:00Z",
     *     "lastSeen": "2025-01-31T13:04:10Z",
     *     "totalReadings": 42,
     *     "status": "ACTIVE"
     *   }
     * ]
     *
     * @return 200 OK with the devices, most recently seen first (empty list if none)
     */
    @GetMapping("/v1/devices")
    public ResponseEntity<List<DeviceResponse>> getDevices() {
        List<DeviceResponse> devices = devicesQueryHandler.handle(new GetDevicesQuery());
        log.info("Returning {} devices", devices.size());
        return ResponseEntity.ok(devices);
    }

    /**
     * @param deviceId the device identifier
     * @return 200 OK with the statistics, 404 Not Found for an unknown device
     */
    @GetMapping("/v1/devices/{deviceId}/stats")
    public ResponseEntity<DeviceStatsResponse> getDeviceStats(@PathVariable String deviceId) {
        return ResponseEntity.ok(deviceStatsQueryHandler.handle(new GetDeviceStatsQuery(deviceId)));
    }
}
