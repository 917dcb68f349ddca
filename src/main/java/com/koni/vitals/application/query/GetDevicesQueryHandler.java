package com.koni.vitals.application.query;

import com.koni.vitals.domain.repository.DeviceRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Query handler for the device registry listing.
 * Status is derived from lastSeen at query time; nothing rewrites the stored status.
 */
@Service
@Slf4j
public class GetDevicesQueryHandler {

    private final DeviceRegistry deviceRegistry;
    private final Clock clock;
    private final Duration livenessWindow;

    public GetDevicesQueryHandler(DeviceRegistry deviceRegistry,
                                  Clock clock,
                                  @Value("${vitals.registry.liveness-window:5m}") Duration livenessWindow) {
        this.deviceRegistry = deviceRegistry;
        this.clock = clock;
        this.livenessWindow = livenessWindow;
    }

    /**
     * @param query the query object (contains no parameters)
     * @return every device, or an empty list if none has reported yet
     */
    @Transactional(readOnly = true)
    public List<DeviceResponse> handle(GetDevicesQuery query) {
        Instant now = clock.instant();

        List<DeviceResponse> devices = deviceRegistry.findAll().stream()
                .map(device -> new DeviceResponse(
                        device.getDeviceId(),
                        device.getFirstSeen(),
                        device.getLastSeen(),
                        device.getTotalReadings(),
                        device.statusAt(now, livenessWindow)
                ))
                .collect(Collectors.toList());

        log.debug("Retrieved {} devices", devices.size());
        return devices;
    }
}
