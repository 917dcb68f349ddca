package com.koni.vitals.application.query;

import com.koni.vitals.domain.exception.RecordNotFoundException;
import com.koni.vitals.domain.exception.ValidationException;
import com.koni.vitals.domain.model.DeviceRecord;
import com.koni.vitals.domain.repository.AnomalyRecordRepository;
import com.koni.vitals.domain.repository.DeviceRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;

/**
 * Query handler for per-device statistics.
 *
 * Totals are counted on the audit log, so they agree with what the anomaly listing shows.
 */
@Service
@Slf4j
public class GetDeviceStatsQueryHandler {

    private final DeviceRegistry deviceRegistry;
    private final AnomalyRecordRepository anomalyRecordRepository;
    private final Clock clock;
    private final Duration livenessWindow;

    public GetDeviceStatsQueryHandler(DeviceRegistry deviceRegistry,
                                      AnomalyRecordRepository anomalyRecordRepository,
                                      Clock clock,
                                      @Value("${vitals.registry.liveness-window:5m}") Duration livenessWindow) {
        this.deviceRegistry = deviceRegistry;
        this.anomalyRecordRepository = anomalyRecordRepository;
        this.clock = clock;
        this.livenessWindow = livenessWindow;
    }

    /**
     * @param query identifies the device
     * @return the statistics of the device
     * @throws ValidationException if the device id is blank
     * @throws RecordNotFoundException if the device never reported
     */
    @Transactional(readOnly = true)
    public DeviceStatsResponse handle(GetDeviceStatsQuery query) {
        if (query.getDeviceId() == null || query.getDeviceId().isBlank()) {
            throw new ValidationException("deviceId is required");
        }

        DeviceRecord device = deviceRegistry.findByDeviceId(query.getDeviceId())
                .orElseThrow(() -> new RecordNotFoundException("Device not found: " + query.getDeviceId()));

        long total = anomalyRecordRepository.countByDeviceId(device.getDeviceId());
        long anomalies = anomalyRecordRepository.countAnomaliesByDeviceId(device.getDeviceId());
        double anomalyRate = total > 0 ? anomalies * 100.0 / total : 0.0;

        log.debug("Device stats: deviceId={}, total={}, anomalies={}", device.getDeviceId(), total, anomalies);

        return new DeviceStatsResponse(
                device.getDeviceId(),
                total,
                anomalies,
                anomalyRate,
                device.getFirstSeen(),
                device.getLastSeen(),
                device.statusAt(clock.instant(), livenessWindow)
        );
    }
}
