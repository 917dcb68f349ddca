package com.koni.vitals.application.query;

import com.koni.vitals.domain.exception.ValidationException;
import com.koni.vitals.domain.repository.AnomalyRecordRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Query handler for the audit log export, newest first.
 * Unlike the anomaly query it returns every accepted reading.
 */
@Service
@Slf4j
public class ExportReadingsQueryHandler {

    private final AnomalyRecordRepository anomalyRecordRepository;
    private final Clock clock;

    public ExportReadingsQueryHandler(AnomalyRecordRepository anomalyRecordRepository, Clock clock) {
        this.anomalyRecordRepository = anomalyRecordRepository;
        this.clock = clock;
    }

    /**
     * @param query the time window in hours
     * @return the audit rows in the window, or an empty list
     * @throws ValidationException if hours is not positive
     */
    @Transactional(readOnly = true)
    public List<ReadingExportRow> handle(ExportReadingsQuery query) {
        if (query.getHours() <= 0) {
            throw new ValidationException("hours must be positive but was: " + query.getHours());
        }
        Instant since = clock.instant().minus(Duration.ofHours(query.getHours()));

        List<ReadingExportRow> rows = anomalyRecordRepository.findRecordsSince(since).stream()
                .map(record -> new ReadingExportRow(
                        record.getId(),
                        record.getTimestamp().toString(),
                        record.getDeviceId(),
                        record.getHeartRate(),
                        record.getBodyTemp(),
                        record.getSignalStrength(),
                        record.getBatteryLevel(),
                        record.isAnomaly() ? 1 : 0,
                        record.getAnomalyType() == null ? null : record.getAnomalyType().name(),
                        record.getRawData()
                ))
                .collect(Collectors.toList());

        log.info("Exporting {} audit rows since {}", rows.size(), since);
        return rows;
    }
}
