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
 * Query handler for recent anomalies, newest first.
 */
@Service
@Slf4j
public class GetAnomaliesQueryHandler {

    private final AnomalyRecordRepository anomalyRecordRepository;
    private final Clock clock;

    public GetAnomaliesQueryHandler(AnomalyRecordRepository anomalyRecordRepository, Clock clock) {
        this.anomalyRecordRepository = anomalyRecordRepository;
        this.clock = clock;
    }

    /**
     * @param query the time window in hours and the optional device filter
     * @return anomalous rows in the window, or an empty list
     * @throws ValidationException if hours is not positive
     */
    @Transactional(readOnly = true)
    public List<AnomalyResponse> handle(GetAnomaliesQuery query) {
        if (query.getHours() <= 0) {
            throw new ValidationException("hours must be positive but was: " + query.getHours());
        }
        Instant since = clock.instant().minus(Duration.ofHours(query.getHours()));

        List<AnomalyResponse> anomalies = anomalyRecordRepository.findAnomaliesSince(since, query.deviceIdFilter())
                .stream()
                .map(record -> new AnomalyResponse(
                        record.getId(),
                        record.getTimestamp(),
                        record.getDeviceId(),
                        record.getHeartRate(),
                        record.getBodyTemp(),
                        record.getSignalStrength(),
                        record.getBatteryLevel(),
                        record.getAnomalyType(),
                        record.getSource(),
                        record.getRuleViolations(),
                        record.getRawData()
                ))
                .collect(Collectors.toList());

        log.debug("Retrieved {} anomalies since {}", anomalies.size(), since);
        return anomalies;
    }
}
