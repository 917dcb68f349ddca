package com.koni.vitals.application.query;

import com.koni.vitals.domain.exception.ValidationException;
import com.koni.vitals.domain.repository.AlertRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Query handler for unresolved alerts, newest first.
 */
@Service
@Slf4j
public class GetAlertsQueryHandler {

    private final AlertRepository alertRepository;
    private final Clock clock;

    public GetAlertsQueryHandler(AlertRepository alertRepository, Clock clock) {
        this.alertRepository = alertRepository;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public List<AlertResponse> handle(GetAlertsQuery query) {
        if (query.getHours() <= 0) {
            throw new ValidationException("hours must be positive but was: " + query.getHours());
        }
        Instant since = clock.instant().minus(Duration.ofHours(query.getHours()));

        List<AlertResponse> alerts = alertRepository.findUnresolvedSince(since).stream()
                .map(alert -> new AlertResponse(
                        alert.getId(),
                        alert.getTimestamp(),
                        alert.getDeviceId(),
                        alert.getAlertType(),
                        alert.getSeverity(),
                        alert.getMessage(),
                        alert.isResolved()
                ))
                .collect(Collectors.toList());

        log.debug("Retrieved {} unresolved alerts since {}", alerts.size(), since);
        return alerts;
    }
}
