package com.koni.vitals.application.command;

import com.koni.vitals.domain.exception.RecordNotFoundException;
import com.koni.vitals.domain.exception.ValidationException;
import com.koni.vitals.domain.repository.AlertRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Command handler for alert resolution. Resolving twice is harmless.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ResolveAlertCommandHandler {

    private final AlertRepository alertRepository;

    /**
     * @param command identifies the alert
     * @throws ValidationException if the alert id is missing
     * @throws RecordNotFoundException if no alert has this id
     */
    public void handle(ResolveAlertCommand command) {
        if (command.getAlertId() == null) {
            throw new ValidationException("alertId is required");
        }
        if (!alertRepository.resolve(command.getAlertId())) {
            throw new RecordNotFoundException("Alert not found: " + command.getAlertId());
        }
        log.info("Alert resolved: alertId={}", command.getAlertId());
    }
}
