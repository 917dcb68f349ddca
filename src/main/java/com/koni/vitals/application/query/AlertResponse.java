package com.koni.vitals.application.query;

import com.koni.vitals.domain.model.AlertSeverity;
import com.koni.vitals.domain.model.AnomalyType;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Data Transfer Object for an alert.
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class AlertResponse {

    private Long id;
    private Instant timestamp;
    private String deviceId;
    private AnomalyType alertType;
    private AlertSeverity severity;
    private String message;
    private boolean resolved;
}
