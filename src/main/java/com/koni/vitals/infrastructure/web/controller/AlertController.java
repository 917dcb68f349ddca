package com.koni.vitals.infrastructure.web.controller;

import com.koni.vitals.application.command.ResolveAlertCommand;
import com.koni.vitals.application.command.ResolveAlertCommandHandler;
import com.koni.vitals.application.query.AlertResponse;
import com.koni.vitals.application.query.GetAlertsQuery;
import com.koni.vitals.application.query.GetAlertsQueryHandler;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for alerts.
 *
 * Endpoints:
 * - GET /api/v1/alerts?hours=24: unresolved alerts in the window, newest first
 * - POST /api/v1/alerts/{id}/resolve: mark an alert resolved
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class AlertController {

    private final GetAlertsQueryHandler queryHandler;
    private final ResolveAlertCommandHandler resolveHandler;

    @GetMapping("/v1/alerts")
    public ResponseEntity<List<AlertResponse>> getAlerts(
            @RequestParam(defaultValue = "24") @Min(1) @Max(AnomalyController.MAX_HOURS) int hours) {
        return ResponseEntity.ok(queryHandler.handle(new GetAlertsQuery(hours)));
    }

    /**
     * @param id the alert identifier
     * @return 204 No Content once resolved, 404 Not Found for an unknown alert
     */
    @PostMapping("/v1/alerts/{id}/resolve")
    public ResponseEntity<Void> resolve(@PathVariable Long id) {
        resolveHandler.handle(new ResolveAlertCommand(id));
        return ResponseEntity.noContent().build();
    }
}
