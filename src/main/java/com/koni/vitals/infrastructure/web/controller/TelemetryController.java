package com.koni.vitals.infrastructure.web.controller;

import com.koni.vitals.application.command.IngestionCoordinator;
import com.koni.vitals.application.command.IngestionOutcome;
import com.koni.vitals.infrastructure.web.dto.IngestionResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.Map;

/**
 * REST controller for reading ingestion, the request-style entry point of the pipeline.
 *
 * Endpoints:
 * - POST /api/v1/telemetry: classify and store one reading
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class TelemetryController {

    private final IngestionCoordinator ingestionCoordinator;

    /**
     * Accepts one reading. The body is taken as a free-form JSON object so that a missing
     * field becomes a MISSING_FIELDS verdict rather than a binding error.
     *
     * Example request:
     * POST /api/v1/telemetry
     * {
     *   "device_id": "monitor-7",
     *   "heart_rate": 72,
     *   "body_temp": 36.8,
     *   "signal_strength": -60,
     *   "battery_level": 80
     * }
     *
     * @param payload the decoded JSON object
     * @return 200 OK when accepted, 400 Bad Request when rejected; storage failures and
     *         cancellations become 503 through the exception handler
     */
    @PostMapping("/v1/telemetry")
    public ResponseEntity<IngestionResponse> ingest(@RequestBody Map<String, Object> payload) {
        log.debug("Received reading over HTTP: deviceId={}", payload.get("device_id"));

        IngestionOutcome outcome = ingestionCoordinator.ingest(payload, Instant.now());

        IngestionResponse response = IngestionResponse.from(outcome);
        if (!outcome.isAccepted()) {
            return ResponseEntity.badRequest().body(response);
        }
        return ResponseEntity.ok(response);
    }
}
