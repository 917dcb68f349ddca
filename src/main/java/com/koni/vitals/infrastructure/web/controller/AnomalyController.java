package com.koni.vitals.infrastructure.web.controller;

import com.koni.vitals.application.query.AnomalyResponse;
import com.koni.vitals.application.query.GetAnomaliesQuery;
import com.koni.vitals.application.query.GetAnomaliesQueryHandler;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for the anomaly log.
 *
 * Endpoints:
 * - GET /api/v1/anomalies?hours=24&amp;deviceId=: anomalous readings in the window, newest first
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class AnomalyController {

    /** Longest look-back accepted by the read endpoints: 30 days. */
    static final long MAX_HOURS = 720;

    private final GetAnomaliesQueryHandler queryHandler;

    @GetMapping("/v1/anomalies")
    public ResponseEntity<List<AnomalyResponse>> getAnomalies(
            @RequestParam(defaultValue = "24") @Min(1) @Max(MAX_HOURS) int hours,
            @RequestParam(required = false) String deviceId) {
        return ResponseEntity.ok(queryHandler.handle(new GetAnomaliesQuery(hours, deviceId)));
    }
}
