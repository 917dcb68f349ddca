package com.koni.vitals.infrastructure.web.controller;

import com.koni.vitals.application.service.DlqManagementService;
import com.koni.vitals.infrastructure.web.dto.DlqMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * REST controller for readings parked on the dead letter topic after their commit kept failing.
 *
 * Endpoints:
 * - GET /api/v1/admin/dlq: list parked readings with the error that parked them
 * - POST /api/v1/admin/dlq/reprocess: republish parked readings to the main topic
 *
 * Broker failures surface as 503 through the global exception handler.
 */
@RestController
@RequestMapping("/api/v1/admin")
@RequiredArgsConstructor
@Slf4j
public class DlqAdminController {

    private final DlqManagementService dlqManagementService;

    /**
     * Example response (200 OK):
     * [
     *   {
     *     "deviceKey": "monitor-7",
     *     "payload": "{\"device_id\":\"monitor-7\",\"heart_rate\":72, ...}",
     *     "errorMessage": "Failed to commit reading for device monitor-7",
     *     "retryCount": 3,
     *     "timestamp": "2025-01-31T10:05:00Z",
     *     "partition": 1,
     *     "offset": 17
     *   }
     * ]
     */
    @GetMapping("/dlq")
    public ResponseEntity<List<DlqMessage>> listDlqMessages() {
        List<DlqMessage> messages = dlqManagementService.listDlqMessages();
        log.info("Returning {} DLQ messages", messages.size());
        return ResponseEntity.ok(messages);
    }

    /**
     * @return 202 Accepted with the number of republished readings
     */
    @PostMapping("/dlq/reprocess")
    public ResponseEntity<Map<String, Object>> reprocessDlqMessages() {
        int reprocessedCount = dlqManagementService.reprocessDlqMessages();

        String message = reprocessedCount > 0
                ? String.format("Republished %d readings from DLQ", reprocessedCount)
                : "No readings to reprocess in DLQ";

        return ResponseEntity.accepted().body(Map.of(
                "message", message,
                "reprocessedCount", reprocessedCount
        ));
    }
}
