package com.koni.vitals.infrastructure.web.controller;

import com.koni.vitals.application.query.ExportReadingsQuery;
import com.koni.vitals.application.query.ExportReadingsQueryHandler;
import com.koni.vitals.application.query.ReadingExportRow;
import com.koni.vitals.infrastructure.web.export.ReadingCsvWriter;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for the audit log export.
 *
 * Endpoints:
 * - GET /api/v1/readings/export?hours=24: every audit row in the window as text/csv, newest first
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class ReadingExportController {

    static final MediaType TEXT_CSV = MediaType.parseMediaType("text/csv");

    private final ExportReadingsQueryHandler queryHandler;
    private final ReadingCsvWriter csvWriter;

    @GetMapping("/v1/readings/export")
    public ResponseEntity<String> export(
            @RequestParam(defaultValue = "24") @Min(1) @Max(AnomalyController.MAX_HOURS) int hours) {
        List<ReadingExportRow> rows = queryHandler.handle(new ExportReadingsQuery(hours));

        return ResponseEntity.ok()
                .contentType(TEXT_CSV)
                .header(HttpHeaders.CONTENT_DISPOSITION,
                        ContentDisposition.attachment().filename("vitals-export.csv").build().toString())
                .body(csvWriter.write(rows));
    }
}
