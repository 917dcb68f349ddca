package com.koni.vitals.infrastructure.web.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.koni.vitals.application.command.IngestionOutcome;
import com.koni.vitals.domain.model.AnomalyType;
import com.koni.vitals.domain.model.DetectionSource;
import com.koni.vitals.domain.model.Verdict;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Response body of the ingestion endpoint.
 *
 * Accepted: {"status":"accepted","recordId":..,"anomaly":..,"anomalyType":..,"source":..}
 * Rejected: {"status":"rejected","reason":..}
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class IngestionResponse {

    public static final String ACCEPTED = "accepted";
    public static final String REJECTED = "rejected";

    private String status;
    private Long recordId;
    private Boolean anomaly;
    private AnomalyType anomalyType;
    private DetectionSource source;
    private String reason;

    public static IngestionResponse from(IngestionOutcome outcome) {
        if (!outcome.isAccepted()) {
            return new IngestionResponse(REJECTED, null, null, null, null, outcome.getReason());
        }
        Verdict verdict = outcome.getVerdict();
        return new IngestionResponse(
                ACCEPTED,
                outcome.getRecordId(),
                verdict.isAnomaly(),
                verdict.getAnomalyType(),
                verdict.getSource(),
                null);
    }
}
