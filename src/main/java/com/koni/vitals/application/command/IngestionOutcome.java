package com.koni.vitals.application.command;

import com.koni.vitals.domain.model.Verdict;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Result of one ingestion call, returned to the request transport and logged by the
 * pub/sub transport. Business conditions are expressed here instead of as exceptions.
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class IngestionOutcome {

    public enum Status {
        ACCEPTED,
        REJECTED
    }

    private final Status status;
    private final String reason;
    private final Long recordId;
    private final Verdict verdict;

    public static IngestionOutcome accepted(Long recordId, Verdict verdict) {
        return new IngestionOutcome(Status.ACCEPTED, null, recordId, verdict);
    }

    public static IngestionOutcome rejected(String reason) {
        return new IngestionOutcome(Status.REJECTED, reason, null, null);
    }

    public boolean isAccepted() {
        return status == Status.ACCEPTED;
    }
}
