package com.koni.vitals.infrastructure.web.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Data Transfer Object for a reading parked on the dead letter topic.
 *
 * Contains:
 * - deviceKey: the record key, the device id the publisher used
 * - payload: the original JSON text, exactly as received
 * - errorMessage: why the last attempt failed
 * - retryCount: delivery attempts before the reading was parked
 * - timestamp: when the record was written to the dead letter topic
 * - partition / offset: position on the dead letter topic
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class DlqMessage {

    private String deviceKey;
    private String payload;
    private String errorMessage;
    private int retryCount;
    private Instant timestamp;
    private int partition;
    private long offset;
}
