package com.koni.vitals.application.query;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * One audit row as exported, in the column order of the audit table.
 * is_anomaly is exported as 0/1 and the timestamp as ISO-8601 UTC.
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({"ID", "Timestamp", "Device ID", "Heart Rate", "Temp", "Signal", "Battery", "Anomaly", "Type", "Raw Data"})
public class ReadingExportRow {

    @JsonProperty("ID")
    private Long id;

    @JsonProperty("Timestamp")
    private String timestamp;

    @JsonProperty("Device ID")
    private String deviceId;

    @JsonProperty("Heart Rate")
    private Double heartRate;

    @JsonProperty("Temp")
    private Double bodyTemp;

    @JsonProperty("Signal")
    private Double signalStrength;

    @JsonProperty("Battery")
    private Double batteryLevel;

    @JsonProperty("Anomaly")
    private int anomaly;

    @JsonProperty("Type")
    private String anomalyType;

    @JsonProperty("Raw Data")
    private String rawData;
}
