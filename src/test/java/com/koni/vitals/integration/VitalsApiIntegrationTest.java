package com.koni.vitals.integration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.koni.vitals.tags.IntegrationTest;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Integration tests running readings through the HTTP API into H2 and reading them back.
 * Each test uses its own device id, so tests do not see each other's data.
 */
@IntegrationTest
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class VitalsApiIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Test
    void shouldAcceptNormalReadingAndCountItForDevice() throws Exception {
        // Given
        String deviceId = newDeviceId();

        // When
        ingest(reading(deviceId, "72", "36.8", "-60", "75"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("accepted"))
                .andExpect(jsonPath("$.anomaly").value(false))
                .andExpect(jsonPath("$.recordId").isNumber());

        // Then
        mockMvc.perform(get("/api/v1/devices/{deviceId}/stats", deviceId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.deviceId").value(deviceId))
                .andExpect(jsonPath("$.totalReadings").value(1))
                .andExpect(jsonPath("$.anomalies").value(0))
                .andExpect(jsonPath("$.anomalyRate").value(0.0))
                .andExpect(jsonPath("$.status").value("ACTIVE"));

        mockMvc.perform(get("/api/v1/devices"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[*].deviceId", hasItem(deviceId)));
    }

    @Test
    void shouldReportRuleViolationAndRaiseAlert() throws Exception {
        // Given
        String deviceId = newDeviceId();

        // When
        ingest(reading(deviceId, "150", "36.8", "-60", "5"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.anomaly").value(true))
                .andExpect(jsonPath("$.anomalyType").value("OUT_OF_RANGE_HR"))
                .andExpect(jsonPath("$.source").value("RULE"));

        // Then
        mockMvc.perform(get("/api/v1/anomalies").param("deviceId", deviceId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1))
                .andExpect(jsonPath("$[0].anomalyType").value("OUT_OF_RANGE_HR"))
                .andExpect(jsonPath("$[0].ruleViolations", hasItem("LOW_BATTERY")))
                .andExpect(jsonPath("$[0].rawData", startsWith("{")));

        mockMvc.perform(get("/api/v1/alerts"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[?(@.deviceId == '" + deviceId + "')].severity", hasItem("CRITICAL")));

        mockMvc.perform(get("/api/v1/devices/{deviceId}/stats", deviceId))
                .andExpect(jsonPath("$.anomalies").value(1))
                .andExpect(jsonPath("$.anomalyRate").value(100.0));
    }

    @Test
    void shouldReportStatisticalAnomalyWhenRulesPass() throws Exception {
        // heart rate 100 is inside the medical range but isolated by the fixture model
        ingest(reading(newDeviceId(), "100", "36.8", "-60", "75"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.anomalyType").value("ML_ANOMALY"))
                .andExpect(jsonPath("$.source").value("ML"));
    }

    @Test
    void shouldStoreIncompleteReadingWithoutAlert() throws Exception {
        // Given
        String deviceId = newDeviceId();

        // When
        ingest("{\"device_id\":\"" + deviceId + "\",\"heart_rate\":72,\"body_temp\":null}")
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.anomalyType").value("MISSING_FIELDS"))
                .andExpect(jsonPath("$.source").value("NONE"));

        // Then
        mockMvc.perform(get("/api/v1/alerts"))
                .andExpect(jsonPath("$[*].deviceId", not(hasItem(deviceId))));
        mockMvc.perform(get("/api/v1/devices/{deviceId}/stats", deviceId))
                .andExpect(jsonPath("$.totalReadings").value(1));
    }

    @Test
    void shouldRejectNonNumericMeasurementWithoutStoringIt() throws Exception {
        // Given
        String deviceId = newDeviceId();

        // When
        ingest("{\"device_id\":\"" + deviceId + "\",\"heart_rate\":\"72\",\"body_temp\":36.8,"
                + "\"signal_strength\":-60,\"battery_level\":75}")
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value("rejected"))
                .andExpect(jsonPath("$.reason", startsWith("heart_rate")));

        // Then
        mockMvc.perform(get("/api/v1/devices/{deviceId}/stats", deviceId))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Device not found: " + deviceId));
    }

    @Test
    void shouldResolveAlertAndHideIt() throws Exception {
        // Given
        String deviceId = newDeviceId();
        ingest(reading(deviceId, "72", "39.5", "-60", "75")).andExpect(status().isOk());
        long alertId = alertIdOf(deviceId);

        // When
        mockMvc.perform(post("/api/v1/alerts/{id}/resolve", alertId))
                .andExpect(status().isNoContent());

        // Then
        mockMvc.perform(get("/api/v1/alerts"))
                .andExpect(jsonPath("$[*].deviceId", not(hasItem(deviceId))));
    }

    @Test
    void shouldReturnNotFoundWhenResolvingUnknownAlert() throws Exception {
        mockMvc.perform(post("/api/v1/alerts/{id}/resolve", Long.MAX_VALUE))
                .andExpect(status().isNotFound());
    }

    @Test
    void shouldExportNormalAndAnomalousReadingsAsCsv() throws Exception {
        // Given
        String deviceId = newDeviceId();
        ingest(reading(deviceId, "72", "36.8", "-60", "75")).andExpect(status().isOk());
        ingest(reading(deviceId, "150", "36.8", "-60", "75")).andExpect(status().isOk());

        // When
        String csv = mockMvc.perform(get("/api/v1/readings/export").param("hours", "1"))
                .andExpect(status().isOk())
                .andExpect(content().contentTypeCompatibleWith("text/csv"))
                .andReturn().getResponse().getContentAsString();

        // Then
        assertThat(csv.lines().findFirst()).hasValueSatisfying(header -> assertThat(header).startsWith("ID,Timestamp,"));
        assertThat(csv.lines().filter(line -> line.contains(deviceId + ",")))
                .hasSize(2)
                .anySatisfy(line -> assertThat(line).contains("OUT_OF_RANGE_HR"));
    }

    @Test
    void shouldRejectInvalidTimeWindows() throws Exception {
        mockMvc.perform(get("/api/v1/anomalies").param("hours", "0"))
                .andExpect(status().isBadRequest());
        mockMvc.perform(get("/api/v1/anomalies").param("hours", "721"))
                .andExpect(status().isBadRequest());
        mockMvc.perform(get("/api/v1/alerts").param("hours", "-3"))
                .andExpect(status().isBadRequest());
        mockMvc.perform(get("/api/v1/anomalies").param("hours", "yesterday"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void shouldExposeDatabaseAndClassifierHealth() throws Exception {
        mockMvc.perform(get("/actuator/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"))
                .andExpect(jsonPath("$.components.database.status").value("UP"))
                .andExpect(jsonPath("$.components.classifier.status").value("UP"))
                .andExpect(jsonPath("$.components.classifier.details.modelLoaded").value(true));
    }

    private ResultActions ingest(String body) throws Exception {
        return mockMvc.perform(post("/api/v1/telemetry")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body));
    }

    private long alertIdOf(String deviceId) throws Exception {
        String body = mockMvc.perform(get("/api/v1/alerts"))
                .andExpect(status().isOk())
                .andReturn().getResponse().getContentAsString();
        for (JsonNode alert : objectMapper.readTree(body)) {
            if (deviceId.equals(alert.get("deviceId").asText())) {
                return alert.get("id").asLong();
            }
        }
        throw new AssertionError("No alert for device " + deviceId);
    }

    private static String reading(String deviceId, String heartRate, String bodyTemp,
                                  String signalStrength, String batteryLevel) {
        return "{\"device_id\":\"" + deviceId + "\""
                + ",\"heart_rate\":" + heartRate
                + ",\"body_temp\":" + bodyTemp
                + ",\"signal_strength\":" + signalStrength
                + ",\"battery_level\":" + batteryLevel + "}";
    }

    private static String newDeviceId() {
        return "monitor-" + UUID.randomUUID();
    }
}
