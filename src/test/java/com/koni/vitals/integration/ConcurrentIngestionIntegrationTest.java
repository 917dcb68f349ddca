package com.koni.vitals.integration;

import com.koni.vitals.application.command.IngestionCoordinator;
import com.koni.vitals.application.command.IngestionOutcome;
import com.koni.vitals.domain.model.DeviceRecord;
import com.koni.vitals.domain.repository.AnomalyRecordRepository;
import com.koni.vitals.domain.repository.DeviceRegistry;
import com.koni.vitals.tags.IntegrationTest;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.TestPropertySource;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Concurrent writers for the same, previously unseen device must neither lose
 * counter increments nor fail on the first-reading insert race. Arrival times are
 * delivered out of order, and last_seen must still end at the latest one.
 */
@IntegrationTest
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.NONE)
@ActiveProfiles("test")
@TestPropertySource(properties = "vitals.persistence.commit-max-attempts=10")
class ConcurrentIngestionIntegrationTest {

    private static final int WRITERS = 8;
    private static final int READINGS_PER_WRITER = 20;

    @Autowired
    private IngestionCoordinator ingestionCoordinator;

    @Autowired
    private DeviceRegistry deviceRegistry;

    @Autowired
    private AnomalyRecordRepository anomalyRecordRepository;

    @Test
    void shouldCountEveryReadingAndKeepTimestampBoundsUnderConcurrentIngestion() throws Exception {
        // Given
        String deviceId = "monitor-" + UUID.randomUUID();
        int total = WRITERS * READINGS_PER_WRITER;
        Instant earliest = Instant.now().truncatedTo(ChronoUnit.SECONDS).minus(1, ChronoUnit.HOURS);
        List<Instant> arrivals = new ArrayList<>();
        for (int i = 0; i < total; i++) {
            arrivals.add(earliest.plusSeconds(i));
        }
        Instant latest = arrivals.get(total - 1);
        Collections.shuffle(arrivals, new Random(42));
        ExecutorService pool = Executors.newFixedThreadPool(WRITERS);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Integer>> results = new ArrayList<>();

        // When
        try {
            for (int writer = 0; writer < WRITERS; writer++) {
                List<Instant> share = arrivals.subList(writer * READINGS_PER_WRITER, (writer + 1) * READINGS_PER_WRITER);
                Callable<Integer> task = () -> {
                    start.await();
                    int accepted = 0;
                    for (Instant arrival : share) {
                        IngestionOutcome outcome = ingestionCoordinator.ingest(payload(deviceId), arrival);
                        if (outcome.isAccepted()) {
                            accepted++;
                        }
                    }
                    return accepted;
                };
                results.add(pool.submit(task));
            }
            start.countDown();

            int accepted = 0;
            for (Future<Integer> result : results) {
                accepted += result.get(60, TimeUnit.SECONDS);
            }

            // Then
            assertThat(accepted).isEqualTo(total);

            DeviceRecord device = deviceRegistry.findByDeviceId(deviceId).orElseThrow();
            assertThat(device.getTotalReadings()).isEqualTo(total);
            assertThat(anomalyRecordRepository.countByDeviceId(deviceId)).isEqualTo(total);
            assertThat(device.getLastSeen()).isEqualTo(latest);
            assertThat(device.getFirstSeen()).isEqualTo(earliest);
        } finally {
            pool.shutdownNow();
        }
    }

    private static Map<String, Object> payload(String deviceId) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("device_id", deviceId);
        payload.put("heart_rate", 72.0);
        payload.put("body_temp", 36.8);
        payload.put("signal_strength", -60.0);
        payload.put("battery_level", 75.0);
        return payload;
    }
}
