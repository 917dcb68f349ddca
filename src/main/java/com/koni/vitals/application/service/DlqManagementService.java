package com.koni.vitals.application.service;

import com.koni.vitals.domain.exception.KafkaUnavailableException;
import com.koni.vitals.infrastructure.messaging.KafkaTopicConfig;
import com.koni.vitals.infrastructure.observability.VitalsMetrics;
import com.koni.vitals.infrastructure.web.dto.DlqMessage;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.PartitionInfo;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.header.Header;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.KafkaHeaders;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Service for managing readings parked on the Dead Letter Queue (DLQ).
 *
 * This service provides functionality to:
 * - List the parked readings with the error that parked them
 * - Replay parked readings by republishing them, unchanged, to the main topic
 *
 * Replay progress is tracked by a dedicated consumer group, so a reading is replayed once.
 */
@Slf4j
@Service
public class DlqManagementService {

    static final String REPLAY_GROUP = "vitals-dlq-replay";

    private static final Duration POLL_TIMEOUT = Duration.ofSeconds(2);
    private static final int PUBLISH_TIMEOUT_SECONDS = 10;

    private final ConsumerFactory<String, String> consumerFactory;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final VitalsMetrics metrics;
    private final String mainTopic;
    private final String deadLetterTopic;

    public DlqManagementService(ConsumerFactory<String, String> consumerFactory,
                                KafkaTemplate<String, String> kafkaTemplate,
                                VitalsMetrics metrics,
                                @Value("${vitals.kafka.topic:vitals.readings}") String mainTopic) {
        this.consumerFactory = consumerFactory;
        this.kafkaTemplate = kafkaTemplate;
        this.metrics = metrics;
        this.mainTopic = mainTopic;
        this.deadLetterTopic = KafkaTopicConfig.deadLetterTopicOf(mainTopic);
    }

    /**
     * Lists every reading currently on the dead letter topic, from the beginning.
     *
     * @return the parked readings, empty when there are none
     * @throws KafkaUnavailableException if the broker cannot be read
     */
    public List<DlqMessage> listDlqMessages() {
        log.info("Listing messages from DLQ topic: {}", deadLetterTopic);

        try (Consumer<String, String> consumer =
                     consumerFactory.createConsumer("dlq-reader-" + System.currentTimeMillis(), "dlq-reader")) {

            List<TopicPartition> partitions = assign(consumer);
            consumer.seekToBeginning(partitions);

            List<DlqMessage> messages = new ArrayList<>();
            for (ConsumerRecord<String, String> record : drain(consumer)) {
                messages.add(toMessage(record));
            }

            log.info("Found {} messages in DLQ", messages.size());
            return messages;

        } catch (KafkaException e) {
            log.error("Failed to list DLQ messages from topic: {}", deadLetterTopic, e);
            throw new KafkaUnavailableException("Failed to list DLQ messages: " + e.getMessage(), e);
        }
    }

    /**
     * Republishes the readings not replayed yet to the main topic, keeping their keys.
     * Offsets are committed only up to the last successfully republished record of each
     * partition, so a failed publish is retried by the next call.
     *
     * @return the number of readings republished
     * @throws KafkaUnavailableException if the broker cannot be read
     */
    public int reprocessDlqMessages() {
        log.info("Starting DLQ replay from topic {} to topic {}", deadLetterTopic, mainTopic);

        int successCount = 0;

        try (Consumer<String, String> consumer = consumerFactory.createConsumer(REPLAY_GROUP, "dlq-replay")) {
            assign(consumer);

            List<ConsumerRecord<String, String>> records = drain(consumer);
            log.info("Found {} messages to replay from DLQ", records.size());

            Map<TopicPartition, OffsetAndMetadata> committable = new HashMap<>();
            Set<TopicPartition> failedPartitions = new HashSet<>();

            for (ConsumerRecord<String, String> record : records) {
                TopicPartition partition = new TopicPartition(record.topic(), record.partition());
                if (failedPartitions.contains(partition)) {
                    continue;
                }
                try {
                    republish(record);
                    metrics.recordDlqMessageReprocessed();
                    committable.put(partition, new OffsetAndMetadata(record.offset() + 1));
                    successCount++;
                } catch (KafkaUnavailableException e) {
                    failedPartitions.add(partition);
                    log.error("Failed to replay DLQ message: partition={}, offset={}, key={}",
                            record.partition(), record.offset(), record.key(), e);
                }
            }

            if (!committable.isEmpty()) {
                consumer.commitSync(committable);
            }

        } catch (KafkaException e) {
            log.error("Failed to replay DLQ messages from topic: {}", deadLetterTopic, e);
            throw new KafkaUnavailableException("Failed to replay DLQ messages: " + e.getMessage(), e);
        }

        log.info("DLQ replay completed: {} messages republished", successCount);
        return successCount;
    }

    private List<TopicPartition> assign(Consumer<String, String> consumer) {
        List<PartitionInfo> infos = consumer.partitionsFor(deadLetterTopic);
        if (infos == null || infos.isEmpty()) {
            return Collections.emptyList();
        }
        List<TopicPartition> partitions = infos.stream()
                .map(info -> new TopicPartition(info.topic(), info.partition()))
                .collect(Collectors.toList());
        consumer.assign(partitions);
        return partitions;
    }

    private List<ConsumerRecord<String, String>> drain(Consumer<String, String> consumer) {
        List<ConsumerRecord<String, String>> records = new ArrayList<>();
        if (consumer.assignment().isEmpty()) {
            return records;
        }
        ConsumerRecords<String, String> batch = consumer.poll(POLL_TIMEOUT);
        while (!batch.isEmpty()) {
            batch.forEach(records::add);
            batch = consumer.poll(POLL_TIMEOUT);
        }
        return records;
    }

    private void republish(ConsumerRecord<String, String> record) {
        try {
            kafkaTemplate.send(mainTopic, record.key(), record.value()).get(PUBLISH_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            log.info("Replayed DLQ message: key={}, dlqOffset={}", record.key(), record.offset());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new KafkaUnavailableException("Interrupted while republishing DLQ message", e);
        } catch (ExecutionException | TimeoutException e) {
            throw new KafkaUnavailableException("Failed to republish DLQ message: " + e.getMessage(), e);
        }
    }

    private DlqMessage toMessage(ConsumerRecord<String, String> record) {
        String errorMessage = headerValue(record, "exception-message");
        if (errorMessage == null) {
            errorMessage = headerValue(record, KafkaHeaders.DLT_EXCEPTION_MESSAGE);
        }
        return new DlqMessage(
                record.key(),
                record.value(),
                errorMessage == null ? "Unknown error" : errorMessage,
                retryCount(record),
                Instant.ofEpochMilli(record.timestamp()),
                record.partition(),
                record.offset()
        );
    }

    private String headerValue(ConsumerRecord<String, String> record, String headerName) {
        Header header = record.headers().lastHeader(headerName);
        if (header != null && header.value() != null) {
            return new String(header.value(), StandardCharsets.UTF_8);
        }
        return null;
    }

    private int retryCount(ConsumerRecord<String, String> record) {
        String value = headerValue(record, "retry-count");
        if (value == null) {
            return 0;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            log.warn("Failed to parse retry count from header: {}", value);
            return 0;
        }
    }
}
