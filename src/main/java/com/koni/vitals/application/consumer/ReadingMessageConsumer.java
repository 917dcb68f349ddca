package com.koni.vitals.application.consumer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.koni.vitals.application.command.IngestionCoordinator;
import com.koni.vitals.application.command.IngestionOutcome;
import com.koni.vitals.domain.exception.DatabaseUnavailableException;
import com.koni.vitals.domain.exception.IngestionCancelledException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Map;

/**
 * ReadingMessageConsumer is the subscribe-style entry point of the pipeline.
 * There is no caller to answer, so every outcome ends in the log.
 *
 * Key responsibilities:
 * - Decode each message as a JSON object and hand it to the ingestion coordinator
 * - Acknowledge malformed and rejected messages, since redelivery cannot fix them
 * - Leave storage failures and cancelled ingestions unacknowledged so the error handler
 *   retries them and, when retries are exhausted, forwards them to the dead letter topic
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReadingMessageConsumer {

    private static final TypeReference<Map<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {
    };

    private final IngestionCoordinator ingestionCoordinator;
    private final ObjectMapper objectMapper;

    /**
     * Consumes one reading from the subscription topic.
     *
     * @param record the Kafka record holding the JSON payload
     * @param acknowledgment the Kafka acknowledgment for manual offset commit
     * @throws DatabaseUnavailableException when the reading could not be committed
     * @throws IngestionCancelledException when ingestion was aborted before commit
     */
    @KafkaListener(
            topics = "${vitals.kafka.topic:vitals.readings}",
            groupId = "${spring.kafka.consumer.group-id}",
            containerFactory = "kafkaListenerContainerFactory"
    )
    public void consume(ConsumerRecord<String, String> record, Acknowledgment acknowledgment) {
        log.debug("Received reading: topic={}, partition={}, offset={}, key={}",
                record.topic(), record.partition(), record.offset(), record.key());

        Map<String, Object> payload = decode(record);
        if (payload == null) {
            acknowledgment.acknowledge();
            return;
        }

        try {
            IngestionOutcome outcome = ingestionCoordinator.ingest(payload, Instant.now());
            if (!outcome.isAccepted()) {
                log.debug("Reading dropped: partition={}, offset={}, reason={}",
                        record.partition(), record.offset(), outcome.getReason());
            }
            acknowledgment.acknowledge();
        } catch (DatabaseUnavailableException e) {
            log.error("Reading not committed, leaving it for retry: partition={}, offset={}, payload={}",
                    record.partition(), record.offset(), record.value(), e);
            throw e;
        } catch (IngestionCancelledException e) {
            log.error("Reading cancelled before commit, leaving it for redelivery: partition={}, offset={}, payload={}",
                    record.partition(), record.offset(), record.value());
            throw e;
        }
    }

    private Map<String, Object> decode(ConsumerRecord<String, String> record) {
        if (record.value() == null) {
            log.warn("Empty message skipped: partition={}, offset={}", record.partition(), record.offset());
            return null;
        }
        try {
            JsonNode node = objectMapper.readTree(record.value());
            if (node == null || !node.isObject()) {
                log.warn("Message is not a JSON object, skipped: partition={}, offset={}, value={}",
                        record.partition(), record.offset(), record.value());
                return null;
            }
            return objectMapper.convertValue(node, PAYLOAD_TYPE);
        } catch (JsonProcessingException e) {
            log.warn("Malformed JSON skipped: partition={}, offset={}, value={}, error={}",
                    record.partition(), record.offset(), record.value(), e.getOriginalMessage());
            return null;
        }
    }
}
