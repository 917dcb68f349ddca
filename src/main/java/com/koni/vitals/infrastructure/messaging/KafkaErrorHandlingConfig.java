package com.koni.vitals.infrastructure.messaging;

import com.koni.vitals.infrastructure.observability.VitalsMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.common.TopicPartition;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.listener.CommonErrorHandler;
import org.springframework.kafka.listener.DeadLetterPublishingRecoverer;
import org.springframework.kafka.listener.DefaultErrorHandler;
import org.springframework.util.backoff.ExponentialBackOff;

import java.nio.charset.StandardCharsets;

/**
 * Kafka error handling configuration for Dead Letter Queue (DLQ) support.
 *
 * Only storage failures reach this handler; bad payloads are acknowledged by the listener.
 * - Exponential backoff retry strategy (1s, 2s, 4s)
 * - Maximum 3 retry attempts before sending to DLQ
 * - Dead Letter Queue topic: "&lt;topic&gt;.dlq", same partition as the original record
 * - Retry count and error message tracked in message headers
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class KafkaErrorHandlingConfig {

    static final String RETRY_COUNT_HEADER = "retry-count";
    static final String EXCEPTION_MESSAGE_HEADER = "exception-message";

    private static final long INITIAL_INTERVAL = 1000L;
    private static final double MULTIPLIER = 2.0;
    private static final int MAX_ATTEMPTS = 3;

    private final VitalsMetrics metrics;

    @Value("${vitals.kafka.topic:vitals.readings}")
    private String topicName;

    /**
     * Creates a DefaultErrorHandler with Dead Letter Queue support.
     *
     * @param kafkaTemplate the Kafka template for publishing to DLQ
     * @return configured DefaultErrorHandler with DLQ support
     */
    @Bean
    public CommonErrorHandler errorHandler(KafkaTemplate<String, String> kafkaTemplate) {
        String deadLetterTopic = KafkaTopicConfig.deadLetterTopicOf(topicName);

        DeadLetterPublishingRecoverer recoverer = new DeadLetterPublishingRecoverer(
                kafkaTemplate,
                (consumerRecord, exception) -> {
                    log.error("Sending reading to DLQ after {} retries: topic={}, key={}, value={}, error={}",
                            MAX_ATTEMPTS,
                            consumerRecord.topic(),
                            consumerRecord.key(),
                            consumerRecord.value(),
                            exception.getMessage(),
                            exception);

                    metrics.recordDlqMessageSent();

                    return new TopicPartition(deadLetterTopic, consumerRecord.partition());
                }
        );

        ExponentialBackOff backOff = new ExponentialBackOff(INITIAL_INTERVAL, MULTIPLIER);
        backOff.setMaxAttempts(MAX_ATTEMPTS);

        DefaultErrorHandler errorHandler = new DefaultErrorHandler(recoverer, backOff);

        errorHandler.setRetryListeners((consumerRecord, exception, deliveryAttempt) -> {
            log.warn("Retry attempt {} for reading: topic={}, key={}, error={}",
                    deliveryAttempt,
                    consumerRecord.topic(),
                    consumerRecord.key(),
                    exception.getMessage());

            consumerRecord.headers().remove(RETRY_COUNT_HEADER);
            consumerRecord.headers().add(RETRY_COUNT_HEADER,
                    String.valueOf(deliveryAttempt).getBytes(StandardCharsets.UTF_8));

            String message = exception.getMessage() == null ? exception.getClass().getName() : exception.getMessage();
            consumerRecord.headers().remove(EXCEPTION_MESSAGE_HEADER);
            consumerRecord.headers().add(EXCEPTION_MESSAGE_HEADER, message.getBytes(StandardCharsets.UTF_8));
        });

        return errorHandler;
    }
}
