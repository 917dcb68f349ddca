package com.koni.vitals.infrastructure.messaging;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Topics of the reading subscription.
 *
 * Devices publish with their device id as key, so readings of one device stay in order
 * within a partition. The dead letter topic mirrors the partitioning of the main one.
 */
@Configuration
public class KafkaTopicConfig {

    static final String DLQ_SUFFIX = ".dlq";

    @Value("${vitals.kafka.topic:vitals.readings}")
    private String topicName;

    @Value("${vitals.kafka.partitions:3}")
    private int partitions;

    @Value("${vitals.kafka.replication-factor:1}")
    private short replicationFactor;

    @Bean
    public NewTopic readingsTopic() {
        return TopicBuilder.name(topicName)
                .partitions(partitions)
                .replicas(replicationFactor)
                .build();
    }

    @Bean
    public NewTopic readingsDeadLetterTopic() {
        return TopicBuilder.name(topicName + DLQ_SUFFIX)
                .partitions(partitions)
                .replicas(replicationFactor)
                .build();
    }

    /**
     * @param topic the main topic name
     * @return the dead letter topic name for it
     */
    public static String deadLetterTopicOf(String topic) {
        return topic + DLQ_SUFFIX;
    }
}
