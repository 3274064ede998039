package com.harvestlink.provenance.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Kafka topic for relayed provenance events. Only declared when the relay is on.
 */
@Configuration
@ConditionalOnProperty(name = "provenance.kafka.relay.enabled", havingValue = "true")
public class KafkaConfig {

    @Value("${provenance.kafka.topic:provenance-events}")
    private String eventsTopic;

    @Value("${provenance.kafka.partitions:3}")
    private int partitions;

    @Bean
    public NewTopic provenanceEventsTopic() {
        return TopicBuilder.name(eventsTopic)
                .partitions(partitions)
                .replicas(1)
                .build();
    }
}
