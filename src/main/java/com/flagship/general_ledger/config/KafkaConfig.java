package com.flagship.general_ledger.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Kafka topic for journal events relayed from the outbox.
 */
@Configuration
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
public class KafkaConfig {

    @Value("${kafka.topic.journal-events:ledger.journal-events}")
    private String journalEventsTopic;

    /**
     * Partitioned by entry id; three partitions keep per-entry ordering while
     * allowing parallel consumers.
     */
    @Bean
    public NewTopic journalEventsTopic() {
        return TopicBuilder.name(journalEventsTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }
}
