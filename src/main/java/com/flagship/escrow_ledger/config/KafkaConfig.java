package com.flagship.escrow_ledger.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Kafka topics of the escrow ledger.
 *
 * escrow-events carries what this service publishes through the outbox,
 * keyed by escrow payment or settlement ID. order-events is consumed.
 */
@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.escrow-events:escrow-events}")
    private String escrowEventsTopic;

    @Value("${kafka.topic.order-events:order-events}")
    private String orderEventsTopic;

    @Value("${kafka.topic.partitions:3}")
    private int partitions;

    @Bean
    public NewTopic escrowEventsTopic() {
        return TopicBuilder.name(escrowEventsTopic)
                .partitions(partitions)
                .replicas(1)
                .build();
    }

    @Bean
    public NewTopic orderEventsTopic() {
        return TopicBuilder.name(orderEventsTopic)
                .partitions(partitions)
                .replicas(1)
                .build();
    }
}
