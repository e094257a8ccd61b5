package com.flagship.retainer_settlement.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Topics the outbox publisher writes to. Events are keyed by deal or invoice id,
 * so events of one aggregate stay in one partition.
 */
@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.settlement-events:settlement-events}")
    private String settlementEventsTopic;

    @Value("${kafka.topic.invoice-events:invoice-events}")
    private String invoiceEventsTopic;

    @Value("${kafka.topic.partitions:3}")
    private int partitions;

    @Bean
    public NewTopic settlementEventsTopic() {
        return TopicBuilder.name(settlementEventsTopic)
                .partitions(partitions)
                .replicas(1)
                .build();
    }

    @Bean
    public NewTopic invoiceEventsTopic() {
        return TopicBuilder.name(invoiceEventsTopic)
                .partitions(partitions)
                .replicas(1)
                .build();
    }
}
