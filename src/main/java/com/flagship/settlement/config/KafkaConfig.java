package com.flagship.settlement.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Kafka topic for settlement domain events.
 *
 * Every aggregate (transaction, escrow, conversion, payout) publishes to the
 * same topic keyed by aggregate id, so events for one aggregate stay ordered
 * within a partition.
 */
@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.settlement:settlement-events}")
    private String settlementTopic;

    @Value("${kafka.topic.partitions:3}")
    private int partitions;

    @Bean
    public NewTopic settlementTopic() {
        return TopicBuilder.name(settlementTopic)
                .partitions(partitions)
                .replicas(1)
                .build();
    }
}
