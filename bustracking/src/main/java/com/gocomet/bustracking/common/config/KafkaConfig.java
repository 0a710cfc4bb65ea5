package com.gocomet.bustracking.common.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Kafka topic definitions.
 *
 * Topics:
 * coordination-events: audit log of waiting-flag and missed-bus transitions; keyed by entity id
 * rider-notifications: push/in-app notification queue; keyed by recipient id
 *
 * Partition count is 2 for local dev.
 */
@Configuration
public class KafkaConfig {

    @Value("${app.kafka.topics.coordination-events}")
    private String coordinationEventsTopic;

    @Value("${app.kafka.topics.rider-notifications}")
    private String riderNotificationsTopic;

    @Bean
    public NewTopic coordinationEventsTopic() {
        return TopicBuilder.name(coordinationEventsTopic)
                .partitions(2)
                .replicas(1)
                .build();
    }

    @Bean
    public NewTopic riderNotificationsTopic() {
        return TopicBuilder.name(riderNotificationsTopic)
                .partitions(2)
                .replicas(1)
                .build();
    }
}
