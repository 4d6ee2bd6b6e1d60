package com.flagship.subscription_billing.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Declares the subscription lifecycle topic.
 * Events are keyed by subscription id, so partitions keep per-subscription order.
 */
@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.subscriptions:subscription-events}")
    private String subscriptionsTopic;

    @Bean
    public NewTopic subscriptionsTopic() {
        return TopicBuilder.name(subscriptionsTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }
}
