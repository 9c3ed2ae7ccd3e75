package com.flagship.classroom_ledger.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Topics owned by the service. Outbox events are keyed by aggregate id, so
 * the partition count bounds consumer parallelism per topic.
 */
@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.claims:classroom.claims}")
    private String claimsTopic;

    @Value("${kafka.topic.ledger:classroom.ledger}")
    private String ledgerTopic;

    @Value("${kafka.topic.enrollments:classroom.enrollments}")
    private String enrollmentsTopic;

    @Value("${kafka.topic.billing:classroom.billing}")
    private String billingTopic;

    @Bean
    public NewTopic claimsTopic() {
        return TopicBuilder.name(claimsTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }

    @Bean
    public NewTopic ledgerTopic() {
        return TopicBuilder.name(ledgerTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }

    @Bean
    public NewTopic enrollmentsTopic() {
        return TopicBuilder.name(enrollmentsTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }

    @Bean
    public NewTopic billingTopic() {
        return TopicBuilder.name(billingTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }
}
