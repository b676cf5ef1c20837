package com.flagship.recon_ledger.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Topics owned by this service. Statement extractions are produced by the
 * extraction collaborator; ledger and reconciliation events come out of the outbox.
 */
@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.ledger-events:ledger-events}")
    private String ledgerEventsTopic;

    @Value("${kafka.topic.reconciliation-events:reconciliation-events}")
    private String reconciliationEventsTopic;

    @Value("${kafka.topic.statement-extractions:statement-extractions}")
    private String statementExtractionsTopic;

    @Bean
    public NewTopic ledgerEventsTopic() {
        return TopicBuilder.name(ledgerEventsTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }

    @Bean
    public NewTopic reconciliationEventsTopic() {
        return TopicBuilder.name(reconciliationEventsTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }

    @Bean
    public NewTopic statementExtractionsTopic() {
        return TopicBuilder.name(statementExtractionsTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }
}
