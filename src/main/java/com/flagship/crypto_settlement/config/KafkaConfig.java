package com.flagship.crypto_settlement.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Declares the ledger sync topic. Messages are keyed by invoice id, so all
 * sync requests for one invoice land on the same partition.
 */
@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.ledger-sync:ledger-sync}")
    private String ledgerSyncTopic;

    @Value("${kafka.topic.ledger-sync-partitions:3}")
    private int partitions;

    @Bean
    public NewTopic ledgerSyncTopic() {
        return TopicBuilder.name(ledgerSyncTopic)
                .partitions(partitions)
                .replicas(1)
                .build();
    }
}
