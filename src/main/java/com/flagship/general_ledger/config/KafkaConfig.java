package com.flagship.general_ledger.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Declares the topic that carries ledger events published from the outbox.
 */
@Configuration
public class KafkaConfig {

    /**
     * Three partitions keyed by aggregate id, so events of one voucher or
     * approval request stay ordered.
     */
    @Bean
    public NewTopic ledgerEventsTopic(LedgerProperties properties) {
        return TopicBuilder.name(properties.getEvents().getTopic())
                .partitions(3)
                .replicas(1)
                .build();
    }
}
