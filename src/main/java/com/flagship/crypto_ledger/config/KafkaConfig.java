package com.flagship.crypto_ledger.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Topics for the trading event stream.
 *
 * One topic per aggregate type; records are keyed by aggregate id so all
 * events of one account or one offer land on the same partition.
 */
@Configuration
@ConditionalOnProperty(name = "kafka.topics.auto-create", havingValue = "true", matchIfMissing = true)
public class KafkaConfig {

    @Value("${kafka.topic.accounts:accounts}")
    private String accountsTopic;

    @Value("${kafka.topic.orders:orders}")
    private String ordersTopic;

    @Value("${kafka.topic.offers:offers}")
    private String offersTopic;

    @Value("${kafka.topic.bonuses:bonuses}")
    private String bonusesTopic;

    @Bean
    public NewTopic accountsTopic() {
        return topic(accountsTopic);
    }

    @Bean
    public NewTopic ordersTopic() {
        return topic(ordersTopic);
    }

    @Bean
    public NewTopic offersTopic() {
        return topic(offersTopic);
    }

    @Bean
    public NewTopic bonusesTopic() {
        return topic(bonusesTopic);
    }

    private NewTopic topic(String name) {
        return TopicBuilder.name(name)
                .partitions(3)
                .replicas(1)
                .build();
    }
}
