package com.example.handoff.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.HashMap;
import java.util.Map;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.StringSerializer;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.kafka.KafkaProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaAdmin;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;
import org.springframework.kafka.support.serializer.JsonSerializer;

@Configuration
@ConditionalOnProperty(prefix = "chat.kafka", name = "enabled", havingValue = "true")
public class KafkaConfig {

    /**
     * One producer for both topics. Values are written with the application's {@link ObjectMapper} so instants
     * leave as ISO-8601 strings, without type headers.
     */
    @Bean
    public ProducerFactory<String, Object> handoffEventProducerFactory(
            KafkaProperties kafkaProperties, ChatProperties chatProperties, ObjectMapper objectMapper) {
        ChatProperties.Kafka kafka = chatProperties.getKafka();
        Map<String, Object> producerConfig = new HashMap<>(kafkaProperties.buildProducerProperties(null));
        producerConfig.putIfAbsent(ProducerConfig.ACKS_CONFIG, "all");
        producerConfig.putIfAbsent(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, true);
        // sends run on the request thread after commit; fail fast when the broker is unreachable
        producerConfig.putIfAbsent(ProducerConfig.MAX_BLOCK_MS_CONFIG, kafka.getMaxBlock().toMillis());

        JsonSerializer<Object> valueSerializer = new JsonSerializer<>(objectMapper);
        valueSerializer.setAddTypeInfo(false);
        return new DefaultKafkaProducerFactory<>(producerConfig, new StringSerializer(), valueSerializer);
    }

    @Bean
    public KafkaTemplate<String, Object> handoffEventKafkaTemplate(
            ProducerFactory<String, Object> handoffEventProducerFactory) {
        return new KafkaTemplate<>(handoffEventProducerFactory);
    }

    @Bean
    public KafkaAdmin.NewTopics handoffTopics(ChatProperties chatProperties) {
        ChatProperties.Kafka kafka = chatProperties.getKafka();
        return new KafkaAdmin.NewTopics(
                TopicBuilder.name(kafka.getLifecycleTopic())
                        .partitions(kafka.getPartitions())
                        .replicas(kafka.getReplicas())
                        .build(),
                TopicBuilder.name(kafka.getMessageTopic())
                        .partitions(kafka.getPartitions())
                        .replicas(kafka.getReplicas())
                        .build());
    }
}
