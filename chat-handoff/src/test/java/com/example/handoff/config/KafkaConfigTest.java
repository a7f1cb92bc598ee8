package com.example.handoff.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Duration;
import java.util.Map;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.kafka.KafkaProperties;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;

class KafkaConfigTest {

    private final KafkaConfig kafkaConfig = new KafkaConfig();

    @Test
    void producerFailsFastAndWritesDurably() {
        ChatProperties chatProperties = new ChatProperties();
        chatProperties.getKafka().setMaxBlock(Duration.ofMillis(1500));

        Map<String, Object> config = producerConfig(new KafkaProperties(), chatProperties);

        assertThat(config)
                .containsEntry(ProducerConfig.MAX_BLOCK_MS_CONFIG, 1500L)
                .containsEntry(ProducerConfig.ACKS_CONFIG, "all")
                .containsEntry(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, true);
    }

    @Test
    void explicitProducerPropertiesWin() {
        KafkaProperties kafkaProperties = new KafkaProperties();
        kafkaProperties.getProducer().getProperties().put(ProducerConfig.MAX_BLOCK_MS_CONFIG, "10000");
        kafkaProperties.getProducer().setAcks("1");

        Map<String, Object> config = producerConfig(kafkaProperties, new ChatProperties());

        assertThat(config)
                .containsEntry(ProducerConfig.MAX_BLOCK_MS_CONFIG, "10000")
                .containsEntry(ProducerConfig.ACKS_CONFIG, "1");
    }

    private Map<String, Object> producerConfig(KafkaProperties kafkaProperties, ChatProperties chatProperties) {
        DefaultKafkaProducerFactory<String, Object> factory = (DefaultKafkaProducerFactory<String, Object>)
                kafkaConfig.handoffEventProducerFactory(kafkaProperties, chatProperties, new ObjectMapper());
        return factory.getConfigurationProperties();
    }
}
