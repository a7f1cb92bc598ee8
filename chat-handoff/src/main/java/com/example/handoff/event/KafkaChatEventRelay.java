package com.example.handoff.event;

import com.example.handoff.config.ChatProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

/**
 * Forwards committed events to Kafka keyed by conversation id, so one conversation stays on one partition.
 * Drafts are operator-side guidance and are not relayed.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "chat.kafka", name = "enabled", havingValue = "true")
public class KafkaChatEventRelay implements ChatEventListener {

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final ChatProperties chatProperties;

    public KafkaChatEventRelay(
            @Qualifier("handoffEventKafkaTemplate") KafkaTemplate<String, Object> kafkaTemplate,
            ChatProperties chatProperties) {
        this.kafkaTemplate = kafkaTemplate;
        this.chatProperties = chatProperties;
    }

    @Override
    public void onConversationEvent(ConversationEvent event) {
        send(chatProperties.getKafka().getLifecycleTopic(), event.getConversationId(), event);
    }

    @Override
    public void onMessageAppended(MessageAppendedEvent event) {
        if (event.isDraft()) {
            return;
        }
        send(chatProperties.getKafka().getMessageTopic(), event.getConversationId(), event);
    }

    private void send(String topic, String key, Object payload) {
        kafkaTemplate.send(topic, key, payload).whenComplete((result, ex) -> {
            if (ex != null) {
                log.warn("Failed to relay event for conversation {} to {}: {}", key, topic, ex.getMessage());
            }
        });
    }
}
