package com.example.handoff.event;

import com.example.handoff.domain.ChatMessage;
import com.example.handoff.domain.ConversationStatus;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Consumer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

/**
 * Fans events out to every {@link ChatEventListener}. Inside a transaction, delivery waits for the commit so a
 * rolled back change is never announced.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ChatEventPublisher {

    private final List<ChatEventListener> listeners;
    private final Clock clock;

    public void publishConversationEvent(
            ChatEventType type,
            String conversationId,
            ConversationStatus status,
            String operatorId,
            Map<String, Object> details) {
        ConversationEvent event = ConversationEvent.builder()
                .eventId(UUID.randomUUID().toString())
                .type(type)
                .conversationId(conversationId)
                .status(status)
                .operatorId(operatorId)
                .occurredAt(Instant.now(clock))
                .details(details != null ? details : Map.of())
                .build();
        deliverAfterCommit(type.name(), listener -> listener.onConversationEvent(event));
    }

    public void publishMessageAppended(ChatMessage message) {
        MessageAppendedEvent event = MessageAppendedEvent.builder()
                .eventId(UUID.randomUUID().toString())
                .conversationId(message.getConversationId())
                .messageId(message.getId())
                .messageType(message.getType())
                .occurredAt(Instant.now(clock))
                .message(message)
                .build();
        deliverAfterCommit("MESSAGE_APPENDED", listener -> listener.onMessageAppended(event));
    }

    private void deliverAfterCommit(String label, Consumer<ChatEventListener> delivery) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            deliver(label, delivery);
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                deliver(label, delivery);
            }
        });
    }

    private void deliver(String label, Consumer<ChatEventListener> delivery) {
        for (ChatEventListener listener : listeners) {
            try {
                delivery.accept(listener);
            } catch (RuntimeException ex) {
                log.warn("Listener {} failed on {}", listener.getClass().getSimpleName(), label, ex);
            }
        }
    }
}
