package com.example.handoff.event;

import com.example.handoff.domain.ChatMessage;
import com.example.handoff.domain.MessageType;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class MessageAppendedEvent {

    String eventId;
    String conversationId;
    long messageId;
    MessageType messageType;
    Instant occurredAt;
    ChatMessage message;

    public boolean isDraft() {
        return messageType != null && messageType.isDraft();
    }
}
