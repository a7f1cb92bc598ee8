package com.example.handoff.event;

import com.example.handoff.domain.ConversationStatus;
import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * A committed change to a conversation's lifecycle or its recommendation drafts.
 */
@Value
@Builder
public class ConversationEvent {

    String eventId;
    ChatEventType type;
    String conversationId;

    /** Status after the change, when the change moved it. */
    ConversationStatus status;

    /** Operator who caused the change, {@code null} for customer and system actions. */
    String operatorId;

    Instant occurredAt;
    Map<String, Object> details;
}
