package com.example.handoff.dto;

import com.example.handoff.domain.ConversationPriority;
import com.example.handoff.domain.ConversationStatus;
import com.example.handoff.domain.ServiceMode;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueueOverviewItem {

    private String conversationId;

    /** Anonymous label derived from the session token. */
    private String displayName;

    private ConversationStatus status;
    private ConversationPriority priority;
    private ServiceMode serviceMode;
    private String assignedOperatorId;
    private Instant queuedAt;
    private long waitMinutes;
    private long messageCount;
    private String lastMessage;
    private Instant lastMessageAt;
}
