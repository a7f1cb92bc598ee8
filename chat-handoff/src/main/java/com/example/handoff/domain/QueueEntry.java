package com.example.handoff.domain;

import java.io.Serializable;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueueEntry implements Serializable {

    private String conversationId;
    private ConversationPriority priority;
    private ConversationStatus status;
    private String assignedOperatorId;
    private Instant queuedAt;
    private Instant claimedAt;
    private Instant resolvedAt;
}
