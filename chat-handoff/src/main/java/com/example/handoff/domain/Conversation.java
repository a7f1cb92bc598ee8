package com.example.handoff.domain;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Conversation implements Serializable {

    private String id;
    private String sessionToken;
    private ServiceMode serviceMode;
    private ConversationStatus status;
    private ConversationPriority priority;
    private String assignedOperatorId;
    private String userAgent;
    private String ipAddress;
    private Map<String, Object> attributes;
    private Instant createdAt;
    private Instant updatedAt;
    private Instant lastMessageAt;
    private Instant resolvedAt;
    private Long version;
}
