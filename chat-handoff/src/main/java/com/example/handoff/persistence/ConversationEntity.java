package com.example.handoff.persistence;

import com.example.handoff.domain.ConversationPriority;
import com.example.handoff.domain.ConversationStatus;
import com.example.handoff.domain.ServiceMode;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import java.time.Instant;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@Entity
@Table(
        name = "chat_conversations",
        indexes = {
            @Index(name = "chat_conversations_session_idx", columnList = "session_token"),
            @Index(name = "chat_conversations_status_idx", columnList = "status"),
            @Index(name = "chat_conversations_operator_idx", columnList = "assigned_operator_id")
        })
public class ConversationEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false, length = 64)
    private String id;

    @Column(name = "session_token", nullable = false, length = 255)
    private String sessionToken;

    @Enumerated(EnumType.STRING)
    @Column(name = "service_mode", nullable = false, length = 32)
    private ServiceMode serviceMode;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 32)
    private ConversationStatus status;

    @Enumerated(EnumType.STRING)
    @Column(name = "priority", nullable = false, length = 16)
    private ConversationPriority priority;

    @Column(name = "assigned_operator_id", length = 128)
    private String assignedOperatorId;

    @Column(name = "user_agent", length = 512)
    private String userAgent;

    @Column(name = "ip_address", length = 64)
    private String ipAddress;

    @Column(name = "attributes", length = 8000)
    private String attributes;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @Column(name = "last_message_at")
    private Instant lastMessageAt;

    @Column(name = "resolved_at")
    private Instant resolvedAt;

    @Version
    @Column(name = "version")
    private Long version;
}
