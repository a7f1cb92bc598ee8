package com.example.handoff.persistence;

import com.example.handoff.domain.ConversationPriority;
import com.example.handoff.domain.ConversationStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.time.Instant;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@Entity
@Table(
        name = "chat_queue_entries",
        indexes = {
            @Index(name = "chat_queue_entries_order_idx", columnList = "status, priority_weight, queued_at"),
            @Index(name = "chat_queue_entries_queued_idx", columnList = "queued_at")
        })
public class QueueEntryEntity {

    @Id
    @Column(name = "conversation_id", nullable = false, updatable = false, length = 64)
    private String conversationId;

    @Enumerated(EnumType.STRING)
    @Column(name = "priority", nullable = false, length = 16)
    private ConversationPriority priority;

    /**
     * Denormalized {@link ConversationPriority#getWeight()} so the queue can be ordered in the database.
     */
    @Column(name = "priority_weight", nullable = false)
    private int priorityWeight;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 32)
    private ConversationStatus status;

    @Column(name = "assigned_operator_id", length = 128)
    private String assignedOperatorId;

    @Column(name = "queued_at", nullable = false)
    private Instant queuedAt;

    @Column(name = "claimed_at")
    private Instant claimedAt;

    @Column(name = "resolved_at")
    private Instant resolvedAt;
}
