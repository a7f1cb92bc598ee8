package com.example.handoff.persistence;

import com.example.handoff.domain.InputMethod;
import com.example.handoff.domain.MessageType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
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
        name = "chat_messages",
        indexes = {
            @Index(name = "chat_messages_conversation_idx", columnList = "conversation_id, id"),
            @Index(name = "chat_messages_type_idx", columnList = "conversation_id, message_type")
        })
public class MessageEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "conversation_id", nullable = false, updatable = false, length = 64)
    private String conversationId;

    @Enumerated(EnumType.STRING)
    @Column(name = "message_type", nullable = false, updatable = false, length = 32)
    private MessageType type;

    @Column(name = "content", nullable = false, updatable = false, length = 10000)
    private String content;

    @Column(name = "confidence", updatable = false)
    private Double confidence;

    @Column(name = "author_operator_id", updatable = false, length = 128)
    private String authorOperatorId;

    @Column(name = "parent_message_id", updatable = false)
    private Long parentMessageId;

    @Enumerated(EnumType.STRING)
    @Column(name = "input_method", length = 32, updatable = false)
    private InputMethod inputMethod;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
}
